package com.jreinhal.haven.service;

import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.model.Village;
import com.jreinhal.haven.repository.CaseRecordRepository;
import com.jreinhal.haven.repository.UserRepository;
import com.jreinhal.haven.repository.VillageRepository;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

@Service
public class VillageService {
    private static final Logger log = LoggerFactory.getLogger(VillageService.class);
    private final VillageRepository villageRepository;
    private final UserRepository userRepository;
    private final CaseRecordRepository caseRecordRepository;

    public VillageService(VillageRepository villageRepository, UserRepository userRepository, CaseRecordRepository caseRecordRepository) {
        this.villageRepository = villageRepository;
        this.userRepository = userRepository;
        this.caseRecordRepository = caseRecordRepository;
    }

    public List<Village> listVillages() {
        return villageRepository.findAll(Sort.by(Sort.Direction.ASC, "name"));
    }

    public Village getVillage(String id) {
        return requireVillage(id);
    }

    public Village createVillage(VillagePayload payload) {
        if (payload == null) {
            throw HavenException.invalidArgument("Village payload is required");
        }
        String name = requireName(payload.name());
        if (villageRepository.existsByName(name)) {
            throw HavenException.conflict("Village with name \"" + name + "\" already exists");
        }
        Village saved = villageRepository.save(new Village(name, trim(payload.location()), trim(payload.description())));
        log.info("Village created: {}", saved.getName());
        return saved;
    }

    public Village updateVillage(String id, VillagePayload payload) {
        Village village = requireVillage(id);
        if (payload == null) {
            return village;
        }
        if (payload.name() != null) {
            String name = requireName(payload.name());
            villageRepository.findByName(name)
                    .filter(other -> !other.getId().equals(village.getId()))
                    .ifPresent(other -> {
                        throw HavenException.conflict("Village with name \"" + name + "\" already exists");
                    });
            village.setName(name);
        }
        if (payload.location() != null) {
            village.setLocation(trim(payload.location()));
        }
        if (payload.description() != null) {
            village.setDescription(trim(payload.description()));
        }
        village.setUpdatedAt(Instant.now());
        return villageRepository.save(village);
    }

    /**
     * Refused while any user or report still references the village.
     */
    public void deleteVillage(String id) {
        Village village = requireVillage(id);
        if (userRepository.existsByVillageId(village.getId())) {
            throw HavenException.conflict("Cannot delete village \"" + village.getName() + "\". Users are still assigned to it.");
        }
        if (caseRecordRepository.existsByVillageId(village.getId())) {
            throw HavenException.conflict("Cannot delete village \"" + village.getName() + "\". Reports still reference it.");
        }
        villageRepository.delete(village);
        log.info("Village deleted: {}", village.getName());
    }

    private Village requireVillage(String id) {
        if (id == null || id.isBlank()) {
            throw HavenException.notFound("Village not found");
        }
        return villageRepository.findById(id).orElseThrow(() -> HavenException.notFound("Village not found"));
    }

    private static String requireName(String raw) {
        String name = trim(raw);
        if (name == null || name.isEmpty()) {
            throw HavenException.invalidArgument("Village name is required");
        }
        return name;
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    public record VillagePayload(String name, String location, String description) {
    }
}
