package com.jreinhal.haven.repository;

import com.jreinhal.haven.model.Village;
import java.util.Optional;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VillageRepository extends MongoRepository<Village, String> {

    Optional<Village> findByName(String name);

    boolean existsByName(String name);
}
