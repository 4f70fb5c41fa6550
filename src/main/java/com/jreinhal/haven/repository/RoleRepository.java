package com.jreinhal.haven.repository;

import com.jreinhal.haven.model.CaseTier;
import com.jreinhal.haven.model.Role;
import java.util.List;
import java.util.Optional;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RoleRepository extends MongoRepository<Role, String> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);

    /**
     * Roles of a given structural tier, e.g. every oversight role for urgent alerts.
     */
    List<Role> findByTier(CaseTier tier);
}
