package com.jreinhal.haven.repository;

import com.jreinhal.haven.model.User;
import com.jreinhal.haven.model.UserStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for user persistence in MongoDB.
 */
@Repository
public interface UserRepository extends MongoRepository<User, String> {

    /**
     * Exact, case-sensitive email lookup.
     */
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    List<User> findByStatus(UserStatus status);

    /**
     * Number of users holding a role. Drives the role-deletion guard.
     */
    long countByRoleId(String roleId);

    boolean existsByVillageId(String villageId);

    /**
     * Approved members of any of the given roles.
     */
    List<User> findByRoleIdInAndStatus(Collection<String> roleIds, UserStatus status);
}
