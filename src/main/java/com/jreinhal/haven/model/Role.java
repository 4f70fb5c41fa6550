package com.jreinhal.haven.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Administrator-defined, named set of permissions.
 *
 * Permissions are a set in the domain; they are persisted as a sorted list so that
 * stored documents and issued tokens are deterministic.
 */
@Document(collection = "roles")
public class Role {

    @Id
    private String id;

    @Indexed(unique = true)
    private String name;

    private String description;

    private List<String> permissions = new ArrayList<>();

    private CaseTier tier = CaseTier.REVIEWER;

    private Instant createdAt;

    private Instant updatedAt;

    public Role() {
    }

    public Role(String name, String description, Collection<String> permissions, CaseTier tier) {
        this.name = name;
        this.description = description;
        setPermissions(permissions);
        this.tier = tier != null ? tier : CaseTier.REVIEWER;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Set<String> getPermissions() {
        if (permissions == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
    }

    /**
     * Replace the permission set. Duplicates collapse and order is normalized.
     */
    public void setPermissions(Collection<String> permissions) {
        this.permissions = permissions == null ? new ArrayList<>() : new ArrayList<>(new TreeSet<>(permissions));
    }

    public boolean hasPermission(String permission) {
        return permissions != null && permissions.contains(permission);
    }

    public CaseTier getTier() {
        return tier;
    }

    public void setTier(CaseTier tier) {
        this.tier = tier;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
