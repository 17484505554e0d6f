package com.venturegate.approval;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class ActorDirectory {

    private final ActorProperties properties;

    public ActorDirectory(ActorProperties properties) {
        this.properties = properties;
    }

    public List<String> rolesOf(String actorId) {
        return properties.getRoles().getOrDefault(actorId, List.of());
    }

    public boolean hasAnyRole(String actorId, Collection<String> roles) {
        return rolesOf(actorId).stream().anyMatch(roles::contains);
    }

    /** The owner, or a reviewer the owner has delegated to. */
    public boolean canReview(String actorId, String ownerId) {
        if (actorId == null || ownerId == null) {
            return false;
        }
        return actorId.equals(ownerId)
            || properties.getReviewers().getOrDefault(ownerId, List.of()).contains(actorId);
    }
}
