package com.venturegate.approval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Static actor roles and reviewer delegations, standing in for the external identity provider.
 */
@Component
@ConfigurationProperties(prefix = "venturegate.actors")
public class ActorProperties {

    /** actorId to roles, e.g. {@code admin}, {@code senior_consultant}. */
    private Map<String, List<String>> roles = new HashMap<>();

    /** ownerId to the actor ids allowed to review that owner's requests. */
    private Map<String, List<String>> reviewers = new HashMap<>();

    public Map<String, List<String>> getRoles() {
        return roles;
    }

    public void setRoles(Map<String, List<String>> roles) {
        this.roles = roles;
    }

    public Map<String, List<String>> getReviewers() {
        return reviewers;
    }

    public void setReviewers(Map<String, List<String>> reviewers) {
        this.reviewers = reviewers;
    }
}
