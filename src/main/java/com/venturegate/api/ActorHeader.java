package com.venturegate.api;

final class ActorHeader {

    static final String NAME = "X-Actor-Id";

    private ActorHeader() {
    }

    static String require(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new MissingActorException();
        }
        return actorId.trim();
    }
}
