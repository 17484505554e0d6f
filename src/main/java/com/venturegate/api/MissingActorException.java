package com.venturegate.api;

/**
 * Thrown when a request arrives without the {@code X-Actor-Id} header set by the
 * authenticating proxy.
 */
public class MissingActorException extends RuntimeException {

    public MissingActorException() {
        super(ActorHeader.NAME + " header is required");
    }
}
