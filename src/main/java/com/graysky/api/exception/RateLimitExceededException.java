package com.graysky.api.exception;

import lombok.Getter;

/**
 * A visitor with the same name signed the welcome book inside the rate-limit window.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String visitorName;

    public RateLimitExceededException(String visitorName) {
        super("Rate limit exceeded. Please wait at least one hour between visits.");
        this.visitorName = visitorName;
    }
}
