package com.deals.collector.service;

import lombok.Getter;

/**
 * The atomic commit of a generation failed and was rolled back. The previous generation stays current.
 */
@Getter
public class CommitFailureException extends RuntimeException {

    private final String generationId;

    public CommitFailureException(String generationId, String message) {
        super(message);
        this.generationId = generationId;
    }

    public CommitFailureException(String generationId, String message, Throwable cause) {
        super(message, cause);
        this.generationId = generationId;
    }
}
