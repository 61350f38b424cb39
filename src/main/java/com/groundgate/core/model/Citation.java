package com.groundgate.core.model;

import java.io.Serializable;

/**
 * An agent's claim that a chunk supports part of its answer.
 * <p>
 * Only {@link #chunkId} is meaningful on input. {@code source}, {@code locator} and
 * {@code quote} are overwritten from the resolved {@link Chunk} during validation.
 */
public record Citation(
    String chunkId,
    String source,
    String locator,
    String quote
) implements Serializable {

    public static Citation of(String chunkId) {
        return new Citation(chunkId, null, null, null);
    }

    public Locator parsedLocator() {
        return Locator.parse(locator);
    }
}
