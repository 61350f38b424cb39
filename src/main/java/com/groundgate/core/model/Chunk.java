package com.groundgate.core.model;

import java.io.Serializable;

/**
 * An immutable, content-addressed span of source text held by the evidence store.
 *
 * @param chunkId stable id derived from source, locator and text
 * @param source  where the text came from (e.g. "pdf", "web", "pubmed")
 * @param locator position inside the source (e.g. "section:Results;page:5")
 * @param text    the evidence text itself
 */
public record Chunk(
    String chunkId,
    String source,
    String locator,
    String text
) implements Serializable {}
