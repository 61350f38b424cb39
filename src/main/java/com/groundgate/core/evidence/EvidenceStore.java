package com.groundgate.core.evidence;

import com.groundgate.core.model.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, content-addressed registry of evidence chunks. The single source of
 * truth for citations.
 * <p>
 * Reads never block. {@link #addChunk} is serialized so several tasks may ingest into
 * one shared store. A chunk is never replaced once stored.
 */
public class EvidenceStore {

    private static final Logger log = LoggerFactory.getLogger(EvidenceStore.class);

    public static final int DEFAULT_TEXT_PREFIX_LENGTH = 4096;
    private static final String ELLIPSIS = "...";
    private static final int ID_HEX_LENGTH = 16;

    private final ConcurrentHashMap<String, Chunk> chunks = new ConcurrentHashMap<>();
    private final List<String> insertionOrder = new ArrayList<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final int textPrefixLength;

    public EvidenceStore() {
        this(DEFAULT_TEXT_PREFIX_LENGTH);
    }

    public EvidenceStore(int textPrefixLength) {
        if (textPrefixLength <= 0) {
            throw new IllegalArgumentException("textPrefixLength must be positive: " + textPrefixLength);
        }
        this.textPrefixLength = textPrefixLength;
    }

    /**
     * Adds a chunk and returns its id. Identical (source, locator, text) input always
     * yields the same id; adding it again is a no-op.
     */
    public String addChunk(String source, String locator, String text) {
        String safeSource = source == null ? "" : source;
        String safeLocator = locator == null ? "" : locator;
        String safeText = text == null ? "" : text;
        String chunkId = idFor(safeSource, safeLocator, safeText);

        writeLock.lock();
        try {
            Chunk existing = chunks.get(chunkId);
            if (existing != null) {
                if (!existing.text().equals(safeText)) {
                    log.warn("Chunk {} already stored with different text beyond the {}-char prefix; keeping original",
                            chunkId, textPrefixLength);
                }
                return chunkId;
            }
            chunks.put(chunkId, new Chunk(chunkId, safeSource, safeLocator, safeText));
            insertionOrder.add(chunkId);
            log.debug("Stored chunk {} from {} at {} ({} chars)", chunkId, safeSource, safeLocator, safeText.length());
            return chunkId;
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<Chunk> getChunk(String chunkId) {
        if (chunkId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(chunks.get(chunkId));
    }

    public boolean hasChunk(String chunkId) {
        return chunkId != null && chunks.containsKey(chunkId);
    }

    /**
     * Returns the chunk text, clipped with a trailing {@code ...} so the result is at
     * most {@code maxLength} characters. Unknown ids yield an empty string.
     */
    public String getQuote(String chunkId, int maxLength) {
        var chunk = getChunk(chunkId);
        if (chunk.isEmpty()) {
            return "";
        }
        String text = chunk.get().text();
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return ELLIPSIS.substring(0, Math.max(0, maxLength));
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    public int size() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    /** Snapshot of all chunks in insertion order. */
    public List<Chunk> chunks() {
        writeLock.lock();
        try {
            return insertionOrder.stream().map(chunks::get).toList();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Computes the id {@link #addChunk} would assign, without storing anything.
     */
    public String idFor(String source, String locator, String text) {
        source = source == null ? "" : source;
        locator = locator == null ? "" : locator;
        text = text == null ? "" : text;
        String prefix = text.length() > textPrefixLength ? text.substring(0, textPrefixLength) : text;
        MessageDigest digest = sha256();
        digest.update(source.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(locator.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(prefix.getBytes(StandardCharsets.UTF_8));
        return "chunk-" + HexFormat.of().formatHex(digest.digest()).substring(0, ID_HEX_LENGTH);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
