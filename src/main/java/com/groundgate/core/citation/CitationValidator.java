package com.groundgate.core.citation;

import com.groundgate.core.evidence.EvidenceStore;
import com.groundgate.core.model.Chunk;
import com.groundgate.core.model.Citation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves agent citations against the {@link EvidenceStore}.
 * <p>
 * For each citation, in order:
 * <ol>
 *   <li>blank chunk id: dropped with {@code citation_missing_chunk_id}</li>
 *   <li>chunk id unknown to the store: dropped with {@code chunk_not_in_evidence_store:<id>}</li>
 *   <li>source, locator and quote rewritten from the stored chunk; dropped with
 *       {@code citation_not_relevant:<id>} when the answer/chunk overlap is below threshold</li>
 * </ol>
 * Dropping every citation is a normal outcome, never an exception.
 */
public class CitationValidator {

    private static final Logger log = LoggerFactory.getLogger(CitationValidator.class);

    public static final String MISSING_CHUNK_ID = "citation_missing_chunk_id";
    public static final String NOT_IN_STORE_PREFIX = "chunk_not_in_evidence_store:";
    public static final String NOT_RELEVANT_PREFIX = "citation_not_relevant:";

    public static final double DEFAULT_RELEVANCE_THRESHOLD = 0.1;
    public static final int DEFAULT_QUOTE_MAX_LENGTH = 200;

    private final EvidenceStore evidenceStore;
    private final double relevanceThreshold;
    private final int quoteMaxLength;

    public CitationValidator(EvidenceStore evidenceStore) {
        this(evidenceStore, DEFAULT_RELEVANCE_THRESHOLD, DEFAULT_QUOTE_MAX_LENGTH);
    }

    public CitationValidator(EvidenceStore evidenceStore, double relevanceThreshold, int quoteMaxLength) {
        if (relevanceThreshold < 0.0 || relevanceThreshold > 1.0) {
            throw new IllegalArgumentException("relevanceThreshold must be within [0, 1]: " + relevanceThreshold);
        }
        if (quoteMaxLength <= 0) {
            throw new IllegalArgumentException("quoteMaxLength must be positive: " + quoteMaxLength);
        }
        this.evidenceStore = evidenceStore;
        this.relevanceThreshold = relevanceThreshold;
        this.quoteMaxLength = quoteMaxLength;
    }

    public CitationValidation validate(String answer, List<Citation> citations) {
        if (citations == null || citations.isEmpty()) {
            return new CitationValidation(List.of(), List.of());
        }

        var answerTokens = RelevanceScorer.tokenize(answer);
        var valid = new ArrayList<Citation>();
        var warnings = new ArrayList<String>();

        for (Citation citation : citations) {
            String chunkId = citation == null ? null : citation.chunkId();
            if (chunkId == null || chunkId.isBlank()) {
                warnings.add(MISSING_CHUNK_ID);
                continue;
            }

            Optional<Chunk> resolved = evidenceStore.getChunk(chunkId);
            if (resolved.isEmpty()) {
                warnings.add(NOT_IN_STORE_PREFIX + chunkId);
                continue;
            }

            Chunk chunk = resolved.get();
            double score = RelevanceScorer.overlap(answerTokens, RelevanceScorer.tokenize(chunk.text()));
            if (score < relevanceThreshold) {
                log.debug("Citation {} dropped: overlap {} below {}", chunkId,
                        String.format("%.3f", score), relevanceThreshold);
                warnings.add(NOT_RELEVANT_PREFIX + chunkId);
                continue;
            }

            valid.add(new Citation(chunk.chunkId(), chunk.source(), chunk.locator(),
                    evidenceStore.getQuote(chunkId, quoteMaxLength)));
        }

        if (!warnings.isEmpty()) {
            log.info("Citation validation kept {}/{} citations: {}", valid.size(), citations.size(), warnings);
        }
        return new CitationValidation(valid, warnings);
    }

    /** Relevance score used for the threshold check, exposed for diagnostics. */
    public double relevance(String answer, String chunkText) {
        return RelevanceScorer.overlap(answer, chunkText);
    }

    public double relevanceThreshold() {
        return relevanceThreshold;
    }
}
