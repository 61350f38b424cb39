package com.groundgate.dispatch.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.groundgate.core.model.Citation;
import com.groundgate.core.model.Claim;
import com.groundgate.core.model.EvidenceLink;

import java.util.List;

/**
 * JSON document read by {@code groundgate verify}: evidence chunks to ingest, the answer
 * under test, its citations and, optionally, claims with their evidence links.
 * <p>
 * A citation points at a chunk either by {@code chunk_id} or by {@code chunk_index}
 * into {@code chunks}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceBundle(
    @JsonProperty("chunks") List<BundleChunk> chunks,
    @JsonProperty("answer") String answer,
    @JsonProperty("citations") List<BundleCitation> citations,
    @JsonProperty("claims") List<BundleClaim> claims,
    @JsonProperty("evidence") List<BundleEvidence> evidence
) {

    public EvidenceBundle {
        chunks = chunks == null ? List.of() : chunks;
        answer = answer == null ? "" : answer;
        citations = citations == null ? List.of() : citations;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BundleChunk(
        @JsonProperty("source") String source,
        @JsonProperty("locator") String locator,
        @JsonProperty("text") String text
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BundleCitation(
        @JsonProperty("chunk_id") String chunkId,
        @JsonProperty("chunk_index") Integer chunkIndex,
        @JsonProperty("source") String source,
        @JsonProperty("locator") String locator,
        @JsonProperty("quote") String quote
    ) {

        /**
         * @param chunkIds ids assigned to {@code chunks}, in bundle order
         */
        Citation toCitation(List<String> chunkIds) {
            String id = chunkId;
            if ((id == null || id.isEmpty()) && chunkIndex != null
                    && chunkIndex >= 0 && chunkIndex < chunkIds.size()) {
                id = chunkIds.get(chunkIndex);
            }
            return new Citation(id, source, locator, quote);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BundleClaim(
        @JsonProperty("claim_id") String claimId,
        @JsonProperty("text") String text
    ) {
        Claim toClaim() {
            return new Claim(claimId, text);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BundleEvidence(
        @JsonProperty("claim_id") String claimId,
        @JsonProperty("chunk_id") String chunkId
    ) {
        EvidenceLink toLink() {
            return new EvidenceLink(claimId, chunkId);
        }
    }

    List<Claim> claimList() {
        return claims == null ? null : claims.stream().map(BundleClaim::toClaim).toList();
    }

    List<EvidenceLink> evidenceList() {
        return evidence == null ? null : evidence.stream().map(BundleEvidence::toLink).toList();
    }
}
