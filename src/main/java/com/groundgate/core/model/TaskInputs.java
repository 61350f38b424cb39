package com.groundgate.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Category-specific task inputs. One record per {@link TaskCategory}.
 */
public sealed interface TaskInputs extends Serializable
        permits TaskInputs.Generic, TaskInputs.PaperSurvey, TaskInputs.ClaimReview {

    TaskCategory category();

    /** Free-form question answered from the evidence store. */
    record Generic(String query) implements TaskInputs {
        @Override
        public TaskCategory category() {
            return TaskCategory.GENERIC;
        }
    }

    /**
     * Literature survey on a topic.
     *
     * @param query     search query
     * @param maxPapers upper bound on papers to consider
     * @param yearFrom  earliest publication year, or {@code null} for no bound
     */
    record PaperSurvey(String query, int maxPapers, Integer yearFrom) implements TaskInputs {
        @Override
        public TaskCategory category() {
            return TaskCategory.PAPER_SURVEY;
        }
    }

    /** Check a fixed list of claims against the evidence. */
    record ClaimReview(List<Claim> claims) implements TaskInputs {
        public ClaimReview {
            claims = claims == null ? List.of() : List.copyOf(claims);
        }

        @Override
        public TaskCategory category() {
            return TaskCategory.CLAIM_REVIEW;
        }
    }
}
