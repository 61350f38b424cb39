package com.groundgate.core.model;

/**
 * Closed vocabulary of failure codes shared by the quality gate, the retry
 * policy and external tooling. The constant names are a wire contract.
 */
public enum FailCode {
    CITATION_MISSING(Category.GROUNDING),
    LOCATOR_MISSING(Category.GROUNDING),
    EVIDENCE_WEAK(Category.QUALITY),
    ASSERTION_DANGER(Category.QUALITY),
    PII_DETECTED(Category.SAFETY),
    FETCH_FAIL(Category.INFRASTRUCTURE),
    INDEX_MISSING(Category.INFRASTRUCTURE),
    BUDGET_EXCEEDED(Category.INFRASTRUCTURE),
    VERIFY_NOT_RUN(Category.VERIFICATION);

    /**
     * Failure families. Grounding and quality failures can be remediated by another
     * attempt; safety and infrastructure failures end the task.
     */
    public enum Category {
        GROUNDING,
        QUALITY,
        SAFETY,
        INFRASTRUCTURE,
        VERIFICATION
    }

    private final Category category;

    FailCode(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean isTerminal() {
        return category == Category.SAFETY || category == Category.INFRASTRUCTURE;
    }
}
