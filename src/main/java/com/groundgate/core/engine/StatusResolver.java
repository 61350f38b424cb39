package com.groundgate.core.engine;

import com.groundgate.core.citation.CitationValidation;
import com.groundgate.core.citation.CitationValidator;
import com.groundgate.core.model.AgentResult;
import com.groundgate.core.model.ProposedStatus;
import com.groundgate.core.model.ResolvedStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the authoritative status of an agent attempt. The agent's own status can
 * only lower the outcome, never raise it.
 * <ol>
 *   <li>blank answer: {@code FAIL} with {@code empty_answer}; nothing else is checked</li>
 *   <li>no citation survives validation: {@code PARTIAL} with the validator's warnings,
 *       or {@code no_valid_citations} when the agent cited nothing</li>
 *   <li>otherwise {@code SUCCESS}</li>
 *   <li>agent said {@code fail} but the output is usable: floored at {@code PARTIAL}
 *       with {@code agent_reported_fail_but_output_valid}</li>
 * </ol>
 */
public class StatusResolver {

    private static final Logger log = LoggerFactory.getLogger(StatusResolver.class);

    public static final String EMPTY_ANSWER = "empty_answer";
    public static final String NO_VALID_CITATIONS = "no_valid_citations";
    public static final String AGENT_REPORTED_FAIL = "agent_reported_fail_but_output_valid";

    private final CitationValidator citationValidator;

    public StatusResolver(CitationValidator citationValidator) {
        this.citationValidator = citationValidator;
    }

    public StatusResolution resolve(AgentResult result) {
        String answer = result.answer();
        if (answer == null || answer.isBlank()) {
            log.info("Attempt resolved to FAIL: empty answer");
            return new StatusResolution(ResolvedStatus.FAIL, List.of(EMPTY_ANSWER), List.of());
        }

        CitationValidation validation = citationValidator.validate(answer, result.citations());
        var warnings = new ArrayList<>(validation.warnings());

        ResolvedStatus status;
        if (validation.hasValidCitations()) {
            status = ResolvedStatus.SUCCESS;
        } else {
            if (result.citations().isEmpty()) {
                warnings.add(NO_VALID_CITATIONS);
            }
            status = ResolvedStatus.PARTIAL;
        }

        if (result.proposedStatus() == ProposedStatus.FAIL) {
            warnings.add(AGENT_REPORTED_FAIL);
            status = ResolvedStatus.PARTIAL;
        }

        if (status != ResolvedStatus.SUCCESS) {
            log.info("Attempt downgraded to {} (agent proposed {}): {}", status, result.proposedStatus(), warnings);
        }
        return new StatusResolution(status, warnings, validation.valid());
    }
}
