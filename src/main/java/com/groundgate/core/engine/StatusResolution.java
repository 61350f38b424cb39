package com.groundgate.core.engine;

import com.groundgate.core.model.Citation;
import com.groundgate.core.model.ResolvedStatus;

import java.util.List;

/**
 * Engine-computed status of one attempt, the warnings that justify it, and the
 * citations that survived validation.
 */
public record StatusResolution(
    ResolvedStatus status,
    List<String> warnings,
    List<Citation> validCitations
) {

    public StatusResolution {
        warnings = List.copyOf(warnings);
        validCitations = List.copyOf(validCitations);
    }
}
