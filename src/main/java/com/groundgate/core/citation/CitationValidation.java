package com.groundgate.core.citation;

import com.groundgate.core.model.Citation;

import java.util.List;

/**
 * Output of {@link CitationValidator#validate}: the citations that survived, with
 * store-authoritative fields, and one warning per dropped citation.
 */
public record CitationValidation(List<Citation> valid, List<String> warnings) {

    public CitationValidation {
        valid = List.copyOf(valid);
        warnings = List.copyOf(warnings);
    }

    public boolean hasValidCitations() {
        return !valid.isEmpty();
    }
}
