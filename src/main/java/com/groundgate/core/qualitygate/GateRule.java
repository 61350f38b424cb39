package com.groundgate.core.qualitygate;

import com.groundgate.core.model.FailCode;
import com.groundgate.core.model.Severity;

import java.util.regex.Pattern;

/**
 * One pattern-matching rule applied to answer text.
 *
 * @param pattern  compiled pattern; every match counts once
 * @param code     fail code raised when the pattern matches
 * @param severity severity of the raised fail reason
 * @param redact   when true, matched text is never echoed into messages
 */
public record GateRule(Pattern pattern, FailCode code, Severity severity, boolean redact) {

    public static GateRule warning(String regex, FailCode code) {
        return new GateRule(Pattern.compile(regex), code, Severity.WARNING, false);
    }

    public static GateRule redactedError(String regex, FailCode code) {
        return new GateRule(Pattern.compile(regex), code, Severity.ERROR, true);
    }
}
