package com.groundgate.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One coded reason why an answer did not cleanly pass the quality gate.
 */
public record FailReason(
    FailCode code,
    String message,
    Severity severity
) implements Serializable {

    public static FailReason error(FailCode code, String message) {
        return new FailReason(code, message, Severity.ERROR);
    }

    public static FailReason warning(FailCode code, String message) {
        return new FailReason(code, message, Severity.WARNING);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code.name());
        map.put("msg", message);
        map.put("severity", severity.wireName());
        return map;
    }
}
