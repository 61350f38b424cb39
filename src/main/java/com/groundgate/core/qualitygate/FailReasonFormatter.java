package com.groundgate.core.qualitygate;

import com.groundgate.core.model.FailReason;

import java.util.List;

/**
 * Human-readable rendering of fail reasons for logs and the CLI.
 */
public final class FailReasonFormatter {

    private FailReasonFormatter() {}

    public static String format(List<FailReason> reasons) {
        if (reasons == null || reasons.isEmpty()) {
            return "No issues detected.";
        }
        var sb = new StringBuilder("Quality Gate Issues:");
        for (FailReason r : reasons) {
            sb.append('\n')
              .append("  ")
              .append(r.isError() ? "[x]" : "[!]")
              .append(" [").append(r.code().name()).append("] ")
              .append(r.message());
        }
        return sb.toString();
    }
}
