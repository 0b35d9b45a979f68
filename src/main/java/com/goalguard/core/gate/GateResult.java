package com.goalguard.core.gate;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Complete outcome of one gate evaluation. Every check the gate defines is present in
 * {@code checks}, in evaluation order, even when an earlier check failed.
 *
 * @param gateName gate that produced this result
 * @param checks   check name to pass/fail, in evaluation order
 * @param details  structured detail per check name
 * @param errors   human-readable diagnostics, one per failed check
 * @param passed   whether every check passed
 */
public record GateResult(
    String gateName,
    Map<String, Boolean> checks,
    Map<String, Object> details,
    List<String> errors,
    boolean passed
) implements Serializable {

    public GateResult {
        checks = checks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<String> failedChecks() {
        return checks.entrySet().stream()
                .filter(e -> !e.getValue())
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean failed(String checkName) {
        return Boolean.FALSE.equals(checks.get(checkName));
    }

    public <T> Optional<T> detail(String checkName, Class<T> type) {
        Object value = details.get(checkName);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /**
     * A result for a failure outside any gate, such as a strategy generation error or a blocked
     * promotion, so reflexion always receives the same shape of input.
     */
    public static GateResult synthetic(String gateName, String checkName, String error, Object detail) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(checkName, false);
        Map<String, Object> details = new LinkedHashMap<>();
        if (detail != null) {
            details.put(checkName, detail);
        }
        return new GateResult(gateName, checks, details, List.of(checkName + ": " + error), false);
    }
}
