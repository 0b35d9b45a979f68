package com.goalguard.core.model;

/**
 * External tools the orchestrator may invoke.
 */
public enum ToolKind {
    GENERATE_STRATEGY,
    BACKTEST,
    RUN_TESTS,
    LINT,
    CRV_VERIFY,
    STRESS_TEST,
    COMMIT;

    /** Lower-case name used for check names and metric tags. */
    public String key() {
        return name().toLowerCase();
    }

    /** Kebab-case name used as the key under {@code goalguard.tools.commands}. */
    public String configKey() {
        return key().replace('_', '-');
    }

    public static ToolKind fromConfigKey(String key) {
        return valueOf(key.trim().replace('-', '_').toUpperCase());
    }
}
