package com.goalguard.core.reflexion;

import com.goalguard.core.gate.DevGate;
import com.goalguard.core.gate.GateResult;
import com.goalguard.core.gate.ProductGate;
import com.goalguard.core.model.FailureLocus;

/**
 * Failure classes recognised by reflexion, declared in classification priority order.
 * Each is keyed by the gate check whose failure identifies it.
 */
public enum FailureType {

    TEST_FAILURE(DevGate.UNIT_TESTS, FailureLocus.VERIFICATION),
    DETERMINISM_FAILURE(DevGate.DETERMINISM, FailureLocus.VERIFICATION),
    LINT_FAILURE(DevGate.LINT, FailureLocus.VERIFICATION),
    CRV_FAILURE(ProductGate.CRV, FailureLocus.DESIGN),
    WALK_FORWARD_FAILURE(ProductGate.WALK_FORWARD, FailureLocus.DESIGN),
    STRESS_FAILURE(ProductGate.STRESS_TEST, FailureLocus.DESIGN),
    GENERATION_FAILURE(FailureChecks.GENERATE_STRATEGY_INVOCATION, FailureLocus.DESIGN),
    BACKTEST_FAILURE(FailureChecks.BACKTEST_INVOCATION, FailureLocus.DESIGN),
    COMMIT_FAILURE(FailureChecks.COMMIT_INVOCATION, FailureLocus.VERIFICATION),
    SCORECARD_BLOCKED(FailureChecks.PROMOTION_BLOCKERS, FailureLocus.VERIFICATION),
    UNKNOWN(null, FailureLocus.DESIGN);

    private final String checkName;
    private final FailureLocus locus;

    FailureType(String checkName, FailureLocus locus) {
        this.checkName = checkName;
        this.locus = locus;
    }

    public String checkName() {
        return checkName;
    }

    public FailureLocus locus() {
        return locus;
    }

    public String key() {
        return name().toLowerCase();
    }

    /**
     * Returns the first failure type, in declaration order, whose check failed.
     */
    public static FailureType classify(GateResult result) {
        if (result == null) {
            return UNKNOWN;
        }
        for (FailureType type : values()) {
            if (type.checkName != null && result.failed(type.checkName)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
