package com.goalguard.core.scorecard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Non-compensatory promotion decision over the five DROPS components.
 * <p>
 * The aggregate S is a weighted sum of independently clamped components. Hard blockers are
 * evaluated separately and force {@link DecisionBand#BLOCKED} whatever S is.
 */
public class PromotionScorecard {

    private static final Logger log = LoggerFactory.getLogger(PromotionScorecard.class);

    public static final String MISSING_RUN_IDENTITY = "missing_run_identity";
    public static final String PARITY_CHECK_FAILED = "parity_check_failed";
    public static final String POLICY_BLOCK_REASONS = "policy_block_reasons";
    public static final String LINEAGE_INCOMPLETE = "lineage_incomplete";
    public static final String STARTUP_UNAVAILABLE = "startup_unavailable";
    public static final String CONTRACT_MISMATCH = "contract_mismatch";

    private final ScorecardSettings settings;
    private final WeightProfile profile;

    public PromotionScorecard(ScorecardSettings settings) {
        this(settings, WeightProfile.DROPS_V1);
    }

    public PromotionScorecard(ScorecardSettings settings, WeightProfile profile) {
        this.settings = settings != null ? settings : ScorecardSettings.defaults();
        this.profile = profile != null ? profile : WeightProfile.DROPS_V1;
        if (!WeightProfile.DROPS_V1.equals(this.profile)) {
            log.warn("Scorecard weight profile overridden: {} {} (default {} {})",
                    this.profile.version(), this.profile.weights(),
                    WeightProfile.DROPS_V1.version(), WeightProfile.DROPS_V1.weights());
        }
    }

    /**
     * Returns a scorecard using a tenant-specific weight profile. The override is logged.
     */
    public PromotionScorecard withProfile(WeightProfile tenantProfile) {
        return new PromotionScorecard(settings, tenantProfile);
    }

    public WeightProfile profile() {
        return profile;
    }

    public ReadinessScorecard score(String runId, ReadinessSignals signals) {
        Map<ScoreComponent, Double> components = new EnumMap<>(ScoreComponent.class);
        components.put(ScoreComponent.D, clamp(determinism(signals)));
        components.put(ScoreComponent.R, clamp(risk(signals)));
        components.put(ScoreComponent.O, clamp(ops(signals)));
        components.put(ScoreComponent.P, clamp(policy(signals)));
        components.put(ScoreComponent.U, clamp(user(signals)));

        double raw = 0.0;
        for (ScoreComponent component : ScoreComponent.values()) {
            raw += profile.weight(component) * components.get(component);
        }
        double score = Math.round(raw * 100.0) / 100.0;

        List<String> blockers = blockers(signals);
        DecisionBand scoreBand = band(score);
        DecisionBand decision = blockers.isEmpty() ? scoreBand : DecisionBand.BLOCKED;

        List<NextAction> actions = nextActions(blockers, components);
        String recommendation = recommend(decision, blockers, score);

        log.info("Scorecard for run {}: S={} band={} decision={} blockers={}",
                runId, score, scoreBand, decision, blockers);
        return new ReadinessScorecard(runId, components, profile.version(), score, decision, scoreBand,
                blockers, actions, recommendation);
    }

    DecisionBand band(double score) {
        if (score >= settings.greenThreshold()) {
            return DecisionBand.GREEN;
        }
        if (score >= settings.amberThreshold()) {
            return DecisionBand.AMBER;
        }
        return DecisionBand.RED;
    }

    // ── Components ───────────────────────────────────────────────────

    private static double determinism(ReadinessSignals s) {
        double score = 100;
        if (!s.parityChecked() || !s.parityPassed()) {
            score -= 50;
        }
        if (!s.runIdentityPresent()) {
            score -= 30;
        }
        return score;
    }

    private static double risk(ReadinessSignals s) {
        double score = 100;
        if (!s.riskMetricsComplete()) {
            score -= 40;
        }
        if (!s.crvAvailable()) {
            score -= 40;
        }
        if (!s.validationPassed()) {
            score -= 40;
        }
        return score;
    }

    private static double ops(ReadinessSignals s) {
        double score = switch (s.startupStatus()) {
            case HEALTHY -> 100;
            case DEGRADED -> 60;
            case UNAVAILABLE -> 0;
        };
        score -= 10 * s.startupReasons().size();
        if (s.evidenceStale()) {
            score -= 20;
        }
        if (s.environmentCaveat() != null && !s.environmentCaveat().isBlank()) {
            score -= 10;
        }
        return score;
    }

    private static double policy(ReadinessSignals s) {
        double score = 100 - 50 * s.policyBlockReasons().size();
        if (!s.lineageComplete()) {
            score -= 30;
        }
        return score;
    }

    private static double user(ReadinessSignals s) {
        double score = 100;
        if (s.contractMismatch()) {
            score -= 50;
        }
        if (!s.maturityLabelVisible()) {
            score -= 30;
        }
        score -= switch (s.evidenceClassification()) {
            case GREEN -> 0;
            case AMBER -> 10;
            case RED -> 30;
        };
        return score;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    // ── Blockers and actions ─────────────────────────────────────────

    static List<String> blockers(ReadinessSignals s) {
        List<String> blockers = new ArrayList<>();
        if (!s.runIdentityPresent()) {
            blockers.add(MISSING_RUN_IDENTITY);
        }
        if (s.parityChecked() && !s.parityPassed()) {
            blockers.add(PARITY_CHECK_FAILED);
        }
        if (!s.policyBlockReasons().isEmpty()) {
            blockers.add(POLICY_BLOCK_REASONS);
        }
        if (!s.lineageComplete()) {
            blockers.add(LINEAGE_INCOMPLETE);
        }
        if (s.startupStatus() == StartupStatus.UNAVAILABLE) {
            blockers.add(STARTUP_UNAVAILABLE);
        }
        if (s.contractMismatch()) {
            blockers.add(CONTRACT_MISMATCH);
        }
        return blockers;
    }

    private static List<NextAction> nextActions(List<String> blockers, Map<ScoreComponent, Double> components) {
        List<NextAction> actions = new ArrayList<>();
        for (String blocker : blockers) {
            actions.add(new NextAction(actions.size() + 1, blocker, blockerAction(blocker)));
        }
        components.entrySet().stream()
                .filter(e -> e.getValue() < 100.0)
                .sorted(Map.Entry.<ScoreComponent, Double>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> actions.add(new NextAction(actions.size() + 1, e.getKey().name(),
                        componentAction(e.getKey(), e.getValue()))));
        if (actions.isEmpty()) {
            actions.add(new NextAction(1, "promotion", "Promote: every readiness dimension is satisfied"));
        }
        return actions;
    }

    private static String blockerAction(String blocker) {
        return switch (blocker) {
            case MISSING_RUN_IDENTITY -> "Attach a run identity and strategy artifact to the evidence";
            case PARITY_CHECK_FAILED -> "Fix non-determinism until reruns reproduce the baseline";
            case POLICY_BLOCK_REASONS -> "Resolve the critical policy violations";
            case LINEAGE_INCOMPLETE -> "Re-run the missing pipeline steps so every artifact is linked";
            case STARTUP_UNAVAILABLE -> "Restore the unavailable runtime dependencies";
            case CONTRACT_MISMATCH -> "Regenerate the strategy with the requested parameters";
            default -> "Resolve " + blocker;
        };
    }

    private static String componentAction(ScoreComponent component, double value) {
        String action = switch (component) {
            case D -> "Run the determinism check and confirm parity";
            case R -> "Complete risk metrics and pass cross-run verification";
            case O -> "Clear operational caveats and refresh stale evidence";
            case P -> "Resolve policy findings and complete lineage";
            case U -> "Fix contract mismatches and strengthen evidence classification";
        };
        return String.format(Locale.ROOT, "%s (%s at %.0f)", action, component.label(), value);
    }

    private static String recommend(DecisionBand decision, List<String> blockers, double score) {
        return switch (decision) {
            case BLOCKED -> "Promotion blocked by " + String.join(", ", blockers);
            case GREEN -> String.format(Locale.ROOT, "Ready for promotion (S=%.2f)", score);
            case AMBER -> String.format(Locale.ROOT, "Promote with caution after addressing next actions (S=%.2f)", score);
            case RED -> String.format(Locale.ROOT, "Not ready for promotion (S=%.2f)", score);
        };
    }
}
