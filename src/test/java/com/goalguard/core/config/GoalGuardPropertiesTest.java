package com.goalguard.core.config;

import com.goalguard.core.gate.GateSettings;
import com.goalguard.core.model.ToolKind;
import com.goalguard.core.reflexion.ReflexionSettings;
import com.goalguard.core.scorecard.ScoreComponent;
import com.goalguard.core.scorecard.ScorecardSettings;
import com.goalguard.core.scorecard.WeightProfile;
import com.goalguard.core.walkforward.WalkForwardConfig;
import com.goalguard.core.walkforward.WindowMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GoalGuardPropertiesTest {

    private static GoalGuardProperties bind(Map<String, String> source) {
        Binder binder = new Binder(new MapConfigurationPropertySource(source));
        return binder.bind("goalguard", GoalGuardProperties.class).orElseGet(GoalGuardProperties::new);
    }

    @Test
    @DisplayName("defaults match the built-in settings")
    void defaults() {
        var props = new GoalGuardProperties();

        assertEquals(WalkForwardConfig.defaults(), props.toWalkForwardConfig());
        assertEquals(GateSettings.defaults(), props.toGateSettings());
        assertEquals(ReflexionSettings.defaults(), props.toReflexionSettings());
        assertEquals(ScorecardSettings.defaults(), props.toScorecardSettings());
        assertTrue(props.toWeightProfile().isEmpty());
        assertTrue(props.toolCommands().isEmpty());
        assertEquals(Duration.ofMinutes(5), props.toolTimeout());
        assertFalse(props.isStrictMode());
    }

    @Test
    @DisplayName("binds relaxed property names into settings")
    void bindsSettings() {
        GoalGuardProperties props = bind(Map.of(
                "goalguard.walk-forward.num-windows", "5",
                "goalguard.walk-forward.gap-rows", "2",
                "goalguard.walk-forward.mode", "anchored",
                "goalguard.gates.enable-walk-forward", "true",
                "goalguard.gates.max-drawdown-limit", "0.2",
                "goalguard.reflexion.max-retries", "1",
                "goalguard.strict-mode", "true"));

        WalkForwardConfig wf = props.toWalkForwardConfig();
        assertEquals(5, wf.numWindows());
        assertEquals(2, wf.gapRows());
        assertEquals(WindowMode.ANCHORED, wf.mode());
        assertTrue(props.toGateSettings().enableWalkForward());
        assertEquals(0.2, props.toGateSettings().maxDrawdownLimit());
        assertEquals(1, props.toReflexionSettings().maxRetries());
        assertTrue(props.isStrictMode());
    }

    @Test
    @DisplayName("binds tool commands by kebab-case tool key")
    void bindsToolCommands() {
        GoalGuardProperties props = bind(Map.of(
                "goalguard.tools.timeout-seconds", "30",
                "goalguard.tools.commands.run-tests[0]", "python",
                "goalguard.tools.commands.run-tests[1]", "tools/run_tests.py",
                "goalguard.tools.commands.crv-verify[0]", "crv"));

        Map<ToolKind, List<String>> commands = props.toolCommands();
        assertEquals(List.of("python", "tools/run_tests.py"), commands.get(ToolKind.RUN_TESTS));
        assertEquals(List.of("crv"), commands.get(ToolKind.CRV_VERIFY));
        assertEquals(Duration.ofSeconds(30), props.toolTimeout());
    }

    @Test
    @DisplayName("configured weights become a versioned profile")
    void weightProfile() {
        var props = new GoalGuardProperties();
        props.getScorecard().setWeightProfileVersion("tenant-a");
        props.getScorecard().setWeights(Map.of("d", 0.2, "r", 0.3, "o", 0.1, "p", 0.2, "u", 0.2));

        WeightProfile profile = props.toWeightProfile().orElseThrow();
        assertEquals("tenant-a", profile.version());
        assertEquals(0.3, profile.weight(ScoreComponent.R));
    }

    @Test
    @DisplayName("invalid values fail when converted")
    void invalidValues() {
        var props = new GoalGuardProperties();
        props.getWalkForward().setTrainRatio(1.5);
        assertThrows(IllegalArgumentException.class, props::toWalkForwardConfig);

        props.getScorecard().setWeights(Map.of("d", 1.0));
        assertThrows(IllegalArgumentException.class, props::toWeightProfile);
    }

    @Test
    @DisplayName("tool keys round-trip through their config form")
    void toolKeys() {
        for (ToolKind kind : ToolKind.values()) {
            assertEquals(kind, ToolKind.fromConfigKey(kind.configKey()));
        }
        assertEquals("generate-strategy", ToolKind.GENERATE_STRATEGY.configKey());
    }
}
