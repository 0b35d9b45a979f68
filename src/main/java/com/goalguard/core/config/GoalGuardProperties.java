package com.goalguard.core.config;

import com.goalguard.core.gate.GateSettings;
import com.goalguard.core.model.ToolKind;
import com.goalguard.core.reflexion.ReflexionSettings;
import com.goalguard.core.scorecard.ScoreComponent;
import com.goalguard.core.scorecard.ScorecardSettings;
import com.goalguard.core.scorecard.WeightProfile;
import com.goalguard.core.walkforward.WalkForwardConfig;
import com.goalguard.core.walkforward.WindowMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binds the {@code goalguard.*} properties and converts them into the immutable settings
 * records the core components are built from.
 */
@Component
@ConfigurationProperties(prefix = "goalguard")
public class GoalGuardProperties {

    private WalkForward walkForward = new WalkForward();
    private Gates gates = new Gates();
    private Reflexion reflexion = new Reflexion();
    private Scorecard scorecard = new Scorecard();
    private Tools tools = new Tools();
    private boolean strictMode = false;

    public WalkForward getWalkForward() { return walkForward; }
    public void setWalkForward(WalkForward walkForward) { this.walkForward = walkForward; }
    public Gates getGates() { return gates; }
    public void setGates(Gates gates) { this.gates = gates; }
    public Reflexion getReflexion() { return reflexion; }
    public void setReflexion(Reflexion reflexion) { this.reflexion = reflexion; }
    public Scorecard getScorecard() { return scorecard; }
    public void setScorecard(Scorecard scorecard) { this.scorecard = scorecard; }
    public Tools getTools() { return tools; }
    public void setTools(Tools tools) { this.tools = tools; }
    public boolean isStrictMode() { return strictMode; }
    public void setStrictMode(boolean strictMode) { this.strictMode = strictMode; }

    // -- conversions --

    public WalkForwardConfig toWalkForwardConfig() {
        return new WalkForwardConfig(walkForward.trainRatio, walkForward.testRatio, walkForward.numWindows,
                walkForward.maxDegradation, walkForward.minTestSharpe, walkForward.minRowsPerWindow,
                walkForward.gapRows, walkForward.mode);
    }

    public GateSettings toGateSettings() {
        return new GateSettings(gates.maxDrawdownLimit, gates.enableWalkForward, gates.enableStressTest,
                gates.determinismRuns);
    }

    public ReflexionSettings toReflexionSettings() {
        return new ReflexionSettings(reflexion.maxRetries, reflexion.maxSuggestions);
    }

    public ScorecardSettings toScorecardSettings() {
        return new ScorecardSettings(scorecard.greenThreshold, scorecard.amberThreshold);
    }

    /** Returns the configured weight profile, or empty when the built-in profile applies. */
    public Optional<WeightProfile> toWeightProfile() {
        if (scorecard.weights == null || scorecard.weights.isEmpty()) {
            return Optional.empty();
        }
        Map<ScoreComponent, Double> weights = new EnumMap<>(ScoreComponent.class);
        scorecard.weights.forEach((key, value) -> weights.put(ScoreComponent.valueOf(key.trim().toUpperCase()), value));
        return Optional.of(new WeightProfile(scorecard.weightProfileVersion, weights));
    }

    public Map<ToolKind, List<String>> toolCommands() {
        Map<ToolKind, List<String>> commands = new EnumMap<>(ToolKind.class);
        tools.commands.forEach((key, command) -> commands.put(ToolKind.fromConfigKey(key), List.copyOf(command)));
        return commands;
    }

    public Duration toolTimeout() {
        return Duration.ofSeconds(tools.timeoutSeconds);
    }

    public static class WalkForward {
        private double trainRatio = WalkForwardConfig.DEFAULT_TRAIN_RATIO;
        private double testRatio = WalkForwardConfig.DEFAULT_TEST_RATIO;
        private int numWindows = WalkForwardConfig.DEFAULT_NUM_WINDOWS;
        private double maxDegradation = WalkForwardConfig.DEFAULT_MAX_DEGRADATION;
        private double minTestSharpe = WalkForwardConfig.DEFAULT_MIN_TEST_SHARPE;
        private int minRowsPerWindow = WalkForwardConfig.DEFAULT_MIN_ROWS_PER_WINDOW;
        private int gapRows = 0;
        private WindowMode mode = WindowMode.ROLLING;

        public double getTrainRatio() { return trainRatio; }
        public void setTrainRatio(double trainRatio) { this.trainRatio = trainRatio; }
        public double getTestRatio() { return testRatio; }
        public void setTestRatio(double testRatio) { this.testRatio = testRatio; }
        public int getNumWindows() { return numWindows; }
        public void setNumWindows(int numWindows) { this.numWindows = numWindows; }
        public double getMaxDegradation() { return maxDegradation; }
        public void setMaxDegradation(double maxDegradation) { this.maxDegradation = maxDegradation; }
        public double getMinTestSharpe() { return minTestSharpe; }
        public void setMinTestSharpe(double minTestSharpe) { this.minTestSharpe = minTestSharpe; }
        public int getMinRowsPerWindow() { return minRowsPerWindow; }
        public void setMinRowsPerWindow(int minRowsPerWindow) { this.minRowsPerWindow = minRowsPerWindow; }
        public int getGapRows() { return gapRows; }
        public void setGapRows(int gapRows) { this.gapRows = gapRows; }
        public WindowMode getMode() { return mode; }
        public void setMode(WindowMode mode) { this.mode = mode; }
    }

    public static class Gates {
        private double maxDrawdownLimit = 0.25;
        private boolean enableWalkForward = false;
        private boolean enableStressTest = true;
        private int determinismRuns = 3;

        public double getMaxDrawdownLimit() { return maxDrawdownLimit; }
        public void setMaxDrawdownLimit(double maxDrawdownLimit) { this.maxDrawdownLimit = maxDrawdownLimit; }
        public boolean isEnableWalkForward() { return enableWalkForward; }
        public void setEnableWalkForward(boolean enableWalkForward) { this.enableWalkForward = enableWalkForward; }
        public boolean isEnableStressTest() { return enableStressTest; }
        public void setEnableStressTest(boolean enableStressTest) { this.enableStressTest = enableStressTest; }
        public int getDeterminismRuns() { return determinismRuns; }
        public void setDeterminismRuns(int determinismRuns) { this.determinismRuns = determinismRuns; }
    }

    public static class Reflexion {
        private int maxRetries = 3;
        private int maxSuggestions = 5;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getMaxSuggestions() { return maxSuggestions; }
        public void setMaxSuggestions(int maxSuggestions) { this.maxSuggestions = maxSuggestions; }
    }

    public static class Scorecard {
        private double greenThreshold = 85;
        private double amberThreshold = 70;
        private String weightProfileVersion = WeightProfile.DROPS_V1.version();
        private Map<String, Double> weights = new LinkedHashMap<>();

        public double getGreenThreshold() { return greenThreshold; }
        public void setGreenThreshold(double greenThreshold) { this.greenThreshold = greenThreshold; }
        public double getAmberThreshold() { return amberThreshold; }
        public void setAmberThreshold(double amberThreshold) { this.amberThreshold = amberThreshold; }
        public String getWeightProfileVersion() { return weightProfileVersion; }
        public void setWeightProfileVersion(String weightProfileVersion) { this.weightProfileVersion = weightProfileVersion; }
        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = weights; }
    }

    public static class Tools {
        private int timeoutSeconds = 300;
        private Map<String, List<String>> commands = new LinkedHashMap<>();

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public Map<String, List<String>> getCommands() { return commands; }
        public void setCommands(Map<String, List<String>> commands) { this.commands = commands; }
    }
}
