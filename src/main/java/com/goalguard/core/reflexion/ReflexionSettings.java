package com.goalguard.core.reflexion;

/**
 * @param maxRetries     retries granted before a run is forced to ERROR
 * @param maxSuggestions cap on suggestions per reflexion record
 */
public record ReflexionSettings(int maxRetries, int maxSuggestions) {

    public ReflexionSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (maxSuggestions < 1) {
            throw new IllegalArgumentException("maxSuggestions must be >= 1, got: " + maxSuggestions);
        }
    }

    public static ReflexionSettings defaults() {
        return new ReflexionSettings(3, 5);
    }
}
