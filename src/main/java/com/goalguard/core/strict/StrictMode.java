package com.goalguard.core.strict;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Enforces artifact-id-only responses: a valid response cites at least one SHA-256 artifact id
 * and carries no more than {@value #MAX_OTHER_TEXT} characters of other text.
 */
public class StrictMode {

    public static final int MAX_OTHER_TEXT = 50;

    private static final Pattern ARTIFACT_ID = Pattern.compile("[a-f0-9]{64}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final boolean enabled;

    public StrictMode(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean validateResponse(String response) {
        if (!enabled) {
            return true;
        }
        if (response == null || extractArtifactIds(response).isEmpty()) {
            return false;
        }
        String other = ARTIFACT_ID.matcher(response).replaceAll("");
        other = WHITESPACE.matcher(other).replaceAll(" ").strip();
        return other.length() <= MAX_OTHER_TEXT;
    }

    public List<String> extractArtifactIds(String text) {
        List<String> ids = new ArrayList<>();
        if (text == null) {
            return ids;
        }
        Matcher matcher = ARTIFACT_ID.matcher(text);
        while (matcher.find()) {
            ids.add(matcher.group());
        }
        return ids;
    }

    public String formatArtifactResponse(List<String> artifactIds, String context) {
        if (artifactIds == null || artifactIds.isEmpty()) {
            return "No artifacts";
        }
        List<String> lines = new ArrayList<>();
        if (context != null && !context.isBlank()) {
            lines.add(context);
        }
        lines.add("Artifacts:");
        artifactIds.forEach(id -> lines.add("  " + id));
        return String.join("\n", lines);
    }
}
