package com.goalguard.core.reflexion;

import java.io.Serializable;

public record Suggestion(
    SuggestionCategory category,
    Priority priority,
    String description,
    String rationale
) implements Serializable {}
