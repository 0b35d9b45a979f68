package com.goalguard.core.scorecard;

import java.io.Serializable;

/**
 * @param rank    1-based position, most urgent first
 * @param subject blocker id or component letter the action addresses
 * @param action  what to do
 */
public record NextAction(int rank, String subject, String action) implements Serializable {}
