package com.goalguard.core.model;

import java.io.Serializable;

/**
 * Identifier assigned by the artifact store when a strategy is committed.
 */
public record CommittedId(String value) implements Serializable {}
