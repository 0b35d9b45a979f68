package com.goalguard.core.tools;

/**
 * A single deferred tool invocation.
 */
@FunctionalInterface
public interface ToolCall<T> {
    T call() throws ToolInvocationException;
}
