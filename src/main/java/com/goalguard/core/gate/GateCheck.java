package com.goalguard.core.gate;

import com.goalguard.core.tools.ToolInvocationException;

@FunctionalInterface
public interface GateCheck {
    CheckOutcome run(GateArtifact artifact, GateContext context) throws GateCheckException, ToolInvocationException;
}
