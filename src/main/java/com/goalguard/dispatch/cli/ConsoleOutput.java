package com.goalguard.dispatch.cli;

import com.goalguard.core.events.GoalGuardEvent;
import com.goalguard.core.gate.GateResult;
import com.goalguard.core.model.TransitionRecord;
import com.goalguard.core.scorecard.DecisionBand;
import com.goalguard.core.scorecard.NextAction;
import com.goalguard.core.scorecard.ReadinessScorecard;
import com.goalguard.core.walkforward.WalkForwardAnalysis;
import picocli.CommandLine;

import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for GoalGuard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GOALGUARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GOALGUARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void transition(TransitionRecord record) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %3d. %-19s @|fg(blue) --%s-->|@ %-19s %s",
                record.sequence(), record.from(), record.event(), record.to(),
                record.note() != null ? record.note() : "")));
    }

    public static void gate(GateResult result) {
        String status = result.passed() ? "@|fg(green),bold PASSED|@" : "@|fg(red),bold FAILED|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [" + result.gateName() + "]|@ " + status));
        for (Map.Entry<String, Boolean> check : result.checks().entrySet()) {
            String mark = check.getValue() ? "@|fg(green) +|@" : "@|fg(red) x|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    " + mark + " " + check.getKey()));
        }
        for (String error : result.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + error));
        }
    }

    public static void walkForward(WalkForwardAnalysis analysis) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "  @|bold Walk-forward|@ train sharpe %.2f, test sharpe %.2f, degradation %.2f, stability %.2f",
                analysis.avgTrainSharpe(), analysis.avgTestSharpe(), analysis.avgDegradation(),
                analysis.stabilityScore())));
    }

    public static void scorecard(ReadinessScorecard card) {
        String color = switch (card.decision()) {
            case GREEN -> "fg(green)";
            case AMBER -> "fg(yellow)";
            case RED, BLOCKED -> "fg(red)";
        };
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "@|bold Readiness|@ %.2f @|%s,bold %s|@ (%s)",
                card.score(), color, card.decision(), card.profileVersion())));
        card.components().forEach((component, score) ->
                System.out.println(String.format(Locale.ROOT, "  %s %-12s %6.1f",
                        component, component.label(), score)));
        if (card.decision() == DecisionBand.BLOCKED) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) Blockers:|@ " + String.join(", ", card.blockers())));
        }
        for (NextAction action : card.nextActions()) {
            System.out.println("  " + action.rank() + ". [" + action.subject() + "] " + action.action());
        }
    }

    public static void watchEvent(GoalGuardEvent event) {
        String prefix = switch (event.eventType()) {
            case GoalGuardEvent.RUN_CREATED -> "@|fg(cyan) [RUN]|@";
            case GoalGuardEvent.RUN_TRANSITION -> "@|fg(blue) [TRANSITION]|@";
            case GoalGuardEvent.TOOL_INVOKED -> "@|fg(magenta) [TOOL]|@";
            case GoalGuardEvent.GATE_EVALUATED -> "@|bold,fg(yellow) [GATE]|@";
            case GoalGuardEvent.REFLEXION_PLANNED -> "@|fg(yellow) [REFLEXION]|@";
            case GoalGuardEvent.RUN_TERMINAL -> "@|bold [DONE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String detail = event.detail() != null ? event.detail() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.runId() + " " + detail));
    }
}
