package com.goalguard.dispatch.cli;

import com.goalguard.core.fsm.Transition;
import com.goalguard.core.fsm.TransitionTable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: goalguard transitions
 * <p>
 * Prints every edge of the lifecycle transition table with its guard.
 */
@Command(name = "transitions", mixinStandardHelpOptions = true, description = "Print the lifecycle transition table")
@Component
public class TransitionsCommand implements Runnable {

    private final TransitionTable table;

    public TransitionsCommand(TransitionTable table) {
        this.table = table;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.printf("%-19s %-17s %-19s %s%n", "FROM", "EVENT", "TO", "GUARD");
        for (Transition t : table.all()) {
            System.out.printf("%-19s %-17s %-19s %s%n", t.from(), t.event(), t.to(), t.guardName());
        }
    }
}
