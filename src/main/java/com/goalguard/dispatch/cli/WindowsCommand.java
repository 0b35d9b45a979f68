package com.goalguard.dispatch.cli;

import com.goalguard.core.data.CsvTimestampReader;
import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.TimeSeriesDataset;
import com.goalguard.core.walkforward.InsufficientDataException;
import com.goalguard.core.walkforward.WalkForwardConfig;
import com.goalguard.core.walkforward.WalkForwardValidator;
import com.goalguard.core.walkforward.WalkForwardWindow;
import com.goalguard.core.walkforward.WindowMode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: goalguard windows (--rows N | --file data.csv)
 * <p>
 * Previews the walk-forward windows the product gate would evaluate.
 */
@Command(name = "windows", mixinStandardHelpOptions = true, description = "Preview walk-forward windows")
@Component
public class WindowsCommand implements Callable<Integer> {

    static class Source {
        @Option(names = "--rows", description = "Synthetic dataset size (daily timestamps)")
        Integer rows;

        @Option(names = "--file", description = "CSV file whose first column holds timestamps")
        Path file;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Source source;

    @Option(names = "--windows", description = "Number of windows (default: configured)")
    private Integer numWindows;

    @Option(names = "--mode", description = "Window mode: ${COMPLETION-CANDIDATES} (default: configured)")
    private WindowMode mode;

    @Option(names = "--gap", description = "Rows skipped between train and test (default: configured)")
    private Integer gapRows;

    private final WalkForwardValidator validator;

    public WindowsCommand(WalkForwardValidator validator) {
        this.validator = validator;
    }

    @Override
    public Integer call() {
        WalkForwardConfig config = validator.config();
        if (numWindows != null) {
            config = config.withNumWindows(numWindows);
        }
        if (mode != null) {
            config = config.withMode(mode);
        }
        if (gapRows != null) {
            config = config.withGapRows(gapRows);
        }

        List<WalkForwardWindow> windows;
        try {
            windows = validator.createWindows(dataset(), config);
        } catch (InsufficientDataException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (IllegalArgumentException | UncheckedIOException e) {
            ConsoleOutput.error("Invalid input: " + e.getMessage());
            return 2;
        }

        ConsoleOutput.info(windows.size() + " " + config.mode().name().toLowerCase() + " windows, gap "
                + config.gapRows() + " rows");
        windows.forEach(w -> System.out.println("  " + w.describe()));
        return 0;
    }

    private TimeSeriesDataset dataset() {
        if (source.file != null) {
            return new CsvTimestampReader().read(source.file);
        }
        if (source.rows < 0) {
            throw new IllegalArgumentException("--rows must not be negative");
        }
        Instant start = Instant.parse("2020-01-01T00:00:00Z");
        List<Instant> timestamps = new ArrayList<>(source.rows);
        for (int i = 0; i < source.rows; i++) {
            timestamps.add(start.plus(Duration.ofDays(i)));
        }
        return new TimeSeriesDataset(DataRef.of("synthetic:" + source.rows), timestamps);
    }
}
