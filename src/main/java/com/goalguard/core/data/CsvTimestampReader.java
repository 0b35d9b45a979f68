package com.goalguard.core.data;

import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.TimeSeriesDataset;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the timestamp column of a CSV file into a {@link TimeSeriesDataset}.
 * <p>
 * The first column of each row is taken as the timestamp: an ISO-8601 instant, local
 * date-time or date (both read as UTC), or epoch milliseconds. A first line that does not
 * parse is treated as a header. Blank lines are skipped.
 */
public class CsvTimestampReader {

    public TimeSeriesDataset read(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset " + path, e);
        }

        List<Instant> timestamps = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                continue;
            }
            String cell = firstCell(line);
            try {
                timestamps.add(parseTimestamp(cell));
            } catch (IllegalArgumentException e) {
                if (i == 0) {
                    continue;
                }
                throw new IllegalArgumentException("Line %d of %s: unparseable timestamp '%s'".formatted(i + 1, path, cell), e);
            }
        }
        return new TimeSeriesDataset(DataRef.of(path.toUri().toString()), timestamps);
    }

    static Instant parseTimestamp(String cell) {
        String value = cell.strip();
        if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
            value = value.substring(1, value.length() - 1);
        }
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a timestamp: " + cell, e);
        }
    }

    private static String firstCell(String line) {
        int comma = line.indexOf(',');
        return comma < 0 ? line : line.substring(0, comma);
    }
}
