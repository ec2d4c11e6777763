package com.verity.dataquality.compiler.dataset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Guesses the column separator of a delimited file from its header line.
 */
public final class DelimiterDetector {
    private static final Logger logger = LoggerFactory.getLogger(DelimiterDetector.class);

    public static final char DEFAULT_DELIMITER = ',';

    /** Candidates in priority order. */
    static final List<Character> CANDIDATES = List.of(',', '|', ';', '\t');

    private DelimiterDetector() {
    }

    /**
     * Reads the first line of {@code path} and detects its delimiter. An unreadable
     * or empty file falls back to {@link #DEFAULT_DELIMITER}; the loader that reads
     * the file afterwards reports the I/O failure itself.
     */
    public static char detect(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return detectFromLine(reader.readLine());
        } catch (IOException e) {
            logger.warn("Could not read header line of {} for delimiter detection, using '{}': {}",
                path, DEFAULT_DELIMITER, e.getMessage());
            return DEFAULT_DELIMITER;
        }
    }

    /**
     * Returns the first candidate that splits {@code headerLine} into more than one part.
     */
    public static char detectFromLine(String headerLine) {
        if (headerLine == null || headerLine.isEmpty()) {
            return DEFAULT_DELIMITER;
        }
        for (char candidate : CANDIDATES) {
            if (headerLine.indexOf(candidate) >= 0) {
                return candidate;
            }
        }
        return DEFAULT_DELIMITER;
    }
}
