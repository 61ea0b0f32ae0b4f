package com.tradesim.core.io;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a bar series from CSV.
 * Format: timestamp,open,high,low,close,volume with an optional header line.
 * The timestamp column may hold epoch milliseconds or ISO-8601 text.
 */
public class BarCsvReader {

    private static final Logger log = LoggerFactory.getLogger(BarCsvReader.class);
    public static final String CSV_HEADER = "timestamp,open,high,low,close,volume";

    /**
     * Read and validate bars from a file.
     */
    public List<Bar> read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<Bar> bars = read(reader, file.getFileName().toString());
            log.info("Loaded {} bars from {}", bars.size(), file);
            return bars;
        }
    }

    /**
     * Read and validate bars from a character stream.
     *
     * @param source name used in error messages
     */
    public List<Bar> read(Reader in, String source) throws IOException {
        BufferedReader reader = in instanceof BufferedReader br ? br : new BufferedReader(in);
        List<Bar> bars = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (bars.isEmpty() && Character.isLetter(trimmed.charAt(0))) {
                continue;  // header
            }
            bars.add(parseLine(trimmed, source, lineNumber));
        }
        InputValidator.validateBars(bars);
        return bars;
    }

    static Bar parseLine(String line, String source, int lineNumber) {
        String[] parts = line.split(",");
        if (parts.length < 6) {
            throw new MalformedInputException(source, lineNumber, "expected 6 columns: " + line);
        }
        try {
            long timestamp = Timestamps.parse(parts[0]);
            double open = Double.parseDouble(parts[1].trim());
            double high = Double.parseDouble(parts[2].trim());
            double low = Double.parseDouble(parts[3].trim());
            double close = Double.parseDouble(parts[4].trim());
            double volume = Double.parseDouble(parts[5].trim());
            return new Bar(timestamp, open, high, low, close, volume);
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException(source, lineNumber, e.getMessage(), e);
        }
    }
}
