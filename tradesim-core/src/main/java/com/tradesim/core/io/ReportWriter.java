package com.tradesim.core.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradesim.core.model.BacktestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes and reads backtest reports as indented JSON.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = createMapper();
    }

    /**
     * Mapper configured for report output: ISO durations, indented.
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        return mapper;
    }

    public void write(BacktestReport report, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        mapper.writeValue(file.toFile(), report);
        log.info("Saved report '{}' ({} trades) to {}", report.name(), report.totalTrades(), file);
    }

    public void write(BacktestReport report, OutputStream out) throws IOException {
        mapper.writeValue(out, report);
    }

    public String toJson(BacktestReport report) throws IOException {
        return mapper.writeValueAsString(report);
    }

    public BacktestReport read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), BacktestReport.class);
    }
}
