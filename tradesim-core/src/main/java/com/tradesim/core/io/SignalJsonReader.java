package com.tradesim.core.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradesim.core.model.MalformedInputException;
import com.tradesim.core.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads entry signals from JSON.
 *
 * Accepts either {@code {"signals": [...]}} or a bare array. Each record needs a
 * {@code timestamp} (ISO-8601 or epoch millis) and a {@code price}
 * ({@code entry_price} is accepted as an alias); {@code score} and
 * {@code metadata} are optional, and any other fields are folded into metadata.
 *
 * The result is sorted by timestamp. When two signals share a timestamp the
 * first one in file order is kept and the rest are dropped with a warning.
 */
public class SignalJsonReader {

    private static final Logger log = LoggerFactory.getLogger(SignalJsonReader.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();

    public List<Signal> read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            List<Signal> signals = read(in, file.getFileName().toString());
            log.info("Loaded {} signals from {}", signals.size(), file);
            return signals;
        }
    }

    public List<Signal> read(InputStream in, String source) throws IOException {
        JsonNode root = mapper.readTree(in);
        JsonNode array = root != null && root.isObject() ? root.get("signals") : root;
        if (array == null || !array.isArray()) {
            throw new MalformedInputException(source, -1, "expected an array or an object with a 'signals' array");
        }

        List<Signal> parsed = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            parsed.add(parseSignal(array.get(i), source, i));
        }
        List<Signal> signals = sortAndDeduplicate(parsed, source);
        InputValidator.validateSignals(signals);
        return signals;
    }

    /**
     * Sort by timestamp (stable) and drop later duplicates of the same timestamp.
     */
    static List<Signal> sortAndDeduplicate(List<Signal> signals, String source) {
        List<Signal> sorted = new ArrayList<>(signals);
        sorted.sort(Comparator.comparingLong(Signal::timestamp));
        List<Signal> result = new ArrayList<>(sorted.size());
        for (Signal signal : sorted) {
            if (!result.isEmpty() && result.get(result.size() - 1).timestamp() == signal.timestamp()) {
                log.warn("{}: dropping duplicate signal at {}", source, Timestamps.format(signal.timestamp()));
                continue;
            }
            result.add(signal);
        }
        return result;
    }

    private Signal parseSignal(JsonNode node, String source, int index) {
        if (node == null || !node.isObject()) {
            throw new MalformedInputException(source, index, "signal is not an object");
        }
        JsonNode ts = node.get("timestamp");
        JsonNode price = node.has("price") ? node.get("price") : node.get("entry_price");
        if (ts == null || ts.isNull()) {
            throw new MalformedInputException(source, index, "missing timestamp");
        }
        if (price == null || !price.isNumber()) {
            throw new MalformedInputException(source, index, "missing or non-numeric price");
        }

        long timestamp;
        try {
            timestamp = ts.isNumber() ? ts.asLong() : Timestamps.parse(ts.asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException(source, index, e.getMessage(), e);
        }

        JsonNode scoreNode = node.get("score");
        Double score = scoreNode != null && scoreNode.isNumber() ? scoreNode.asDouble() : null;

        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode metaNode = node.get("metadata");
        if (metaNode != null && metaNode.isObject()) {
            metadata.putAll(mapper.convertValue(metaNode, METADATA_TYPE));
        }
        node.fields().forEachRemaining(e -> {
            String key = e.getKey();
            if (!key.equals("timestamp") && !key.equals("price") && !key.equals("entry_price")
                    && !key.equals("score") && !key.equals("metadata")) {
                metadata.putIfAbsent(key, mapper.convertValue(e.getValue(), Object.class));
            }
        });

        return new Signal(timestamp, price.asDouble(), score, metadata);
    }
}
