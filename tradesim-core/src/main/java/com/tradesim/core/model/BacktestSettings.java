package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * User-editable backtest settings, stored as YAML.
 *
 * <pre>
 * name: v35-day
 * initial_capital: 10000000
 * costs:
 *   fee_rate: 0.0005
 *   slippage_rate: 0.0002
 *   min_order_value: 5000
 * sizing:
 *   type: kelly
 *   min_fraction: 0.1
 *   max_fraction: 1.0
 *   half_kelly: true
 *   lookback_trades: 50
 * exits:
 *   take_profit: 0.05
 *   stop_loss: 0.02
 *   trailing_stop: { enabled: true, activation_pct: 0.03, trail_pct: 0.01 }
 *   max_hold_duration: 72h
 * </pre>
 *
 * Missing keys keep their defaults. {@link #toConfig()} validates and converts to
 * the immutable {@link BacktestConfig} the engine runs on.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BacktestSettings {

    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*([smhdw])");

    private String name = "backtest";
    private double initialCapital = 10_000_000;
    private Costs costs = new Costs();
    private Sizing sizing = new Sizing();
    private Exits exits = new Exits();

    public BacktestSettings() {
        // For Jackson
    }

    /**
     * Load settings from a YAML file. A missing file yields the defaults.
     */
    public static BacktestSettings load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new BacktestSettings();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), BacktestSettings.class);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    /**
     * Validate and convert to the engine configuration.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public BacktestConfig toConfig() {
        CostModel costModel = new CostModel(costs.feeRate, costs.slippageRate, costs.minOrderValue);
        SizingSettings sizingSettings = new SizingSettings(
            PositionSizingType.fromValue(sizing.type),
            sizing.minFraction,
            sizing.maxFraction,
            sizing.defaultFraction,
            sizing.halfKelly,
            sizing.kellyDamping,
            sizing.lookbackTrades,
            sizing.minTrades
        );
        TrailingStop ts = exits.trailingStop != null ? exits.trailingStop : new TrailingStop();
        ExitSettings exitSettings = new ExitSettings(
            exits.takeProfit,
            exits.stopLoss,
            new TrailingStopSettings(ts.enabled, ts.activationPct, ts.trailPct),
            parseDuration(exits.maxHoldDuration)
        );
        return new BacktestConfig(name, initialCapital, costModel, sizingSettings, exitSettings);
    }

    /**
     * Parse an ISO-8601 duration ({@code PT72H}) or a shorthand such as {@code 30m},
     * {@code 72h}, {@code 3d}, {@code 2w} or {@code 1d 12h}. Blank means no limit.
     */
    public static Duration parseDuration(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        if (value.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + text, e);
            }
        }
        Matcher m = SHORT_DURATION.matcher(value.toLowerCase(Locale.ROOT));
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (m.find()) {
            if (!value.substring(consumed, m.start()).isBlank()) {
                throw new IllegalArgumentException("Invalid duration: " + text);
            }
            long amount = Long.parseLong(m.group(1));
            total = total.plus(switch (m.group(2)) {
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                case "d" -> Duration.ofDays(amount);
                default -> Duration.ofDays(amount * 7);
            });
            consumed = m.end();
        }
        if (consumed == 0 || !value.substring(consumed).isBlank()) {
            throw new IllegalArgumentException("Invalid duration: " + text);
        }
        return total;
    }

    // Getters and setters

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public double getInitialCapital() { return initialCapital; }
    public void setInitialCapital(double initialCapital) { this.initialCapital = initialCapital; }

    public Costs getCosts() { return costs; }
    public void setCosts(Costs costs) { this.costs = costs != null ? costs : new Costs(); }

    public Sizing getSizing() { return sizing; }
    public void setSizing(Sizing sizing) { this.sizing = sizing != null ? sizing : new Sizing(); }

    public Exits getExits() { return exits; }
    public void setExits(Exits exits) { this.exits = exits != null ? exits : new Exits(); }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Costs {
        private double feeRate = 0.0005;
        private double slippageRate = 0.0002;
        private double minOrderValue = 5_000;

        public double getFeeRate() { return feeRate; }
        public void setFeeRate(double v) { this.feeRate = v; }

        public double getSlippageRate() { return slippageRate; }
        public void setSlippageRate(double v) { this.slippageRate = v; }

        public double getMinOrderValue() { return minOrderValue; }
        public void setMinOrderValue(double v) { this.minOrderValue = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Sizing {
        private String type = PositionSizingType.KELLY.getValue();
        private double minFraction = 0.1;
        private double maxFraction = 1.0;
        private double defaultFraction = 0.5;
        private boolean halfKelly = true;
        private double kellyDamping = SizingSettings.DEFAULT_KELLY_DAMPING;
        private int lookbackTrades = SizingSettings.DEFAULT_LOOKBACK_TRADES;
        private int minTrades = SizingSettings.DEFAULT_MIN_TRADES;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public double getMinFraction() { return minFraction; }
        public void setMinFraction(double v) { this.minFraction = v; }

        public double getMaxFraction() { return maxFraction; }
        public void setMaxFraction(double v) { this.maxFraction = v; }

        public double getDefaultFraction() { return defaultFraction; }
        public void setDefaultFraction(double v) { this.defaultFraction = v; }

        public boolean isHalfKelly() { return halfKelly; }
        public void setHalfKelly(boolean v) { this.halfKelly = v; }

        public double getKellyDamping() { return kellyDamping; }
        public void setKellyDamping(double v) { this.kellyDamping = v; }

        public int getLookbackTrades() { return lookbackTrades; }
        public void setLookbackTrades(int v) { this.lookbackTrades = v; }

        public int getMinTrades() { return minTrades; }
        public void setMinTrades(int v) { this.minTrades = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Exits {
        private Double takeProfit;
        private Double stopLoss;
        private TrailingStop trailingStop = new TrailingStop();
        private String maxHoldDuration;

        public Double getTakeProfit() { return takeProfit; }
        public void setTakeProfit(Double v) { this.takeProfit = v; }

        public Double getStopLoss() { return stopLoss; }
        public void setStopLoss(Double v) { this.stopLoss = v; }

        public TrailingStop getTrailingStop() { return trailingStop; }
        public void setTrailingStop(TrailingStop v) { this.trailingStop = v; }

        public String getMaxHoldDuration() { return maxHoldDuration; }
        public void setMaxHoldDuration(String v) { this.maxHoldDuration = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TrailingStop {
        private boolean enabled;
        private double activationPct;
        private double trailPct;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }

        public double getActivationPct() { return activationPct; }
        public void setActivationPct(double v) { this.activationPct = v; }

        public double getTrailPct() { return trailPct; }
        public void setTrailPct(double v) { this.trailPct = v; }
    }
}
