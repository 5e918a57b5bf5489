package org.carball.widgetq.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class EngineConfig {

    // Pagination
    @Builder.Default
    private int defaultPage = 1;

    @Builder.Default
    private int defaultPageSize = 100;

    // Chart output
    @Builder.Default
    private int maxSeries = 10;

    @Builder.Default
    private int labelMaxLength = 30;

    // Calendar zone for relative dates and day ranges
    @Builder.Default
    private String zoneId = "UTC";

    // Percent change below which a trend counts as stable
    @Builder.Default
    private double trendStableThreshold = 1.0;

    // Identifier quoting: postgres or bracket
    @Builder.Default
    private String quoting = "postgres";

    @Builder.Default
    private List<String> aggregationAliases = List.of("value", "count", "total", "avg", "min", "max", "sum");

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }

    /**
     * The configured zone, or UTC when the id cannot be resolved.
     */
    public ZoneId getZone() {
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            log.warn("Unknown zone id '{}', falling back to UTC", zoneId);
            return ZoneOffset.UTC;
        }
    }

    /**
     * Validates the configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (defaultPage < 1) {
            log.warn("Default page ({}) should be at least 1", defaultPage);
        }

        if (defaultPageSize < 1) {
            log.warn("Default page size ({}) should be at least 1", defaultPageSize);
        }

        if (defaultPageSize > 10_000) {
            log.warn("Default page size ({}) is unusually large", defaultPageSize);
        }

        if (maxSeries < 1) {
            log.warn("Max series ({}) should be at least 1", maxSeries);
        }

        if (labelMaxLength < 4) {
            log.warn("Label max length ({}) is too short to hold a truncation marker", labelMaxLength);
        }

        if (trendStableThreshold < 0) {
            log.warn("Trend stable threshold ({}) should not be negative", trendStableThreshold);
        }

        if (!"postgres".equalsIgnoreCase(quoting) && !"bracket".equalsIgnoreCase(quoting)) {
            log.warn("Unknown quoting style '{}', expected postgres or bracket", quoting);
        }

        try {
            ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            log.warn("Zone id '{}' is not recognised: {}", zoneId, e.getMessage());
        }

        log.debug("Using engine config - Page size: {}, Max series: {}, Zone: {}, Quoting: {}",
                defaultPageSize, maxSeries, zoneId, quoting);
    }

    public String getConfigurationSummary() {
        return String.format("Page: %d | Page size: %d | Max series: %d | Zone: %s | Label length: %d | Trend threshold: %.2f%% | Quoting: %s",
                defaultPage, defaultPageSize, maxSeries, zoneId, labelMaxLength, trendStableThreshold, quoting);
    }
}
