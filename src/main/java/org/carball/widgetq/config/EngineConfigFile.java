package org.carball.widgetq.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * YAML shape of an engine config file. Absent keys stay null and keep the lower-priority value.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfigFile {

    @JsonProperty("default_page")
    private Integer defaultPage;

    @JsonProperty("default_page_size")
    private Integer defaultPageSize;

    @JsonProperty("max_series")
    private Integer maxSeries;

    @JsonProperty("label_max_length")
    private Integer labelMaxLength;

    @JsonProperty("zone")
    private String zoneId;

    @JsonProperty("trend_stable_threshold")
    private Double trendStableThreshold;

    @JsonProperty("quoting")
    private String quoting;

    @JsonProperty("aggregation_aliases")
    private List<String> aggregationAliases;

    public void applyTo(EngineConfig.EngineConfigBuilder builder) {
        if (defaultPage != null) {
            builder.defaultPage(defaultPage);
        }
        if (defaultPageSize != null) {
            builder.defaultPageSize(defaultPageSize);
        }
        if (maxSeries != null) {
            builder.maxSeries(maxSeries);
        }
        if (labelMaxLength != null) {
            builder.labelMaxLength(labelMaxLength);
        }
        if (zoneId != null) {
            builder.zoneId(zoneId);
        }
        if (trendStableThreshold != null) {
            builder.trendStableThreshold(trendStableThreshold);
        }
        if (quoting != null) {
            builder.quoting(quoting);
        }
        if (aggregationAliases != null && !aggregationAliases.isEmpty()) {
            builder.aggregationAliases(List.copyOf(aggregationAliases));
        }
    }
}
