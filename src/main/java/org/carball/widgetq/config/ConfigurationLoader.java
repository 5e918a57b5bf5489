package org.carball.widgetq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.error.ConfigException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.IntConsumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public EngineConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > config file > defaults
     */
    public EngineConfig loadConfiguration(Path configFile, String[] args) {
        log.debug("Loading engine configuration");

        EngineConfig.EngineConfigBuilder builder = EngineConfig.builder();

        // 1. Config file
        if (configFile != null) {
            loadConfigFile(configFile).applyTo(builder);
        }

        // 2. Environment variables
        applyEnvironmentVariables(builder);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args == null ? new String[0] : args);

        EngineConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    public EngineConfigFile loadConfigFile(Path configFile) {
        if (!Files.exists(configFile)) {
            log.warn("Engine config file not found: {}, using defaults", configFile);
            return new EngineConfigFile();
        }
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            EngineConfigFile file = mapper.readValue(configFile.toFile(), EngineConfigFile.class);
            log.info("Loaded engine config from: {}", configFile);
            return file == null ? new EngineConfigFile() : file;
        } catch (IOException e) {
            log.error("Failed to read engine config {}: {}", configFile, e.getMessage());
            throw new ConfigException("Invalid engine config file: " + configFile, e);
        }
    }

    private void applyEnvironmentVariables(EngineConfig.EngineConfigBuilder builder) {
        applyInt(environment.get("WIDGETQ_DEFAULT_PAGE_SIZE"), "WIDGETQ_DEFAULT_PAGE_SIZE", builder::defaultPageSize);
        applyInt(environment.get("WIDGETQ_MAX_SERIES"), "WIDGETQ_MAX_SERIES", builder::maxSeries);
        applyInt(environment.get("WIDGETQ_LABEL_MAX_LENGTH"), "WIDGETQ_LABEL_MAX_LENGTH", builder::labelMaxLength);

        if (environment.containsKey("WIDGETQ_ZONE")) {
            builder.zoneId(environment.get("WIDGETQ_ZONE"));
        }
        if (environment.containsKey("WIDGETQ_QUOTING")) {
            builder.quoting(environment.get("WIDGETQ_QUOTING"));
        }
        if (environment.containsKey("WIDGETQ_TREND_STABLE_THRESHOLD")) {
            String value = environment.get("WIDGETQ_TREND_STABLE_THRESHOLD");
            try {
                builder.trendStableThreshold(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for WIDGETQ_TREND_STABLE_THRESHOLD: {}", value);
            }
        }
    }

    private void applyCLIArguments(EngineConfig.EngineConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--engine.page-size":
                        builder.defaultPageSize(Integer.parseInt(value));
                        break;
                    case "--engine.max-series":
                        builder.maxSeries(Integer.parseInt(value));
                        break;
                    case "--engine.label-max-length":
                        builder.labelMaxLength(Integer.parseInt(value));
                        break;
                    case "--engine.trend-threshold":
                        builder.trendStableThreshold(Double.parseDouble(value));
                        break;
                    case "--engine.zone":
                    case "--zone":
                        builder.zoneId(value);
                        break;
                    case "--engine.quoting":
                        builder.quoting(value);
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private void applyInt(String value, String name, IntConsumer setter) {
        if (value == null) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    /**
     * Returns help text for engine configuration options.
     */
    public static String getConfigHelp() {
        return """
            Engine Configuration Options:

            CLI Arguments:
              --engine.page-size <num>          Default page size when none is requested
              --engine.max-series <num>         Maximum number of chart series
              --engine.label-max-length <num>   Truncate series labels beyond this length
              --engine.trend-threshold <num>    Percent change treated as a stable trend
              --engine.zone <zone>              Calendar zone for dates (alias: --zone)
              --engine.quoting <style>          Identifier quoting: postgres or bracket

            Environment Variables:
              WIDGETQ_DEFAULT_PAGE_SIZE         Same as --engine.page-size
              WIDGETQ_MAX_SERIES                Same as --engine.max-series
              WIDGETQ_LABEL_MAX_LENGTH          Same as --engine.label-max-length
              WIDGETQ_TREND_STABLE_THRESHOLD    Same as --engine.trend-threshold
              WIDGETQ_ZONE                      Same as --engine.zone
              WIDGETQ_QUOTING                   Same as --engine.quoting

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Config file (--config)
              4. Built-in defaults
            """;
    }
}
