package org.carball.widgetq.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.config.ConfigurationLoader;
import org.carball.widgetq.config.EngineConfig;
import org.carball.widgetq.engine.WidgetQueryEngine;
import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.filter.DateResolver;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.schema.DatabaseSchema;
import org.carball.widgetq.model.schema.Table;
import org.carball.widgetq.model.widget.MetricConfig;
import org.carball.widgetq.model.widget.Pagination;
import org.carball.widgetq.model.widget.WidgetDescriptor;
import org.carball.widgetq.model.widget.WidgetQueryConfig;
import org.carball.widgetq.parser.SchemaParser;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Compiles a widget request file into query parameters and prints them as JSON or YAML.
 */
@Slf4j
public class WidgetQueryCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    private static final String VERSION = "1.0.0";

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;

    public WidgetQueryCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
    }

    public static void main(String[] args) {
        int exitCode = new WidgetQueryCLI(System.out, System.err, new ConfigurationLoader()).run(args);
        System.exit(exitCode);
    }

    public int run(String[] args) {
        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            return args.length == 0 ? EXIT_CONFIG_ERROR : EXIT_OK;
        }

        try {
            CliOptions options = parseArgs(args);
            if (options.verbose) {
                enableDebugLogging();
            }

            EngineConfig engineConfig = configurationLoader.loadConfiguration(options.configFile, args);
            Clock clock = clockFor(options.now, engineConfig);
            WidgetQueryEngine engine = new WidgetQueryEngine(clock, engineConfig);

            CompileRequest request = readRequest(options.requestFile);
            WidgetDescriptor widget = request.getWidget();
            if (widget == null) {
                throw new ConfigException("Request is missing the 'widget' section");
            }
            List<ColumnMeta> columns = resolveColumns(request, options.schemaFile);
            Pagination pagination = new Pagination(request.getPage(), request.getPageSize());

            Object result;
            WidgetQueryConfig config = engine.parseConfig(widget, request.getConfig());
            if (WidgetQueryEngine.hasTrend(config)) {
                log.debug("Metric carries a trend filter, planning current and previous queries");
                result = engine.planTrend(widget, (MetricConfig) config, pagination, columns);
            } else {
                result = engine.compile(widget, config, pagination, columns);
            }

            String rendered = mapper(options.format).writeValueAsString(result);
            if (options.outputFile != null) {
                Files.writeString(options.outputFile, rendered);
                err.println("Wrote query parameters to " + options.outputFile);
            } else {
                out.println(rendered);
            }
            return EXIT_OK;

        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_IO_ERROR;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h");
    }

    private void printUsage() {
        out.println("Widget Query Engine v" + VERSION);
        out.println();
        out.println("Usage: java -jar widget-query-engine.jar <request.(json|yaml)> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  request             Request file with widget, config, page, pageSize and columns");
        out.println();
        out.println("Options:");
        out.println("  --schema, -s        SQL DDL file; columns are taken from the widget's table");
        out.println("  --now               Fixed current time (ISO-8601) for relative dates");
        out.println("  --output, -o        Write the result to a file instead of stdout");
        out.println("  --format, -f        Output format: json|yaml (default: json)");
        out.println("  --config            YAML file with engine settings");
        out.println("  --verbose, -v       Enable debug logging");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigHelp());
        out.println("Examples:");
        out.println("  java -jar widget-query-engine.jar sales-chart.json --schema schema.sql");
        out.println("  java -jar widget-query-engine.jar revenue.yml --now 2024-03-15T10:00:00Z --format yaml");
    }

    CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--schema":
                case "-s":
                    options.schemaFile = Paths.get(requireValue(args, ++i, "Schema file not specified"));
                    break;

                case "--now":
                    options.now = requireValue(args, ++i, "Current time not specified");
                    break;

                case "--output":
                case "-o":
                    options.outputFile = Paths.get(requireValue(args, ++i, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        options.format = OutputFormat.valueOf(format.toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json or yaml");
                    }
                    break;

                case "--config":
                    options.configFile = Paths.get(requireValue(args, ++i, "Config file not specified"));
                    break;

                case "--verbose":
                case "-v":
                    options.verbose = true;
                    break;

                default:
                    if (arg.startsWith("--engine.") || arg.equals("--zone")) {
                        // Read by ConfigurationLoader
                        requireValue(args, ++i, "Value not specified for " + arg);
                    } else if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    } else if (options.requestFile == null) {
                        options.requestFile = Paths.get(arg);
                    } else {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
            }
        }

        if (options.requestFile == null) {
            throw new IllegalArgumentException("Request file not specified");
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static Clock clockFor(String now, EngineConfig config) {
        if (now == null) {
            return Clock.systemUTC();
        }
        DateResolver resolver = new DateResolver(config.getZone());
        return Clock.fixed(resolver.parseInstant(now), ZoneOffset.UTC);
    }

    private CompileRequest readRequest(Path requestFile) throws IOException {
        if (!Files.exists(requestFile)) {
            throw new IOException("Request file not found: " + requestFile);
        }
        ObjectMapper mapper = isYaml(requestFile) ? new ObjectMapper(new YAMLFactory()) : new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        CompileRequest request = mapper.readValue(requestFile.toFile(), CompileRequest.class);
        if (request == null) {
            throw new ConfigException("Request file is empty: " + requestFile);
        }
        log.debug("Read request for {} widget on {}.{}",
                request.getWidget() == null ? null : request.getWidget().getWidgetType(),
                request.getWidget() == null ? null : request.getWidget().getSchemaName(),
                request.getWidget() == null ? null : request.getWidget().getTableName());
        return request;
    }

    private static List<ColumnMeta> resolveColumns(CompileRequest request, Path schemaFile) throws IOException {
        if (schemaFile == null) {
            return request.getColumns() == null ? List.of() : request.getColumns();
        }
        DatabaseSchema schema = SchemaParser.parseDDL(schemaFile);
        WidgetDescriptor widget = request.getWidget();
        Table table = schema.findTable(widget.getSchemaName(), widget.getTableName())
                .orElseThrow(() -> new ConfigException("Table '" + widget.getTableName()
                        + "' not found in schema file " + schemaFile));
        log.debug("Using {} columns from {}", table.getColumns().size(), table.getQualifiedName());
        return table.getColumns();
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    static ObjectMapper mapper(OutputFormat format) {
        ObjectMapper mapper = format == OutputFormat.YAML ? new ObjectMapper(new YAMLFactory()) : new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    private static void enableDebugLogging() {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.DEBUG);
    }

    static class CliOptions {
        Path requestFile;
        Path schemaFile;
        Path outputFile;
        Path configFile;
        String now;
        OutputFormat format = OutputFormat.JSON;
        boolean verbose;
    }
}
