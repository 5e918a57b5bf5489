package org.carball.widgetq.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.widgetq.chart.ChartDataTransformer;
import org.carball.widgetq.chart.ChartLabelGenerator;
import org.carball.widgetq.chart.NumericTransformer;
import org.carball.widgetq.config.EngineConfig;
import org.carball.widgetq.error.ConfigException;
import org.carball.widgetq.filter.BracketQuotingStrategy;
import org.carball.widgetq.filter.DateResolver;
import org.carball.widgetq.filter.FilterCategorizer;
import org.carball.widgetq.filter.FilterCompiler;
import org.carball.widgetq.filter.PostgresQuotingStrategy;
import org.carball.widgetq.filter.QuotingStrategy;
import org.carball.widgetq.model.chart.ChartDataResult;
import org.carball.widgetq.model.filter.CompiledPredicate;
import org.carball.widgetq.model.filter.FilterCondition;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.carball.widgetq.model.trend.TrendQueryPlan;
import org.carball.widgetq.model.trend.TrendResult;
import org.carball.widgetq.model.validation.AggregationConfig;
import org.carball.widgetq.model.validation.AggregationValidationResult;
import org.carball.widgetq.model.validation.TimeAggregationCheck;
import org.carball.widgetq.model.validation.ValidationResult;
import org.carball.widgetq.model.widget.ChartConfig;
import org.carball.widgetq.model.widget.MetricConfig;
import org.carball.widgetq.model.widget.Pagination;
import org.carball.widgetq.model.widget.QueryParams;
import org.carball.widgetq.model.widget.WidgetDescriptor;
import org.carball.widgetq.model.widget.WidgetQueryConfig;
import org.carball.widgetq.query.QueryParamsBuilder;
import org.carball.widgetq.query.WidgetConfigParser;
import org.carball.widgetq.trend.MetricTrendPlanner;
import org.carball.widgetq.trend.TrendCalculator;
import org.carball.widgetq.trend.TrendFilterParser;
import org.carball.widgetq.validation.AggregationValidator;
import org.carball.widgetq.validation.MetricConfigValidator;
import org.carball.widgetq.validation.WidgetConfigValidator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Entry point that wires the compilation components from one {@link EngineConfig}.
 * Every public call that needs the current time reads the clock once.
 */
@Slf4j
public class WidgetQueryEngine {

    private final Clock clock;

    @Getter
    private final EngineConfig config;

    private final DateResolver dateResolver;
    private final FilterCompiler filterCompiler;
    private final QueryParamsBuilder queryParamsBuilder;
    private final WidgetConfigParser configParser;
    private final AggregationValidator aggregationValidator;
    private final MetricConfigValidator metricConfigValidator;
    private final WidgetConfigValidator widgetConfigValidator;
    private final ChartDataTransformer chartDataTransformer;
    private final ChartLabelGenerator labelGenerator;
    private final MetricTrendPlanner trendPlanner;
    private final TrendCalculator trendCalculator;

    public WidgetQueryEngine(Clock clock) {
        this(clock, EngineConfig.defaults());
    }

    public WidgetQueryEngine(Clock clock, EngineConfig config) {
        this.clock = clock;
        this.config = config;
        this.dateResolver = new DateResolver(config.getZone());
        this.filterCompiler = new FilterCompiler(dateResolver, quotingFor(config.getQuoting()), clock);
        this.queryParamsBuilder = new QueryParamsBuilder(filterCompiler,
                new FilterCategorizer(config.getAggregationAliases()),
                config.getDefaultPage(), config.getDefaultPageSize());
        this.configParser = new WidgetConfigParser();
        this.aggregationValidator = new AggregationValidator();
        this.metricConfigValidator = new MetricConfigValidator();
        this.widgetConfigValidator = new WidgetConfigValidator();
        this.chartDataTransformer = new ChartDataTransformer(dateResolver, new NumericTransformer(),
                config.getMaxSeries());
        this.labelGenerator = new ChartLabelGenerator(config.getLabelMaxLength());
        this.trendPlanner = new MetricTrendPlanner(queryParamsBuilder, new TrendFilterParser(dateResolver));
        this.trendCalculator = new TrendCalculator(config.getTrendStableThreshold());

        log.debug("Widget query engine ready: {}", config.getConfigurationSummary());
    }

    /**
     * Compiles a widget into query parameters. The config may be typed, a JSON string or a map.
     * A configured time bucket is passed through as is; see {@link #validateTimeAggregation}.
     */
    public QueryParams compile(WidgetDescriptor widget, Object rawConfig, Pagination pagination,
                               List<ColumnMeta> columns) {
        if (widget == null) {
            throw new ConfigException("Widget descriptor is required");
        }
        if (widget.getWidgetType() == null) {
            throw new ConfigException("Widget type is required");
        }
        Instant now = clock.instant();

        WidgetQueryConfig config = configParser.parse(widget.getWidgetType(), rawConfig);
        return queryParamsBuilder.build(widget, config, pagination, columns, now);
    }

    public WidgetQueryConfig parseConfig(WidgetDescriptor widget, Object rawConfig) {
        return configParser.parse(widget.getWidgetType(), rawConfig);
    }

    /**
     * True when the config is a metric carrying a trend filter, which calls for {@link #planTrend}.
     */
    public static boolean hasTrend(WidgetQueryConfig config) {
        return config instanceof MetricConfig metric && metric.getFilters() != null
                && metric.getFilters().stream().anyMatch(TrendFilterParser::isTrendFilter);
    }

    public List<CompiledPredicate> compileFilters(List<FilterCondition> filters, List<ColumnMeta> columns) {
        return filterCompiler.compile(filters, columns, clock.instant());
    }

    public String buildWhere(List<FilterCondition> filters, List<ColumnMeta> columns) {
        return filterCompiler.buildWhere(filters, columns, clock.instant());
    }

    public AggregationValidationResult validateAggregation(String aggregation, String metric,
                                                           List<ColumnMeta> columns) {
        return aggregationValidator.validate(aggregation, metric, columns);
    }

    public AggregationConfig autoCorrect(AggregationConfig aggregation, List<ColumnMeta> columns) {
        return aggregationValidator.autoCorrect(aggregation, columns);
    }

    public ValidationResult validateMetric(MetricConfig metric) {
        return metricConfigValidator.validate(metric);
    }

    public List<String> validateRequiredFields(WidgetDescriptor widget, Object rawConfig) {
        return widgetConfigValidator.validateRequiredFields(widget.getWidgetType(),
                configParser.parse(widget.getWidgetType(), rawConfig));
    }

    public TimeAggregationCheck validateTimeAggregation(ChartConfig chart, List<ColumnMeta> columns) {
        return widgetConfigValidator.validateTimeAggregation(chart, columns);
    }

    public ChartDataResult transform(List<Map<String, Object>> rows, ChartConfig chart) {
        return chartDataTransformer.transform(rows, chart);
    }

    public Map<String, String> labels(ChartConfig chart, List<String> seriesKeys, List<ColumnMeta> columns) {
        return labelGenerator.generateLabels(chart, seriesKeys, columns);
    }

    public TrendQueryPlan planTrend(WidgetDescriptor widget, MetricConfig metric, Pagination pagination,
                                    List<ColumnMeta> columns) {
        return trendPlanner.plan(widget, metric, pagination, columns, clock.instant());
    }

    public TrendResult calculateTrend(List<Map<String, Object>> currentRows, List<Map<String, Object>> previousRows) {
        return trendCalculator.calculate(TrendCalculator.extractMetricValue(currentRows),
                TrendCalculator.extractMetricValue(previousRows));
    }

    public TrendResult calculateTrend(double current, double previous) {
        return trendCalculator.calculate(current, previous);
    }

    static QuotingStrategy quotingFor(String style) {
        if (style != null && style.equalsIgnoreCase("bracket")) {
            return new BracketQuotingStrategy();
        }
        if (style != null && !style.equalsIgnoreCase("postgres")) {
            log.warn("Unknown quoting style '{}', using postgres quoting", style);
        }
        return new PostgresQuotingStrategy();
    }
}
