package org.carball.widgetq.filter;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.widgetq.error.DateParseException;
import org.carball.widgetq.error.ValidationException;
import org.carball.widgetq.model.filter.CompiledPredicate;
import org.carball.widgetq.model.filter.FilterCondition;
import org.carball.widgetq.model.filter.FilterOperator;
import org.carball.widgetq.model.filter.LogicalOperator;
import org.carball.widgetq.model.schema.ColumnMeta;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FilterCompilerTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:00:00Z");

    private static final List<ColumnMeta> COLUMNS = List.of(
            ColumnMeta.of("name", "varchar(100)"),
            ColumnMeta.of("amount", "numeric(12,2)"),
            ColumnMeta.of("active", "boolean"),
            ColumnMeta.of("created_at", "timestamp with time zone"),
            ColumnMeta.of("order_date", "date"),
            ColumnMeta.of("payload", "jsonb"),
            ColumnMeta.of("status", "user_status"));

    private FilterCompiler compiler;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    public void setUp() {
        compiler = new FilterCompiler(DateResolver.utc(), Clock.fixed(NOW, ZoneOffset.UTC));

        logger = (Logger) LoggerFactory.getLogger(FilterCompiler.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    public void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    public void shouldCompileTextEquality() {
        CompiledPredicate predicate = compiler.compileCondition(filter("name", FilterOperator.EQ, "O'Brien"), COLUMNS);

        assertThat(predicate.sql()).isEqualTo("\"name\" = 'O''Brien'");
        assertThat(predicate.values()).containsExactly("O'Brien");
        assertThat(predicate.logicalOperator()).isEqualTo(LogicalOperator.AND);
    }

    @Test
    public void shouldCompileLikeOperators() {
        assertThat(sql(filter("name", FilterOperator.CONTAINS, "acme"))).isEqualTo("\"name\" ILIKE '%acme%'");
        assertThat(sql(filter("name", FilterOperator.STARTS_WITH, "acme"))).isEqualTo("\"name\" ILIKE 'acme%'");
        assertThat(sql(filter("name", FilterOperator.ENDS_WITH, "acme"))).isEqualTo("\"name\" ILIKE '%acme'");
    }

    @Test
    public void shouldCompileTextMembershipFromListOrCommaString() {
        assertThat(sql(filter("name", FilterOperator.IN, List.of("a", "b")))).isEqualTo("\"name\" IN ('a', 'b')");
        assertThat(sql(filter("name", FilterOperator.NOT_IN, "a, b"))).isEqualTo("\"name\" NOT IN ('a', 'b')");
    }

    @Test
    public void shouldLeaveNumbersUnquoted() {
        assertThat(sql(filter("amount", FilterOperator.GT, "100.50"))).isEqualTo("\"amount\" > 100.50");
        assertThat(sql(filter("amount", FilterOperator.IN, List.of(1, 2, 3)))).isEqualTo("\"amount\" IN (1, 2, 3)");
        assertThat(sql(filter("amount", FilterOperator.BETWEEN, List.of(10, 20))))
                .isEqualTo("\"amount\" BETWEEN 10 AND 20");
        assertThat(sql(filter("amount", FilterOperator.NOT_BETWEEN, "10,20")))
                .isEqualTo("\"amount\" NOT BETWEEN 10 AND 20");
    }

    @Test
    public void shouldCompileBooleanAndNullChecks() {
        assertThat(sql(filter("active", FilterOperator.EQ, "true"))).isEqualTo("\"active\" = TRUE");
        assertThat(sql(filter("active", FilterOperator.EQ, false))).isEqualTo("\"active\" = FALSE");
        assertThat(sql(filter("name", FilterOperator.IS_NULL, null))).isEqualTo("\"name\" IS NULL");
        assertThat(sql(filter("name", FilterOperator.NOT_NULL, null))).isEqualTo("\"name\" IS NOT NULL");
    }

    @Test
    public void shouldCompileJsonOperators() {
        assertThat(sql(filter("payload", FilterOperator.HAS_KEY, "status"))).isEqualTo("\"payload\" ? 'status'");
        assertThat(sql(filter("payload", FilterOperator.KEY_EQUALS, "status:active")))
                .isEqualTo("\"payload\" @> '{\"status\":\"active\"}'");
        assertThat(sql(filter("payload", FilterOperator.KEY_EQUALS, "count:3")))
                .isEqualTo("\"payload\" @> '{\"count\":3}'");
        assertThat(sql(filter("payload", FilterOperator.PATH_EXISTS, "$.address.city")))
                .isEqualTo("\"payload\" #> '{address,city}' IS NOT NULL");
        assertThat(sql(filter("payload", FilterOperator.CONTAINS_TEXT, "50%")))
                .isEqualTo("\"payload\"::text ILIKE '%50\\%%'");
    }

    @Test
    public void shouldExpandDateEqualityToDayRange() {
        assertThat(sql(filter("created_at", FilterOperator.EQ, "2024-03-10")))
                .isEqualTo("\"created_at\" BETWEEN '2024-03-10T00:00:00.000Z' AND '2024-03-10T23:59:59.999Z'");
        assertThat(sql(filter("created_at", FilterOperator.NEQ, "2024-03-10T15:30:00Z")))
                .isEqualTo("\"created_at\" NOT BETWEEN '2024-03-10T00:00:00.000Z' AND '2024-03-10T23:59:59.999Z'");
    }

    @Test
    public void shouldCompileDuringWithRelativeToken() {
        CompiledPredicate predicate = compiler.compileCondition(
                filter("created_at", FilterOperator.DURING, "__rel_date:last7Days"), COLUMNS, NOW);

        assertThat(predicate.sql())
                .isEqualTo("\"created_at\" BETWEEN '2024-03-07T00:00:00.000Z' AND '2024-03-13T23:59:59.999Z'");
        assertThat(predicate.operator()).isEqualTo(FilterOperator.EQ);
    }

    @Test
    public void shouldUseRangeBoundsForComparisons() {
        assertThat(sql(filter("created_at", FilterOperator.BEFORE, "__rel_date:today")))
                .isEqualTo("\"created_at\" < '2024-03-13T00:00:00.000Z'");
        assertThat(sql(filter("created_at", FilterOperator.AFTER, "__rel_date:today")))
                .isEqualTo("\"created_at\" > '2024-03-13T23:59:59.999Z'");
        assertThat(sql(filter("created_at", FilterOperator.BEFORE_OR_ON, "2024-03-10")))
                .isEqualTo("\"created_at\" <= '2024-03-10T23:59:59.999Z'");
        assertThat(sql(filter("created_at", FilterOperator.AFTER_OR_ON, "2024-03-10")))
                .isEqualTo("\"created_at\" >= '2024-03-10T00:00:00.000Z'");
    }

    @Test
    public void shouldCoverWholeEndDayInDateBetween() {
        assertThat(sql(filter("order_date", FilterOperator.BETWEEN, List.of("2024-03-01", "2024-03-05"))))
                .isEqualTo("\"order_date\" BETWEEN '2024-03-01T00:00:00.000Z' AND '2024-03-05T23:59:59.999Z'");
    }

    @Test
    public void shouldPassYearThroughAsLiteral() {
        assertThat(sql(filter("order_date", FilterOperator.EQ, "2024"))).isEqualTo("\"order_date\" = '2024'");
    }

    @Test
    public void shouldRejectUnknownColumnOnStrictPath() {
        assertThatThrownBy(() -> compiler.compileCondition(filter("missing", FilterOperator.EQ, "x"), COLUMNS))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("missing")
                .extracting("messageKey").isEqualTo("filter.columnNotFound");
    }

    @Test
    public void shouldCompileFallbackOperatorsWithoutColumnMetadata() {
        assertThat(compiler.compileCondition(filter("status", FilterOperator.NEQ, "it's"), null).sql())
                .isEqualTo("\"status\" != 'it''s'");
        assertThat(compiler.compileCondition(filter("status", FilterOperator.IS_NULL, null), List.of()).sql())
                .isEqualTo("\"status\" IS NULL");
        assertThatThrownBy(() -> compiler.compileCondition(filter("amount", FilterOperator.GT, 5), null))
                .isInstanceOf(ValidationException.class)
                .extracting("messageKey").isEqualTo("filter.operatorNotAllowed");
    }

    @Test
    public void shouldRejectIllegalOperatorOnStrictPath() {
        assertThatThrownBy(() -> compiler.compileCondition(filter("active", FilterOperator.CONTAINS, "x"), COLUMNS))
                .isInstanceOf(ValidationException.class)
                .extracting("messageKey").isEqualTo("filter.operatorNotAllowed");
    }

    @Test
    public void shouldRaiseDateParseExceptionOnStrictPath() {
        assertThatThrownBy(() -> compiler.compileCondition(filter("created_at", FilterOperator.AFTER, "soon"), COLUMNS))
                .isInstanceOf(DateParseException.class);
    }

    @Test
    public void shouldSkipMalformedConditionsAndLogWarnings() {
        List<FilterCondition> conditions = new ArrayList<>();
        conditions.add(filter("name", FilterOperator.EQ, "acme"));
        conditions.add(null);
        conditions.add(filter(null, FilterOperator.EQ, "x"));
        conditions.add(filter("name", null, "x"));
        conditions.add(filter("name", FilterOperator.EQ, "  "));
        conditions.add(filter("unknown", FilterOperator.EQ, "x"));
        conditions.add(filter("amount", FilterOperator.GT, "lots"));
        conditions.add(filter("amount", FilterOperator.BETWEEN, List.of(1)));
        conditions.add(filter("name", FilterOperator.IN, List.of()));
        conditions.add(filter("created_at", FilterOperator.AFTER, "not-a-date"));

        List<CompiledPredicate> predicates = compiler.compile(conditions, COLUMNS, NOW);

        assertThat(predicates).extracting(CompiledPredicate::sql).containsExactly("\"name\" = 'acme'");
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .hasSize(9)
                .allMatch(event -> event.getFormattedMessage().startsWith("Skipping filter condition"));
    }

    @Test
    public void shouldJoinWithEachPredicatesLogicalOperator() {
        List<FilterCondition> conditions = List.of(
                filter("name", FilterOperator.EQ, "a").toBuilder().logicalOperator(LogicalOperator.OR).build(),
                filter("name", FilterOperator.EQ, "b"),
                filter("amount", FilterOperator.GT, 5));

        assertThat(compiler.buildWhere(conditions, COLUMNS))
                .isEqualTo("WHERE \"name\" = 'a' OR \"name\" = 'b' AND \"amount\" > 5");
    }

    @Test
    public void shouldReturnEmptyWhereWhenNothingSurvives() {
        assertThat(compiler.buildWhere(List.of(filter("unknown", FilterOperator.EQ, "x")), COLUMNS)).isEmpty();
        assertThat(compiler.buildWhere(null, COLUMNS)).isEmpty();
    }

    @Test
    public void shouldCompileHavingFiltersAsNumeric() {
        List<CompiledPredicate> having = compiler.compileHaving(List.of(
                filter("value", FilterOperator.GT, "10"),
                filter("sum(amount)", FilterOperator.LTE, 500),
                filter("count", FilterOperator.EQ, "many")), NOW);

        assertThat(having).extracting(CompiledPredicate::sql)
                .containsExactly("\"value\" > 10", "SUM(\"amount\") <= 500");
    }

    @Test
    public void shouldQuoteWithBrackets() {
        FilterCompiler bracketCompiler = new FilterCompiler(DateResolver.utc(), new BracketQuotingStrategy(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(bracketCompiler.compileCondition(filter("name", FilterOperator.EQ, "x"), COLUMNS).sql())
                .isEqualTo("[name] = 'x'");
    }

    @Test
    public void shouldMatchColumnsCaseInsensitively() {
        assertThat(FilterCompiler.findColumn(COLUMNS, "NAME")).map(ColumnMeta::getName).contains("name");
        assertThat(sql(filter("Amount", FilterOperator.EQ, 1))).isEqualTo("\"amount\" = 1");
    }

    @Test
    public void shouldCompileUnrecognisedTypesAsText() {
        assertThat(sql(filter("status", FilterOperator.EQ, "active"))).isEqualTo("\"status\" = 'active'");
    }

    private String sql(FilterCondition condition) {
        return compiler.compileCondition(condition, COLUMNS, NOW).sql();
    }

    private static FilterCondition filter(String column, FilterOperator operator, Object value) {
        return FilterCondition.builder()
                .column(column)
                .operator(operator)
                .value(value)
                .config(Map.of())
                .build();
    }
}
