package com.snqlsdk.validation;

import com.snqlsdk.exception.SchemaValidationException;
import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.FunctionCall;
import com.snqlsdk.expression.Op;
import com.snqlsdk.logical.Entity;
import com.snqlsdk.logical.Join;
import com.snqlsdk.logical.Query;
import com.snqlsdk.logical.Relationship;
import com.snqlsdk.logical.Storage;
import com.snqlsdk.metrics.ArithmeticOperator;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.Metric;
import com.snqlsdk.metrics.MetricsQuery;
import com.snqlsdk.metrics.Timeseries;
import com.snqlsdk.schema.EntityModel;
import com.snqlsdk.test.TestBase;
import com.snqlsdk.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SchemaValidator}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Validation
@DisplayName("Schema Validator Tests")
public class SchemaValidatorTest extends TestBase {

    private static final EntityModel EVENTS_MODEL = EntityModel.builder("events")
        .required("project_id")
        .column("event_id")
        .column("tags")
        .timeColumn("timestamp")
        .build();

    private static final LocalDateTime START = LocalDateTime.of(2021, 1, 1, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2021, 2, 1, 0, 0);

    private static final Entity EVENTS = new Entity("events", null, null, EVENTS_MODEL);

    private static Condition timeFrom(Column time) {
        return Condition.of(time, Op.GTE, START);
    }

    private static Condition timeTo(Column time) {
        return Condition.of(time, Op.LT, END);
    }

    private static Query eventsQuery(Expression... where) {
        return new Query(EVENTS).setSelect(new Column("event_id")).setWhere(Arrays.asList(where));
    }

    private static List<String> violations(Query query) {
        return assertThrows(SchemaValidationException.class, () -> SchemaValidator.validate(query)).getViolations();
    }

    // ==================== Single entity ====================

    @Nested
    @DisplayName("Single entity")
    class SingleEntityTests {

        private final Column projectId = new Column("project_id");
        private final Column timestamp = new Column("timestamp");

        @Test
        @DisplayName("A query meeting every requirement passes")
        void testValid() {
            Query query = eventsQuery(Condition.of(projectId, Op.IN, List.of(1, 2)), timeFrom(timestamp), timeTo(timestamp))
                .setSelect(new Column("event_id"), new Column("tags[environment]"));

            assertThatCode(() -> SchemaValidator.validate(query)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Unknown columns are reported")
        void testUnknownColumn() {
            Query query = eventsQuery(Condition.of(projectId, Op.EQ, 1), timeFrom(timestamp), timeTo(timestamp))
                .setSelect(new Column("foo"));

            assertThat(violations(query)).containsExactly("entity 'events' does not support the column 'foo'");
        }

        @Test
        @DisplayName("Storages with a data model are checked like entities")
        void testStorageModel() {
            Storage storage = new Storage("events", null, EVENTS_MODEL);
            Query valid = new Query(storage)
                .setSelect(new Column("event_id"))
                .setWhere(Condition.of(projectId, Op.EQ, 1), timeFrom(timestamp), timeTo(timestamp));
            Query invalid = valid.setSelect(new Column("foo")).setWhere(timeFrom(timestamp), timeTo(timestamp));

            assertThatCode(() -> SchemaValidator.validate(valid)).doesNotThrowAnyException();
            assertThat(violations(invalid)).containsExactly(
                "entity 'events' does not support the column 'foo'",
                "where clause is missing required condition(s) on column(s) 'project_id'");
            assertThatCode(() -> SchemaValidator.validate(invalid.setMatch(new Storage("events"))))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Required columns need an equality or membership filter")
        void testMissingRequired() {
            Query query = eventsQuery(Condition.of(projectId, Op.GT, 1), timeFrom(timestamp), timeTo(timestamp));

            assertThat(violations(query))
                .containsExactly("where clause is missing required condition(s) on column(s) 'project_id'");
        }

        @Test
        @DisplayName("The time column needs both bounds")
        void testMissingTimeBound() {
            Query query = eventsQuery(Condition.of(projectId, Op.EQ, 1), timeFrom(timestamp));

            assertThat(violations(query))
                .containsExactly("where clause is missing condition(s) on time column 'timestamp' with operator(s) '<'");
        }

        @Test
        @DisplayName("All violations are reported together")
        void testAllViolations() {
            logStep("Given: a query with an unknown column and no where clause");
            Query query = new Query(EVENTS).setSelect(new Column("foo"));

            logStep("When: validating against the schema");
            SchemaValidationException error = assertThrows(
                SchemaValidationException.class, () -> SchemaValidator.validate(query));
            logData("Violations", error.getViolations());

            logStep("Then: every violation is listed");
            assertThat(error.getEntity()).isEqualTo("events");
            assertThat(error.getViolations()).containsExactly(
                "entity 'events' does not support the column 'foo'",
                "where clause is missing required condition(s) on column(s) 'project_id'",
                "where clause is missing condition(s) on time column 'timestamp' with operator(s) '>=', '<'");
            assertThat(error.getMessage()).startsWith("Schema validation failed for entity 'events': ");
            assertThat(error.getTechnicalMessage()).contains("Violations: 3");
        }

        @Test
        @DisplayName("Conditions inside OR groups do not satisfy requirements")
        void testOrDoesNotCount() {
            Query query = eventsQuery(
                BooleanCondition.or(Condition.of(projectId, Op.EQ, 1), Condition.of(projectId, Op.EQ, 2)),
                timeFrom(timestamp), timeTo(timestamp));

            assertThat(violations(query))
                .containsExactly("where clause is missing required condition(s) on column(s) 'project_id'");
        }

        @Test
        @DisplayName("Conditions inside AND groups satisfy requirements")
        void testNestedAndCounts() {
            Query query = eventsQuery(
                BooleanCondition.and(Condition.of(projectId, Op.EQ, 1),
                                     BooleanCondition.and(timeFrom(timestamp), timeTo(timestamp))));

            assertThatCode(() -> SchemaValidator.validate(query)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Select aliases are not schema columns")
        void testAliasReference() {
            Query query = eventsQuery(Condition.of(projectId, Op.EQ, 1), timeFrom(timestamp), timeTo(timestamp))
                .setSelect(FunctionCall.of("count").as("total"))
                .setHaving(Condition.of(new Column("total"), Op.GT, 1));

            assertThatCode(() -> SchemaValidator.validate(query)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Entities without a model are not checked")
        void testNoModel() {
            Query query = new Query(new Entity("events")).setSelect(new Column("anything"));

            assertThatCode(() -> SchemaValidator.validate(query)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("A valid query serializes with its time bounds")
        void testSerializeWithModel() {
            EntityModel model = EntityModel.builder("metrics")
                .required("required1")
                .required("required2")
                .column("value")
                .timeColumn("time")
                .build();
            Column time = new Column("time");
            Query query = new Query(new Entity("metrics", null, null, model))
                .setSelect(new Column("value"))
                .setWhere(Condition.of(new Column("required1"), Op.IN, List.of(1, 2)),
                          Condition.of(new Column("required2"), Op.EQ, "x"),
                          timeFrom(time), timeTo(time));

            assertThat(query.serialize()).isEqualTo(
                "MATCH (metrics) SELECT value WHERE required1 IN (1, 2) AND required2 = 'x' " +
                "AND time >= toDateTime('2021-01-01T00:00:00.000000') " +
                "AND time < toDateTime('2021-02-01T00:00:00.000000')");
        }
    }

    // ==================== Joins and subqueries ====================

    @Nested
    @DisplayName("Joins and subqueries")
    class CompositeTests {

        private final Entity events = new Entity("events", "e", null, EVENTS_MODEL);
        private final Entity groups = new Entity("groupedmessage", "g");
        private final Join join = new Join(List.of(new Relationship(events, "grouped", groups)));

        private List<Expression> eventsWhere() {
            List<Expression> where = new ArrayList<>();
            where.add(Condition.of(new Column("project_id", events), Op.EQ, 1));
            where.add(timeFrom(new Column("timestamp", events)));
            where.add(timeTo(new Column("timestamp", events)));
            return where;
        }

        @Test
        @DisplayName("A join with qualified columns passes")
        void testValidJoin() {
            Query query = new Query(join)
                .setSelect(new Column("event_id", events), new Column("id", groups))
                .setWhere(eventsWhere());

            assertThatCode(() -> SchemaValidator.validate(query)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Join columns must be qualified")
        void testUnqualifiedColumn() {
            Query query = new Query(join).setSelect(new Column("event_id")).setWhere(eventsWhere());

            assertThat(violations(query)).contains("column 'event_id' must be qualified by an entity of the join");
        }

        @Test
        @DisplayName("Join columns must use an alias of the join")
        void testUnknownAlias() {
            Query query = new Query(join)
                .setSelect(new Column("event_id", new Entity("events", "x")))
                .setWhere(eventsWhere());

            assertThat(violations(query)).contains("column 'event_id' refers to unknown entity alias 'x'");
        }

        @Test
        @DisplayName("Requirements are checked per entity alias")
        void testJoinRequirements() {
            Query query = new Query(join).setSelect(new Column("event_id", events));

            assertThat(violations(query)).containsExactly(
                "where clause is missing required condition(s) on column(s) 'project_id' for entity alias 'e'",
                "where clause is missing condition(s) on time column 'timestamp' with operator(s) '>=', '<' " +
                "for entity alias 'e'");
        }

        @Test
        @DisplayName("Outer queries may only use what the inner query selects")
        void testSubquery() {
            Query inner = new Query(new Entity("events"))
                .setSelect(FunctionCall.of("count").as("c"), new Column("project_id"))
                .setGroupby(new Column("project_id"));
            Query valid = new Query(inner).setSelect(new Column("project_id"), FunctionCall.of("avg", new Column("c")).as("a"));
            Query invalid = new Query(inner).setSelect(new Column("event_id"));

            assertThatCode(() -> SchemaValidator.validate(valid)).doesNotThrowAnyException();
            assertThat(violations(invalid)).containsExactly("column 'event_id' is not selected by the inner query");
        }
    }

    // ==================== Metrics ====================

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        private final EntityModel distributions = EntityModel.builder("generic_metrics_distributions")
            .column("transaction")
            .column("environment")
            .timeColumn("timestamp")
            .build();
        private final Map<String, EntityModel> models = Map.of("generic_metrics_distributions", distributions);

        private Timeseries timeseries(String entity) {
            return new Timeseries(new Metric("transaction.duration", null, null, entity), "sum");
        }

        private List<String> metricsViolations(MetricsQuery query) {
            return assertThrows(SchemaValidationException.class,
                                () -> SchemaValidator.validate(query, models)).getViolations();
        }

        @Test
        @DisplayName("Known tags on a bound metric pass")
        void testValid() {
            Timeseries bound = timeseries("generic_metrics_distributions")
                .setFilters(List.of(Condition.of(new Column("environment"), Op.EQ, "prod")))
                .setGroupby(List.of(new Column("transaction")));

            assertThatCode(() -> SchemaValidator.validate(new MetricsQuery().setQuery(bound), models))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Formula filters apply to the timeseries below")
        void testInheritedTags() {
            Formula formula = Formula.of(ArithmeticOperator.DIVIDE,
                    timeseries("generic_metrics_distributions"), timeseries("generic_metrics_distributions"))
                .setGroupby(List.of(new Column("release")));

            assertThat(metricsViolations(new MetricsQuery().setQuery(formula))).containsExactly(
                "entity 'generic_metrics_distributions' does not support the tag 'release'",
                "entity 'generic_metrics_distributions' does not support the tag 'release'");
        }

        @Test
        @DisplayName("Unbound metrics and unknown entities are reported")
        void testBinding() {
            Formula formula = Formula.of(ArithmeticOperator.PLUS, timeseries(null), timeseries("other_entity"));

            assertThat(metricsViolations(new MetricsQuery().setQuery(formula))).containsExactly(
                "metric 'transaction.duration' is not bound to an entity",
                "no data model for entity 'other_entity' of metric 'transaction.duration'");
        }
    }
}
