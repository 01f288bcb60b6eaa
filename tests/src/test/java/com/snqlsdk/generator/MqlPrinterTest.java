package com.snqlsdk.generator;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.expression.AliasedExpression;
import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Op;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.metrics.ArithmeticOperator;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.Metric;
import com.snqlsdk.metrics.MetricsQuery;
import com.snqlsdk.metrics.MetricsScope;
import com.snqlsdk.metrics.Rollup;
import com.snqlsdk.metrics.Timeseries;
import com.snqlsdk.test.TestBase;
import com.snqlsdk.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link MqlPrinter} and {@link MqlContextPrinter}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Generator
@DisplayName("MQL Printer Tests")
public class MqlPrinterTest extends TestBase {

    private static final Column TRANSACTION = new Column("transaction");

    private static Timeseries timeseries(String aggregate) {
        return new Timeseries(Metric.ofPublicName("transaction.duration"), aggregate);
    }

    // ==================== Timeseries ====================

    @Nested
    @DisplayName("Timeseries")
    class TimeseriesTests {

        @Test
        @DisplayName("MRIs print without backticks")
        void testMri() {
            Timeseries timeseries = new Timeseries(Metric.ofMri("d:transactions/duration@millisecond"), "max");

            assertThat(MqlPrinter.toMql(timeseries)).isEqualTo("max(d:transactions/duration@millisecond)");
        }

        @Test
        @DisplayName("Names outside the bare grammar are backticked")
        void testQuotedName() {
            assertThat(MqlPrinter.metricName(Metric.ofPublicName("transaction-duration")))
                .isEqualTo("`transaction-duration`");
            assertThat(MqlPrinter.metricName(Metric.ofPublicName("transaction.duration")))
                .isEqualTo("transaction.duration");
        }

        @Test
        @DisplayName("Aggregate parameters render as a curried call")
        void testAggregateParams() {
            Timeseries timeseries = new Timeseries(
                Metric.ofPublicName("transaction.duration"), "quantiles", List.of(ScalarLiteral.of(0.5)), null, null);

            assertThat(MqlPrinter.toMql(timeseries)).isEqualTo("quantiles(0.5)(transaction.duration)");
        }

        @Test
        @DisplayName("Filters encode the operator in their shape")
        void testFilters() {
            logStep("Given: one filter per supported operator");
            Timeseries timeseries = timeseries("max").setFilters(List.of(
                Condition.of(new Column("environment"), Op.EQ, "prod"),
                Condition.of(new Column("release"), Op.NEQ, "1.0"),
                Condition.of(new Column("device"), Op.NOT_IN, List.of("a", "b")),
                Condition.of(TRANSACTION, Op.LIKE, "/api/*"),
                Condition.of(new Column("project_id"), Op.EQ, 1)));

            logStep("When: rendering as MQL");
            String mql = MqlPrinter.toMql(timeseries);
            logData("MQL", mql);

            logStep("Then: negation, lists and patterns are expressed inline");
            assertThat(mql).isEqualTo(
                "max(transaction.duration){environment:\"prod\" AND !release:\"1.0\" AND " +
                "!device:[\"a\", \"b\"] AND transaction:\"/api/*\" AND project_id:1}");
        }

        @Test
        @DisplayName("Nested boolean groups are parenthesized")
        void testBooleanGroups() {
            Timeseries timeseries = timeseries("sum").setFilters(List.of(BooleanCondition.or(
                Condition.of(new Column("a"), Op.EQ, "1"),
                BooleanCondition.and(Condition.of(new Column("b"), Op.EQ, "2"), Condition.of(new Column("c"), Op.EQ, "3")))));

            assertThat(MqlPrinter.toMql(timeseries))
                .isEqualTo("sum(transaction.duration){(a:\"1\" OR (b:\"2\" AND c:\"3\"))}");
        }

        @Test
        @DisplayName("Group by columns and aliases")
        void testGroupby() {
            Timeseries timeseries = timeseries("sum")
                .setGroupby(List.of(TRANSACTION, new AliasedExpression(new Column("status_code"), "tx.status")));

            assertThat(MqlPrinter.toMql(timeseries))
                .isEqualTo("sum(transaction.duration) by (transaction, status_code AS `tx.status`)");
        }

        @Test
        @DisplayName("Range operators have no MQL form")
        void testUnsupportedOperator() {
            Timeseries timeseries = timeseries("sum")
                .setFilters(List.of(Condition.of(new Column("duration"), Op.GT, 10)));

            InvalidExpressionException e = assertThrows(InvalidExpressionException.class,
                () -> MqlPrinter.toMql(timeseries));
            assertThat(e.getRule()).isEqualTo("mql-operator");
        }
    }

    // ==================== Formulas ====================

    @Nested
    @DisplayName("Formulas")
    class FormulaTests {

        @Test
        @DisplayName("Arithmetic renders infix in parentheses")
        void testArithmetic() {
            Formula formula = Formula.of(ArithmeticOperator.DIVIDE, timeseries("sum"), timeseries("count"))
                .setGroupby(List.of(TRANSACTION));

            assertThat(MqlPrinter.toMql(formula))
                .isEqualTo("(sum(transaction.duration) / count(transaction.duration)) by (transaction)");
        }

        @Test
        @DisplayName("Constants render as numbers")
        void testConstants() {
            assertThat(MqlPrinter.toMql(Formula.of(ArithmeticOperator.MULTIPLY, timeseries("sum"), 2.5)))
                .isEqualTo("(sum(transaction.duration) * 2.5)");
            assertThat(MqlPrinter.toMql(Formula.of("apdex", timeseries("sum"), 500)))
                .isEqualTo("apdex(sum(transaction.duration), 500)");
        }

        @Test
        @DisplayName("Curried formulas and nesting")
        void testCurriedAndNested() {
            Formula topK = new Formula("topK", List.of(ScalarLiteral.of(10L)), List.of(timeseries("sum")), null, null);
            Formula nested = Formula.of(ArithmeticOperator.PLUS,
                Formula.of(ArithmeticOperator.MINUS, timeseries("max"), timeseries("min")), 1);

            assertThat(MqlPrinter.toMql(topK)).isEqualTo("topK(10)(sum(transaction.duration))");
            assertThat(MqlPrinter.toMql(nested))
                .isEqualTo("((max(transaction.duration) - min(transaction.duration)) + 1)");
        }

        @Test
        @DisplayName("Formula filters print after the closing parenthesis")
        void testFormulaFilters() {
            Formula formula = Formula.of(ArithmeticOperator.PLUS, timeseries("sum"), timeseries("max"))
                .setFilters(List.of(Condition.of(new Column("environment"), Op.EQ, "prod")));

            assertThat(MqlPrinter.toMql(formula))
                .isEqualTo("(sum(transaction.duration) + max(transaction.duration)){environment:\"prod\"}");
        }
    }

    // ==================== Queries ====================

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        private MetricsQuery query(Timeseries timeseries) {
            return new MetricsQuery()
                .setQuery(timeseries)
                .setStart(LocalDateTime.of(2023, 1, 2, 3, 4, 5))
                .setEnd(LocalDateTime.of(2023, 1, 16, 3, 4, 5))
                .setRollup(Rollup.ofInterval(3600))
                .setScope(new MetricsScope(List.of(1L), List.of(11L), "transactions"));
        }

        @Test
        @DisplayName("Serialize merges equality groups and adds the context")
        @SuppressWarnings("unchecked")
        void testSerialize() {
            Column environment = new Column("environment");
            Timeseries timeseries = timeseries("sum").setFilters(List.of(BooleanCondition.or(
                Condition.of(environment, Op.EQ, "prod"), Condition.of(environment, Op.EQ, "dev"))));

            Map<String, Object> wire = MqlPrinter.serialize(query(timeseries));

            assertThat(wire.keySet()).containsExactly("mql", "mql_context");
            assertThat(wire.get("mql")).isEqualTo("sum(transaction.duration){environment:[\"prod\", \"dev\"]}");
            Map<String, Object> context = (Map<String, Object>) wire.get("mql_context");
            assertThat(context).doesNotContainKey("entity")
                               .containsEntry("start", "2023-01-02T03:04:05")
                               .containsEntry("end", "2023-01-16T03:04:05")
                               .containsEntry("indexer_mappings", Map.of());
            assertThat(context.get("scope")).isEqualTo(MqlContextPrinter.scopeMap(
                new MetricsScope(List.of(1L), List.of(11L), "transactions")));
        }

        @Test
        @DisplayName("toMql leaves equality groups untouched")
        void testToMqlKeepsOr() {
            Column environment = new Column("environment");
            Timeseries timeseries = timeseries("sum").setFilters(List.of(BooleanCondition.or(
                Condition.of(environment, Op.EQ, "prod"), Condition.of(environment, Op.EQ, "dev"))));

            assertThat(MqlPrinter.toMql(timeseries))
                .isEqualTo("sum(transaction.duration){(environment:\"prod\" OR environment:\"dev\")}");
        }

        @Test
        @DisplayName("The context names the entity when all metrics share it")
        void testContextEntity() {
            Timeseries bound = new Timeseries(
                new Metric("transaction.duration", null, null, "generic_metrics_distributions"), "sum");

            assertThat(MqlContextPrinter.toContext(query(bound)).entity()).isEqualTo("generic_metrics_distributions");
            assertThat(MqlContextPrinter.toContext(query(timeseries("sum"))).entity()).isNull();
        }

        @Test
        @DisplayName("Rollup maps carry totals as Python-style booleans")
        void testRollupMap() {
            assertThat(MqlContextPrinter.rollupMap(Rollup.ofTotals()))
                .containsEntry("with_totals", "True")
                .containsEntry("interval", null)
                .containsEntry("granularity", null);
            assertThat(MqlContextPrinter.rollupMap(new Rollup(60, false, null, null)))
                .containsEntry("with_totals", "False")
                .containsEntry("granularity", 60);
        }

        @Test
        @DisplayName("Print shows unset sections")
        void testPrintUnset() {
            String text = MqlPrinter.print(new MetricsQuery().setLimit(10));

            assertThat(text).isEqualTo(
                "MQL <unset>\nSTART <unset>\nEND <unset>\nROLLUP <unset>\nSCOPE <unset>\nLIMIT 10");
        }
    }
}
