package com.snqlsdk.optimizer;

import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Op;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.logical.Entity;
import com.snqlsdk.logical.Query;
import com.snqlsdk.metrics.ArithmeticOperator;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.Metric;
import com.snqlsdk.metrics.MetricsExpression;
import com.snqlsdk.metrics.Timeseries;
import com.snqlsdk.test.TestBase;
import com.snqlsdk.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OrToInOptimizer}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("OR to IN Optimizer Tests")
public class OrToInOptimizerTest extends TestBase {

    private static final Column ENVIRONMENT = new Column("environment");

    private static Condition eq(Column column, Object value) {
        return Condition.of(column, Op.EQ, value);
    }

    private static Query query(Condition... where) {
        return new Query(new Entity("events")).setSelect(new Column("event_id")).setWhere(where);
    }

    @Test
    @DisplayName("Equalities on one column become a membership test")
    void testMerge() {
        logStep("Given: a three-way OR of equalities on the same column");
        Query query = new Query(new Entity("events"))
            .setSelect(new Column("event_id"))
            .setWhere(BooleanCondition.or(eq(ENVIRONMENT, "prod"), eq(ENVIRONMENT, "dev"), eq(ENVIRONMENT, "qa")));

        logStep("When: optimizing");
        Query optimized = OrToInOptimizer.optimize(query);

        logStep("Then: the group is one IN condition over a tuple");
        assertThat(optimized.where()).containsExactly(new Condition(ENVIRONMENT, Op.IN, ScalarLiteral.tuple(
            ScalarLiteral.of("prod"), ScalarLiteral.of("dev"), ScalarLiteral.of("qa"))));
        assertThat(query.where().get(0)).isInstanceOf(BooleanCondition.class);
    }

    @Test
    @DisplayName("Unchanged queries are returned as the same instance")
    void testNoChange() {
        Query plain = query(eq(ENVIRONMENT, "prod"));
        Query mixedColumns = new Query(new Entity("events"))
            .setSelect(new Column("event_id"))
            .setWhere(BooleanCondition.or(eq(ENVIRONMENT, "prod"), eq(new Column("release"), "1.0")));
        Query mixedOperators = new Query(new Entity("events"))
            .setSelect(new Column("event_id"))
            .setWhere(BooleanCondition.or(eq(ENVIRONMENT, "prod"), Condition.of(ENVIRONMENT, Op.NEQ, "dev")));

        assertThat(OrToInOptimizer.optimize(plain)).isSameAs(plain);
        assertThat(OrToInOptimizer.optimize(mixedColumns)).isSameAs(mixedColumns);
        assertThat(OrToInOptimizer.optimize(mixedOperators)).isSameAs(mixedOperators);
    }

    @Test
    @DisplayName("Groups under AND and in having are rewritten")
    void testNested() {
        Column total = new Column("total");
        Query query = new Query(new Entity("events"))
            .setSelect(new Column("event_id"))
            .setWhere(BooleanCondition.and(
                BooleanCondition.or(eq(ENVIRONMENT, "prod"), eq(ENVIRONMENT, "dev")),
                eq(new Column("project_id"), 1)))
            .setHaving(BooleanCondition.or(eq(total, 1), eq(total, 2)));

        Query optimized = OrToInOptimizer.optimize(query);

        assertThat(optimized.where()).containsExactly(BooleanCondition.and(
            new Condition(ENVIRONMENT, Op.IN, ScalarLiteral.tuple(ScalarLiteral.of("prod"), ScalarLiteral.of("dev"))),
            eq(new Column("project_id"), 1)));
        assertThat(optimized.having()).containsExactly(
            new Condition(total, Op.IN, ScalarLiteral.tuple(ScalarLiteral.of(1L), ScalarLiteral.of(2L))));
    }

    @Test
    @DisplayName("Metrics filters are rewritten at every level of a formula")
    void testMetricsExpression() {
        BooleanCondition group = BooleanCondition.or(eq(ENVIRONMENT, "prod"), eq(ENVIRONMENT, "dev"));
        Condition merged = new Condition(ENVIRONMENT, Op.IN,
            ScalarLiteral.tuple(ScalarLiteral.of("prod"), ScalarLiteral.of("dev")));
        Timeseries filtered = new Timeseries(Metric.ofPublicName("transaction.duration"), "sum")
            .setFilters(List.of(group));
        Timeseries plain = new Timeseries(Metric.ofPublicName("transaction.duration"), "count");
        Formula formula = Formula.of(ArithmeticOperator.DIVIDE, filtered, plain).setFilters(List.of(group));

        MetricsExpression optimized = OrToInOptimizer.optimize(formula);

        assertThat(optimized.filters()).containsExactly(merged);
        Formula optimizedFormula = (Formula) optimized;
        assertThat(((Timeseries) optimizedFormula.parameters().get(0)).filters()).containsExactly(merged);
        assertThat(optimizedFormula.parameters().get(1)).isSameAs(plain);
        assertThat(OrToInOptimizer.optimize(plain)).isSameAs(plain);
    }
}
