package com.snqlsdk.parser;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.exception.MqlParseException;
import com.snqlsdk.expression.AliasedExpression;
import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.BooleanOp;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.Op;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.generator.MqlPrinter;
import com.snqlsdk.metrics.ArithmeticOperator;
import com.snqlsdk.metrics.Constant;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.MQLContext;
import com.snqlsdk.metrics.Metric;
import com.snqlsdk.metrics.MetricsExpression;
import com.snqlsdk.metrics.MetricsQuery;
import com.snqlsdk.metrics.MetricsScope;
import com.snqlsdk.metrics.Rollup;
import com.snqlsdk.metrics.Timeseries;
import com.snqlsdk.test.TestBase;
import com.snqlsdk.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MqlParser}: grammar coverage, error reporting, context
 * merging and print/parse round trips.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Parser
@DisplayName("MQL Parser Tests")
public class MqlParserTest extends TestBase {

    private static final Metric DURATION = Metric.ofPublicName("transaction.duration");
    private static final Metric DURATION_MRI = Metric.ofMri("d:transactions/duration@millisecond");

    private static Condition eq(String tag, String value) {
        return new Condition(new Column(tag), Op.EQ, ScalarLiteral.of(value));
    }

    private static Timeseries sum(String metric) {
        return new Timeseries(Metric.ofPublicName(metric), "sum");
    }

    static Stream<Arguments> malformedInputs() {
        return Stream.of(
            Arguments.of("sum(foo){a}", "expected ':'"),
            Arguments.of("sum(foo){a:\"open}", "unterminated string"),
            Arguments.of("sum(foo){a:b", "expected '}'"),
            Arguments.of("sum(foo){a:[]}", "expected a tag value"),
            Arguments.of("sum(foo) by", "expected a group by column"),
            Arguments.of("42", "must reference at least one metric"),
            Arguments.of("sum(foo) + \"x\"", "string literals"));
    }

    // ==================== Timeseries ====================

    @Nested
    @DisplayName("Timeseries")
    class TimeseriesTests {

        @Test
        @DisplayName("Formula dividing a grouped timeseries by a constant")
        void testDivideByConstant() {
            logStep("Given: a grouped sum divided by 1000");
            String mql = "sum(transaction.duration){} by (project_id) / 1000";

            logStep("When: parsing");
            MetricsExpression result = MqlParser.parseExpression(mql);
            logData("Result", result);

            logStep("Then: a DIVIDE formula over the timeseries and the constant");
            Timeseries timeseries = new Timeseries(DURATION, "sum", null, null, List.of(new Column("project_id")));
            assertThat(result).isEqualTo(Formula.of(ArithmeticOperator.DIVIDE, timeseries, 1000));
            Formula formula = (Formula) result;
            assertThat(formula.parameters().get(1)).isEqualTo(Constant.of(1000));
        }

        @Test
        @DisplayName("Aggregate over a public name")
        void testPublicName() {
            MetricsExpression result = MqlParser.parseExpression("max(transaction.duration)");

            assertThat(result).isEqualTo(new Timeseries(DURATION, "max"));
        }

        @Test
        @DisplayName("Aggregate over an unquoted MRI")
        void testUnquotedMri() {
            MetricsExpression result = MqlParser.parseExpression("avg(d:transactions/duration@millisecond)");

            assertThat(result).isEqualTo(new Timeseries(DURATION_MRI, "avg"));
        }

        @Test
        @DisplayName("Backticked MRI may contain spaces")
        void testQuotedMri() {
            MetricsExpression result = MqlParser.parseExpression("sum(`d:custom/foo bar@none`)");

            assertThat(((Timeseries) result).metric()).isEqualTo(Metric.ofMri("d:custom/foo bar@none"));
        }

        @Test
        @DisplayName("Curried aggregate with filters and a single group by column")
        void testCurriedAggregate() {
            String mql = "quantiles(0.5)(d:transactions/duration@millisecond){environment:prod} by transaction";

            MetricsExpression result = MqlParser.parseExpression(mql);

            assertThat(result).isEqualTo(new Timeseries(
                DURATION_MRI, "quantiles", List.of(ScalarLiteral.of(0.5)),
                List.of(eq("environment", "prod")), List.of(new Column("transaction"))));
        }

        @Test
        @DisplayName("Curried parameters may be strings and negative numbers")
        void testMixedParameters() {
            Timeseries result = (Timeseries) MqlParser.parseExpression("histogram(\"p\", -5, 10)(transaction.duration)");

            assertThat(result.aggregateParams())
                .containsExactly(ScalarLiteral.of("p"), ScalarLiteral.of(-5L), ScalarLiteral.of(10L));
        }

        @Test
        @DisplayName("Filters inside the aggregate stay on the timeseries")
        void testInnerFilter() {
            Timeseries result = (Timeseries) MqlParser.parseExpression("sum(transaction.duration{a:b} by c)");

            assertThat(result.filters()).containsExactly(eq("a", "b"));
            assertThat(result.groupby()).containsExactly(new Column("c"));
        }

        @Test
        @DisplayName("Filters after the aggregate are placed before the inner ones")
        void testOuterFiltersPrepended() {
            Timeseries result = (Timeseries) MqlParser.parseExpression("sum(foo{a:b} by x){c:d} by y");

            assertThat(result.filters()).containsExactly(eq("c", "d"), eq("a", "b"));
            assertThat(result.groupby()).containsExactly(new Column("y"), new Column("x"));
        }
    }

    // ==================== Filters ====================

    @Nested
    @DisplayName("Filters")
    class FilterTests {

        @Test
        @DisplayName("Each filter shape maps to its operator")
        void testOperators() {
            logStep("Given: one filter of each shape");
            String mql = "sum(foo.bar){a:\"x\" AND !b:\"y\" AND c:[\"1\", \"2\"] AND !d:[e, f] " +
                         "AND g:\"pre*\" AND !h:suf*}";

            logStep("When: parsing");
            List<Expression> filters = MqlParser.parseExpression(mql).filters();
            logData("Filters", filters);

            logStep("Then: the top-level AND is split into separate filters");
            assertThat(filters).containsExactly(
                eq("a", "x"),
                new Condition(new Column("b"), Op.NEQ, ScalarLiteral.of("y")),
                new Condition(new Column("c"), Op.IN, ScalarLiteral.array(ScalarLiteral.of("1"), ScalarLiteral.of("2"))),
                new Condition(new Column("d"), Op.NOT_IN, ScalarLiteral.array(ScalarLiteral.of("e"), ScalarLiteral.of("f"))),
                new Condition(new Column("g"), Op.LIKE, ScalarLiteral.of("pre*")),
                new Condition(new Column("h"), Op.NOT_LIKE, ScalarLiteral.of("suf*")));
        }

        @Test
        @DisplayName("Parenthesized OR groups are kept as boolean conditions")
        void testOrGroup() {
            List<Expression> filters = MqlParser.parseExpression("sum(foo){(a:1 OR a:2) b:3}").filters();

            assertThat(filters).containsExactly(
                new BooleanCondition(BooleanOp.OR, List.of(eq("a", "1"), eq("a", "2"))),
                eq("b", "3"));
        }

        @Test
        @DisplayName("Top-level OR is a single filter")
        void testTopLevelOr() {
            List<Expression> filters = MqlParser.parseExpression("sum(foo){a:1 or b:2 c:3}").filters();

            assertThat(filters).containsExactly(new BooleanCondition(BooleanOp.OR, List.of(
                eq("a", "1"),
                new BooleanCondition(BooleanOp.AND, List.of(eq("b", "2"), eq("c", "3"))))));
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "sum(foo){a:1, b:2 c:3}",
            "sum(foo){a:1 AND b:2 and c:3}",
            "sum(foo){ a : 1 , b:\"2\"   c:3 }"
        })
        @DisplayName("Commas, AND and whitespace all join filters")
        void testSeparators(String mql) {
            List<Expression> filters = MqlParser.parseExpression(mql).filters();

            assertThat(filters).containsExactly(eq("a", "1"), eq("b", "2"), eq("c", "3"));
        }

        @Test
        @DisplayName("Unquoted values may contain colons and dashes")
        void testUnquotedValue() {
            List<Expression> filters = MqlParser.parseExpression("sum(foo){release:2023-01-03T10:00:00}").filters();

            assertThat(filters).containsExactly(eq("release", "2023-01-03T10:00:00"));
        }

        @Test
        @DisplayName("Quoted values are unescaped")
        void testEscapedValue() {
            List<Expression> filters = MqlParser.parseExpression(
                "sum(foo){tag:\"a \\\"quoted\\\" \\\\ value\"}").filters();

            assertThat(filters).containsExactly(eq("tag", "a \"quoted\" \\ value"));
        }

        @Test
        @DisplayName("A tag key spelled like a keyword is still a tag key")
        void testKeywordLikeTagKey() {
            List<Expression> filters = MqlParser.parseExpression("sum(foo){a:1 or:2}").filters();

            assertThat(filters).containsExactly(eq("a", "1"), eq("or", "2"));
        }
    }

    // ==================== Formulas ====================

    @Nested
    @DisplayName("Formulas")
    class FormulaTests {

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void testPrecedence() {
            MetricsExpression result = MqlParser.parseExpression("sum(a) + sum(b) * 2");

            assertThat(result).isEqualTo(Formula.of(ArithmeticOperator.PLUS,
                sum("a"), Formula.of(ArithmeticOperator.MULTIPLY, sum("b"), 2)));
        }

        @Test
        @DisplayName("Parentheses override precedence")
        void testParentheses() {
            MetricsExpression result = MqlParser.parseExpression("(sum(a) + sum(b)) * 2");

            assertThat(result).isEqualTo(Formula.of(ArithmeticOperator.MULTIPLY,
                Formula.of(ArithmeticOperator.PLUS, sum("a"), sum("b")), 2));
        }

        @Test
        @DisplayName("Operators of equal precedence associate to the left")
        void testLeftAssociative() {
            MetricsExpression result = MqlParser.parseExpression("sum(a) - sum(b) - sum(c)");

            assertThat(result).isEqualTo(Formula.of(ArithmeticOperator.MINUS,
                Formula.of(ArithmeticOperator.MINUS, sum("a"), sum("b")), sum("c")));
        }

        @Test
        @DisplayName("Unary minus negates constants and wraps expressions")
        void testUnaryMinus() {
            assertThat(MqlParser.parseExpression("sum(a) * -1"))
                .isEqualTo(Formula.of(ArithmeticOperator.MULTIPLY, sum("a"), -1));
            assertThat(MqlParser.parseExpression("sum(a) * -0.5"))
                .isEqualTo(Formula.of(ArithmeticOperator.MULTIPLY, sum("a"), -0.5));
            assertThat(MqlParser.parseExpression("-sum(a)"))
                .isEqualTo(Formula.of("negate", sum("a")));
        }

        @Test
        @DisplayName("Arbitrary function over timeseries and constants")
        void testArbitraryFunction() {
            MetricsExpression result = MqlParser.parseExpression("apdex(sum(foo), 500)");

            assertThat(result).isEqualTo(Formula.of("apdex", sum("foo"), 500));
        }

        @Test
        @DisplayName("Curried function over a timeseries")
        void testCurriedFunction() {
            Formula result = (Formula) MqlParser.parseExpression("topK(10)(sum(foo))");

            assertThat(result.function()).isEqualTo("topK");
            assertThat(result.aggregateParams()).containsExactly(ScalarLiteral.of(10L));
            assertThat(result.parameters()).containsExactly(sum("foo"));
        }

        @Test
        @DisplayName("Filters and group by on a parenthesized formula")
        void testFormulaFilters() {
            Formula result = (Formula) MqlParser.parseExpression(
                "(sum(foo) / sum(bar)){env:prod} by (transaction)");

            assertThat(result.operator()).isEqualTo(ArithmeticOperator.DIVIDE);
            assertThat(result.filters()).containsExactly(eq("env", "prod"));
            assertThat(result.groupby()).containsExactly(new Column("transaction"));
        }
    }

    // ==================== Errors ====================

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Unclosed call reports the end of input")
        void testUnclosedCall() {
            assertThatThrownBy(() -> MqlParser.parseExpression("sum(foo"))
                .isInstanceOf(MqlParseException.class)
                .hasMessageContaining("expected ')'")
                .satisfies(e -> {
                    MqlParseException parseError = (MqlParseException) e;
                    assertThat(parseError.getPosition()).isEqualTo(7);
                    assertThat(parseError.getToken()).isEqualTo("<EOF>");
                });
        }

        @Test
        @DisplayName("Trailing input is rejected with its position")
        void testTrailingInput() {
            assertThatThrownBy(() -> MqlParser.parseExpression("sum(foo) sum(bar)"))
                .isInstanceOf(MqlParseException.class)
                .hasMessageContaining("unexpected input")
                .satisfies(e -> {
                    MqlParseException parseError = (MqlParseException) e;
                    assertThat(parseError.getPosition()).isEqualTo(9);
                    assertThat(parseError.getToken()).isEqualTo("sum(bar)");
                });
        }

        @Test
        @DisplayName("A metric needs an aggregate")
        void testBareMetric() {
            assertThatThrownBy(() -> MqlParser.parseExpression("transaction.duration{a:b}"))
                .isInstanceOf(MqlParseException.class)
                .hasMessageContaining("must be wrapped in an aggregate function");
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"sum(foo){a:$var}", "sum(foo){$var}", "$metric"})
        @DisplayName("Variables are rejected")
        void testVariables(String mql) {
            assertThatThrownBy(() -> MqlParser.parseExpression(mql))
                .isInstanceOf(MqlParseException.class)
                .hasMessageContaining("Variables are not supported");
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.snqlsdk.parser.MqlParserTest#malformedInputs")
        @DisplayName("Malformed input fails with a descriptive message")
        void testMalformed(String mql, String message) {
            assertThatThrownBy(() -> MqlParser.parseExpression(mql))
                .isInstanceOf(MqlParseException.class)
                .hasMessageContaining(message);
        }

        @Test
        @DisplayName("Invalid names are reported as parse errors")
        void testInvalidColumn() {
            assertThatThrownBy(() -> MqlParser.parseExpression("sum(foo) by (1abc)"))
                .isInstanceOf(MqlParseException.class)
                .hasCauseInstanceOf(InvalidExpressionException.class);
        }

        @Test
        @DisplayName("Nesting depth is bounded")
        void testDepthLimit() {
            String mql = "(".repeat(100) + "sum(foo)" + ")".repeat(100);

            assertThatThrownBy(() -> MqlParser.parseExpression(mql))
                .isInstanceOf(MqlParseException.class)
                .hasMessageContaining("nested deeper than 64");
        }

        @Test
        @DisplayName("Moderate nesting is accepted")
        void testModerateNesting() {
            String mql = "(".repeat(20) + "sum(foo)" + ")".repeat(20);

            assertThat(MqlParser.parseExpression(mql)).isEqualTo(sum("foo"));
        }
    }

    // ==================== Context ====================

    @Nested
    @DisplayName("Context merging")
    class ContextTests {

        private MQLContext context() {
            Map<String, Object> rollup = new LinkedHashMap<>();
            rollup.put("orderby", null);
            rollup.put("granularity", 3600);
            rollup.put("interval", 3600);
            rollup.put("with_totals", null);
            Map<String, Object> scope = new LinkedHashMap<>();
            scope.put("org_ids", List.of(1));
            scope.put("project_ids", List.of(11));
            scope.put("use_case_id", "transactions");
            Map<String, Object> mappings = new LinkedHashMap<>();
            mappings.put("transaction.duration", "d:transactions/duration@millisecond");
            mappings.put("d:transactions/duration@millisecond", 123456);
            return new MQLContext("generic_metrics_distributions", "2023-01-02T03:04:05", "2023-01-16T03:04:05",
                                  rollup, scope, 100, 5, true, mappings);
        }

        @Test
        @DisplayName("Context fills in every query field")
        void testQueryFields() {
            logStep("Given: MQL and a complete context");
            MQLContext context = context();

            logStep("When: parsing with the context");
            MetricsQuery query = MqlParser.parse("sum(transaction.duration)", context);
            logData("Query", query);

            logStep("Then: time range, rollup, scope and paging come from the context");
            assertThat(query.start()).isEqualTo(LocalDateTime.of(2023, 1, 2, 3, 4, 5));
            assertThat(query.end()).isEqualTo(LocalDateTime.of(2023, 1, 16, 3, 4, 5));
            assertThat(query.rollup()).isEqualTo(Rollup.ofInterval(3600, 3600));
            assertThat(query.scope()).isEqualTo(new MetricsScope(List.of(1L), List.of(11L), "transactions"));
            assertThat(query.limit()).isEqualTo(100);
            assertThat(query.offset()).isEqualTo(5);
            assertThat(query.extrapolate()).isTrue();
            assertThat(query.indexerMappings()).containsEntry("d:transactions/duration@millisecond", 123456L);
        }

        @Test
        @DisplayName("Metrics are bound to the entity, MRI and id of the context")
        void testMetricBinding() {
            MetricsQuery query = MqlParser.parse("sum(transaction.duration) / 1000", context());

            Formula formula = (Formula) query.query();
            Timeseries timeseries = (Timeseries) formula.parameters().get(0);
            assertThat(timeseries.metric()).isEqualTo(new Metric(
                "transaction.duration", "d:transactions/duration@millisecond", 123456L,
                "generic_metrics_distributions"));
        }

        @Test
        @DisplayName("Parsed query validates and serializes with the bound MRI")
        void testSerializeAfterParse() {
            MetricsQuery query = MqlParser.parse("sum(transaction.duration){env:prod}", context());

            query.validate();
            assertThat(query.serialize()).isEqualTo("sum(d:transactions/duration@millisecond){env:\"prod\"}");
        }

        @Test
        @DisplayName("Without context only the expression is set")
        void testNoContext() {
            MetricsQuery query = MqlParser.parse("sum(foo)");

            assertThat(query.query()).isEqualTo(sum("foo"));
            assertThat(query.start()).isNull();
            assertThat(query.rollup()).isNull();
        }
    }

    // ==================== Round trip ====================

    @Nested
    @DisplayName("Round trip")
    @TestCategories.Integration
    class RoundTripTests {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "max(d:transactions/duration@millisecond){environment:\"prod\" AND !release:[\"1.0\", \"1.1\"]} by (transaction)",
            "(sum(transaction.duration) / count(transaction.duration)) by (transaction)",
            "apdex(sum(transaction.duration), 500)",
            "quantiles(0.5, 0.75)(transaction.duration){transaction:\"/api/*\"}",
            "topK(10)(sum(transaction.duration))",
            "(sum(foo) * -1)",
            "sum(`d:custom/foo bar@none`){tag:\"a \\\"b\\\"\"}",
            "sum(foo){(a:\"1\" OR a:\"2\") AND b:\"3\"}",
            "sum(foo){tag:\"a\\\\b*\"}",
            "sum(foo){tag:\"a b*\"}",
            "sum(foo){tag:\"a\\\"b*\"}",
            "sum(foo){tag:\"a\\*\"}",
            "sum(foo) by (transaction AS `tx.name`, release)"
        })
        @DisplayName("Printing a parsed canonical expression gives the same text")
        void testCanonical(String mql) {
            MetricsExpression parsed = MqlParser.parseExpression(mql);
            logData("Parsed", parsed);

            assertThat(MqlPrinter.toMql(parsed)).isEqualTo(mql);
        }

        @Test
        @DisplayName("Non-canonical input prints in canonical form")
        void testNormalization() {
            MetricsExpression parsed = MqlParser.parseExpression("sum(foo){ a : b , c:\"d\" }by(x)");

            assertThat(MqlPrinter.toMql(parsed)).isEqualTo("sum(foo){a:\"b\" AND c:\"d\"} by (x)");
        }

        @Test
        @DisplayName("Quoted wildcard values are unescaped and an escaped star stays literal")
        void testQuotedWildcards() {
            logStep("Given: LIKE values holding a backslash, a space and a quote, and an equality ending in a star");
            Timeseries timeseries = new Timeseries(Metric.ofPublicName("foo"), "sum").setFilters(List.of(
                new Condition(new Column("a"), Op.LIKE, ScalarLiteral.of("x\\y*")),
                new Condition(new Column("b"), Op.LIKE, ScalarLiteral.of("x y*")),
                new Condition(new Column("c"), Op.NOT_LIKE, ScalarLiteral.of("x\"y*")),
                eq("d", "x*")));

            logStep("When: printing and parsing back");
            String mql = MqlPrinter.toMql(timeseries);
            logData("MQL", mql);

            logStep("Then: every operator and value survives");
            assertThat(mql).contains("d:\"x\\*\"");
            assertThat(MqlParser.parseExpression(mql)).isEqualTo(timeseries);
        }

        @Test
        @DisplayName("Group by columns keep their aliases")
        void testGroupbyAlias() {
            Timeseries parsed = (Timeseries) MqlParser.parseExpression("sum(foo) by (transaction AS tx, release)");

            assertThat(parsed.groupby()).containsExactly(
                new AliasedExpression(new Column("transaction"), "tx"), new Column("release"));
            assertThatThrownBy(() -> MqlParser.parseExpression("sum(foo) by (transaction AS)"))
                .isInstanceOf(MqlParseException.class)
                .hasMessageContaining("expected an alias after AS");
        }

        @Test
        @DisplayName("Parsing a printed tree reconstructs it")
        void testTreeRoundTrip() {
            Timeseries timeseries = new Timeseries(
                DURATION_MRI, "quantiles", List.of(ScalarLiteral.of(0.95)),
                List.of(eq("environment", "prod"),
                        new Condition(new Column("release"), Op.NOT_IN,
                                      ScalarLiteral.array(ScalarLiteral.of("1.0"), ScalarLiteral.of("1.1")))),
                List.of(new Column("transaction")));
            Formula formula = Formula.of(ArithmeticOperator.DIVIDE, timeseries, 1000);

            MetricsExpression reparsed = MqlParser.parseExpression(MqlPrinter.toMql(formula));

            assertThat(reparsed).isEqualTo(formula);
        }
    }
}
