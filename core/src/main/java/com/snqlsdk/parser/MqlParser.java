package com.snqlsdk.parser;

import com.snqlsdk.config.QueryLimits;
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
import com.snqlsdk.generator.Escaping;
import com.snqlsdk.metrics.ArithmeticOperator;
import com.snqlsdk.metrics.Constant;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.FormulaParameter;
import com.snqlsdk.metrics.MQLContext;
import com.snqlsdk.metrics.Metric;
import com.snqlsdk.metrics.MetricsExpression;
import com.snqlsdk.metrics.MetricsQuery;
import com.snqlsdk.metrics.Timeseries;
import com.snqlsdk.validation.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for MQL.
 *
 * <pre>
 *   expression  := term (('+'|'-') term)*
 *   term        := unary (('*'|'/') unary)*
 *   unary       := '-'? coefficient
 *   coefficient := number | filter
 *   filter      := target ('{' filterExpr? '}')? groupBy?
 *   target      := '(' expression ')' | function
 *   function    := NAME ('(' params ')')? '(' (inner | expression (',' expression)*) ')' groupBy?
 *   inner       := metric ('{' filterExpr? '}')? groupBy?
 *   filterExpr  := filterTerm (OR filterTerm)*
 *   filterTerm  := filterFactor ((','|AND)? filterFactor)*
 *   filterFactor:= '!'? tagKey ':' tagValue | '(' filterExpr ')'
 *   groupBy     := 'by' (column | '(' column (',' column)* ')')
 *   column      := name ('AS' alias)?
 * </pre>
 *
 * <p>A function whose argument is a bare metric is an aggregate and yields a
 * {@link Timeseries}; any other function yields a {@link Formula}. A metric
 * outside an aggregate is an error. Filters and group-by columns written after
 * a function are added in front of the ones already on it, and the top-level
 * {@code AND} terms of a filter block become separate filters.
 *
 * <p>Tag values are always strings: a list makes the filter {@code IN}, a
 * trailing {@code *} makes it {@code LIKE}, and a leading {@code !} negates it.
 *
 * <p>A parser instance is used for one input only. Parsing stops at the first
 * error with an {@link MqlParseException} carrying the position and token.
 */
public final class MqlParser {

    private static final Logger logger = LoggerFactory.getLogger(MqlParser.class);

    private static final Pattern SIGNED_NUMBER = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

    private static final String NEGATE = "negate";

    private final MqlLexer lexer;
    private int depth;

    private MqlParser(String text) {
        this.lexer = new MqlLexer(text);
    }

    // ==================== Entry points ====================

    /**
     * Parses MQL into a timeseries or formula.
     *
     * @param text the MQL text
     * @return the parsed expression
     * @throws MqlParseException if the text is not valid MQL
     */
    public static MetricsExpression parseExpression(String text) {
        Objects.requireNonNull(text, "text must not be null");
        MetricsExpression expression = new MqlParser(text).parseTop();
        logger.debug("Parsed MQL '{}' into {}", text, expression.getClass().getSimpleName());
        return expression;
    }

    /**
     * Parses MQL into a metrics query holding only the expression. Time range,
     * rollup and scope must be set before the query validates.
     *
     * @param text the MQL text
     * @return the query
     * @throws MqlParseException if the text is not valid MQL
     */
    public static MetricsQuery parse(String text) {
        return new MetricsQuery().setQuery(parseExpression(text));
    }

    /**
     * Parses MQL and completes the query from a context: metrics are bound to the
     * context entity and to the ids and MRIs of its indexer mappings, and the
     * time range, rollup, scope, limit, offset and extrapolation are taken over.
     *
     * @param text the MQL text
     * @param context the out-of-grammar part of the query
     * @return the query
     * @throws MqlParseException if the text is not valid MQL
     */
    public static MetricsQuery parse(String text, MQLContext context) {
        Objects.requireNonNull(context, "context must not be null");
        MetricsExpression expression = (MetricsExpression) bind(parseExpression(text), context);

        MetricsQuery query = new MetricsQuery()
            .setQuery(expression)
            .setStart(context.startTime())
            .setEnd(context.endTime())
            .setRollup(context.toRollup())
            .setScope(context.toScope());
        if (context.limit() != null) {
            query = query.setLimit(context.limit());
        }
        if (context.offset() != null) {
            query = query.setOffset(context.offset());
        }
        if (context.extrapolate() != null) {
            query = query.setExtrapolate(context.extrapolate());
        }
        if (!context.indexerMappings().isEmpty()) {
            query = query.setIndexerMappings(context.indexerMappings());
        }
        logger.debug("Merged MQL context into parsed query (entity={})", context.entity());
        return query;
    }

    private MetricsExpression parseTop() {
        FormulaParameter result = parseArithmetic();
        if (!lexer.atEnd()) {
            throw lexer.error("unexpected input after expression");
        }
        if (!(result instanceof MetricsExpression)) {
            throw lexer.errorAt("expression must reference at least one metric", 0);
        }
        return (MetricsExpression) result;
    }

    // ==================== Arithmetic ====================

    private FormulaParameter parseArithmetic() {
        enter();
        FormulaParameter left = parseTerm();
        while (true) {
            int position = lexer.position();
            if (lexer.tryConsume('+')) {
                left = arithmetic(ArithmeticOperator.PLUS, left, parseTerm(), position);
            } else if (lexer.tryConsume('-')) {
                left = arithmetic(ArithmeticOperator.MINUS, left, parseTerm(), position);
            } else {
                break;
            }
        }
        leave();
        return left;
    }

    private FormulaParameter parseTerm() {
        FormulaParameter left = parseUnary();
        while (true) {
            int position = lexer.position();
            if (lexer.tryConsume('*')) {
                left = arithmetic(ArithmeticOperator.MULTIPLY, left, parseUnary(), position);
            } else if (lexer.tryConsume('/')) {
                left = arithmetic(ArithmeticOperator.DIVIDE, left, parseUnary(), position);
            } else {
                break;
            }
        }
        return left;
    }

    private FormulaParameter arithmetic(ArithmeticOperator operator, FormulaParameter left,
                                        FormulaParameter right, int position) {
        return build(position, () -> new Formula(operator, List.of(left, right)));
    }

    private FormulaParameter parseUnary() {
        int position = lexer.position();
        if (!lexer.tryConsume('-')) {
            return parseCoefficient();
        }
        FormulaParameter operand = parseCoefficient();
        if (operand instanceof Constant) {
            ScalarLiteral value = ((Constant) operand).value();
            return value.kind() == ScalarLiteral.Kind.INTEGER
                ? Constant.of(-value.asLong())
                : Constant.of(-value.asDouble());
        }
        return build(position, () -> new Formula(NEGATE, List.of(operand)));
    }

    private FormulaParameter parseCoefficient() {
        MqlToken number = lexer.read(MqlLexer.NUMBER, MqlToken.Type.NUMBER);
        if (number != null) {
            return numberConstant(number);
        }
        if (lexer.peek() == '"') {
            throw lexer.error("string literals are only allowed as function parameters");
        }
        return parseFilter();
    }

    private Constant numberConstant(MqlToken token) {
        try {
            if (token.text().indexOf('.') >= 0) {
                return Constant.of(Double.parseDouble(token.text()));
            }
            return Constant.of(Long.parseLong(token.text()));
        } catch (NumberFormatException e) {
            throw new MqlParseException("number out of range", token.position(), token.text(), e);
        }
    }

    // ==================== Targets ====================

    private FormulaParameter parseFilter() {
        int position = lexer.position();
        FormulaParameter target = parseTarget();
        List<Expression> filters = parseFilterBlock();
        List<Expression> groupby = parseGroupBy();
        if (filters.isEmpty() && groupby.isEmpty()) {
            return target;
        }
        if (!(target instanceof MetricsExpression)) {
            throw lexer.errorAt("filters and group by can only follow a metric expression", position);
        }
        return build(position, () -> prepend((MetricsExpression) target, filters, groupby));
    }

    private static MetricsExpression prepend(MetricsExpression target, List<Expression> filters,
                                             List<Expression> groupby) {
        MetricsExpression result = target;
        if (!filters.isEmpty()) {
            result = result.setFilters(concat(filters, result.filters()));
        }
        if (!groupby.isEmpty()) {
            result = result.setGroupby(concat(groupby, result.groupby()));
        }
        return result;
    }

    private FormulaParameter parseTarget() {
        char next = lexer.peek();
        if (next == '(') {
            lexer.expect('(');
            FormulaParameter nested = parseArithmetic();
            lexer.expect(')');
            return nested;
        }
        if (next == '$') {
            throw lexer.error("Variables are not supported");
        }

        int start = lexer.position();
        MqlToken name = lexer.read(MqlLexer.NAME, MqlToken.Type.NAME);
        if (name != null && lexer.tryConsumeRaw('(')) {
            return parseFunction(name);
        }
        lexer.reset(start);

        Metric metric = readMetric();
        if (metric != null) {
            throw lexer.errorAt("metric '" + metric.mqlName() + "' must be wrapped in an aggregate function", start);
        }
        throw lexer.error("expected a metric, a function or '('");
    }

    // Called with the lexer just past the opening parenthesis.
    private MetricsExpression parseFunction(MqlToken name) {
        List<ScalarLiteral> params = tryParseParams();
        MetricsExpression call = parseCall(name, params != null ? params : List.of());
        lexer.expect(')');
        List<Expression> groupby = parseGroupBy();
        if (groupby.isEmpty()) {
            return call;
        }
        return build(name.position(), () -> prepend(call, List.of(), groupby));
    }

    /**
     * Reads {@code params)(} of a curried call. Leaves the lexer where it was and
     * returns null when the parenthesis does not hold a parameter list followed
     * directly by a second one.
     */
    private List<ScalarLiteral> tryParseParams() {
        int start = lexer.position();
        List<ScalarLiteral> params = new ArrayList<>();
        do {
            ScalarLiteral param = readParam();
            if (param == null) {
                lexer.reset(start);
                return null;
            }
            params.add(param);
        } while (lexer.tryConsume(','));

        if (lexer.tryConsume(')') && lexer.tryConsumeRaw('(')) {
            return params;
        }
        lexer.reset(start);
        return null;
    }

    private ScalarLiteral readParam() {
        MqlToken quoted = lexer.readQuoted('"', MqlToken.Type.STRING);
        if (quoted != null) {
            return ScalarLiteral.of(unescape(quoted.text(), quoted));
        }
        MqlToken token = lexer.read(MqlLexer.UNQUOTED_VALUE, MqlToken.Type.TAG_VALUE);
        if (token == null) {
            return null;
        }
        String text = token.text();
        if (SIGNED_NUMBER.matcher(text).matches()) {
            return numberConstant(new MqlToken(MqlToken.Type.NUMBER, text, token.position())).value();
        }
        return ScalarLiteral.of(text);
    }

    private MetricsExpression parseCall(MqlToken name, List<ScalarLiteral> params) {
        int start = lexer.position();
        Metric metric = readMetric();
        char next = lexer.peek();
        if (metric != null && (next == '{' || next == ')' || next == 0 || lexer.peekKeyword("by"))) {
            List<Expression> filters = parseFilterBlock();
            List<Expression> groupby = parseGroupBy();
            if (lexer.peek() != ')') {
                throw lexer.error("expected ')'");
            }
            return build(name.position(), () -> new Timeseries(metric, name.text(), params, filters, groupby));
        }
        lexer.reset(start);

        List<FormulaParameter> arguments = new ArrayList<>();
        do {
            arguments.add(parseArithmetic());
        } while (lexer.tryConsume(','));
        return build(name.position(), () -> new Formula(name.text(), params, arguments, null, null));
    }

    // ==================== Metrics ====================

    /**
     * Reads a metric name: an MRI or a public name, either of them optionally in
     * backticks.
     *
     * @return the metric, or null if no metric name comes next
     */
    private Metric readMetric() {
        MqlToken quoted = lexer.readQuoted('`', MqlToken.Type.QUOTED_METRIC);
        if (quoted != null) {
            String name = quoted.text();
            if (Identifiers.QUOTED_MRI.matcher(name).matches()) {
                return Metric.ofMri(name);
            }
            if (Identifiers.PUBLIC_NAME.matcher(name).matches()) {
                return Metric.ofPublicName(name);
            }
            throw lexer.errorAt("'" + name + "' is neither an MRI nor a public metric name", quoted.position());
        }
        MqlToken mri = lexer.read(MqlLexer.UNQUOTED_MRI, MqlToken.Type.METRIC);
        if (mri != null) {
            return Metric.ofMri(mri.text());
        }
        MqlToken publicName = lexer.read(MqlLexer.PUBLIC_NAME, MqlToken.Type.METRIC);
        if (publicName != null) {
            return Metric.ofPublicName(publicName.text());
        }
        return null;
    }

    // ==================== Filters ====================

    private List<Expression> parseFilterBlock() {
        if (!lexer.tryConsume('{')) {
            return List.of();
        }
        if (lexer.tryConsume('}')) {
            return List.of();
        }
        Expression condition = parseFilterExpr();
        lexer.expect('}');
        if (condition instanceof BooleanCondition && ((BooleanCondition) condition).op() == BooleanOp.AND) {
            return ((BooleanCondition) condition).conditions();
        }
        return List.of(condition);
    }

    private Expression parseFilterExpr() {
        enter();
        int position = lexer.position();
        List<Expression> terms = new ArrayList<>();
        terms.add(parseFilterTerm());
        while (lexer.tryKeyword("OR", "or") != null) {
            terms.add(parseFilterTerm());
        }
        leave();
        return terms.size() == 1 ? terms.get(0) : build(position, () -> new BooleanCondition(BooleanOp.OR, terms));
    }

    private Expression parseFilterTerm() {
        int position = lexer.position();
        List<Expression> factors = new ArrayList<>();
        factors.add(parseFilterFactor());
        while (true) {
            if (lexer.tryConsume(',') || lexer.tryKeyword("AND", "and") != null) {
                factors.add(parseFilterFactor());
                continue;
            }
            char next = lexer.peek();
            if (next == '}' || next == ')' || next == 0 || lexer.peekKeyword("OR", "or")) {
                break;
            }
            factors.add(parseFilterFactor());
        }
        return factors.size() == 1
            ? factors.get(0)
            : build(position, () -> new BooleanCondition(BooleanOp.AND, factors));
    }

    private Expression parseFilterFactor() {
        if (lexer.tryConsume('(')) {
            Expression nested = parseFilterExpr();
            lexer.expect(')');
            return nested;
        }
        if (lexer.peek() == '$') {
            throw lexer.error("Variables are not supported");
        }
        boolean negated = lexer.tryConsume('!');
        MqlToken key = lexer.read(MqlLexer.TAG_KEY, MqlToken.Type.TAG_KEY);
        if (key == null) {
            throw lexer.error("expected a tag key");
        }
        lexer.expect(':');

        char next = lexer.peek();
        if (next == '$') {
            throw lexer.error("Variables are not supported");
        }
        if (next == '[') {
            ScalarLiteral values = parseTagList();
            return build(key.position(),
                () -> new Condition(new Column(key.text()), negated ? Op.NOT_IN : Op.IN, values));
        }

        boolean wildcard;
        String value;
        MqlToken quoted = lexer.readQuoted('"', MqlToken.Type.STRING);
        if (quoted != null) {
            String raw = quoted.text();
            if (raw.endsWith("*") && isEscaped(raw, raw.length() - 1)) {
                // "\*" at the end is a literal star on an equality filter
                wildcard = false;
                value = unescape(raw.substring(0, raw.length() - 2), quoted) + "*";
            } else {
                wildcard = raw.endsWith("*");
                value = unescape(raw, quoted);
            }
        } else {
            MqlToken unquoted = lexer.read(MqlLexer.UNQUOTED_VALUE, MqlToken.Type.TAG_VALUE);
            if (unquoted == null) {
                throw lexer.error("expected a tag value");
            }
            wildcard = lexer.tryConsumeRaw('*');
            value = wildcard ? unquoted.text() + "*" : unquoted.text();
        }

        Op op;
        if (wildcard) {
            op = negated ? Op.NOT_LIKE : Op.LIKE;
        } else {
            op = negated ? Op.NEQ : Op.EQ;
        }
        return build(key.position(), () -> new Condition(new Column(key.text()), op, ScalarLiteral.of(value)));
    }

    private ScalarLiteral parseTagList() {
        lexer.expect('[');
        List<ScalarLiteral> values = new ArrayList<>();
        do {
            MqlToken quoted = lexer.readQuoted('"', MqlToken.Type.STRING);
            if (quoted != null) {
                values.add(ScalarLiteral.of(unescape(quoted.text(), quoted)));
                continue;
            }
            MqlToken unquoted = lexer.read(MqlLexer.UNQUOTED_VALUE, MqlToken.Type.TAG_VALUE);
            if (unquoted == null) {
                throw lexer.error("expected a tag value");
            }
            values.add(ScalarLiteral.of(unquoted.text()));
        } while (lexer.tryConsume(','));
        lexer.expect(']');
        return ScalarLiteral.array(values);
    }

    private List<Expression> parseGroupBy() {
        if (lexer.tryKeyword("by") == null) {
            return List.of();
        }
        List<Expression> columns = new ArrayList<>();
        if (lexer.tryConsume('(')) {
            do {
                columns.add(readGroupbyColumn());
            } while (lexer.tryConsume(','));
            lexer.expect(')');
        } else {
            columns.add(readGroupbyColumn());
        }
        return columns;
    }

    private Expression readGroupbyColumn() {
        MqlToken name = lexer.read(MqlLexer.TAG_KEY, MqlToken.Type.TAG_KEY);
        if (name == null) {
            throw lexer.error("expected a group by column");
        }
        if (lexer.tryKeyword("AS", "as") == null) {
            return build(name.position(), () -> new Column(name.text()));
        }
        MqlToken alias = lexer.readQuoted('`', MqlToken.Type.NAME);
        if (alias == null) {
            alias = lexer.read(MqlLexer.NAME, MqlToken.Type.NAME);
        }
        if (alias == null) {
            throw lexer.error("expected an alias after AS");
        }
        String aliasText = alias.text();
        return build(name.position(), () -> new AliasedExpression(new Column(name.text()), aliasText));
    }

    // ==================== Helpers ====================

    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private String unescape(String text, MqlToken token) {
        try {
            return Escaping.unescape(text, Escaping.DOUBLE_QUOTE);
        } catch (IllegalArgumentException e) {
            throw new MqlParseException("invalid string: " + e.getMessage(), token.position(), token.text(), e);
        }
    }

    // Node constructors validate their input; report their failures as parse errors.
    private <T> T build(int position, Supplier<T> node) {
        try {
            return node.get();
        } catch (InvalidExpressionException e) {
            throw new MqlParseException(e.getMessage(), position, lexer.tokenAt(position), e);
        }
    }

    private void enter() {
        if (++depth > QueryLimits.MAX_PARSE_DEPTH) {
            throw lexer.error("expression is nested deeper than " + QueryLimits.MAX_PARSE_DEPTH + " levels");
        }
    }

    private void leave() {
        depth--;
    }

    private static List<Expression> concat(List<Expression> first, List<Expression> second) {
        List<Expression> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }

    // ==================== Context binding ====================

    private static FormulaParameter bind(FormulaParameter parameter, MQLContext context) {
        if (parameter instanceof Timeseries) {
            Timeseries timeseries = (Timeseries) parameter;
            return timeseries.setMetric(bindMetric(timeseries.metric(), context));
        }
        if (parameter instanceof Formula) {
            Formula formula = (Formula) parameter;
            List<FormulaParameter> bound = new ArrayList<>();
            for (FormulaParameter child : formula.parameters()) {
                bound.add(bind(child, context));
            }
            return formula.setParameters(bound);
        }
        return parameter;
    }

    private static Metric bindMetric(Metric metric, MQLContext context) {
        Map<String, Object> mappings = context.indexerMappings();
        Metric bound = metric;
        if (bound.mri() == null && mappings.get(bound.publicName()) instanceof String) {
            bound = bound.withMri((String) mappings.get(bound.publicName()));
        }
        if (bound.id() == null && bound.mri() != null && mappings.get(bound.mri()) instanceof Number) {
            bound = bound.withId(((Number) mappings.get(bound.mri())).longValue());
        }
        if (bound.entity() == null && context.entity() != null) {
            bound = bound.withEntity(context.entity());
        }
        return bound;
    }
}
