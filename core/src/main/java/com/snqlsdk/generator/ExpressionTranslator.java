package com.snqlsdk.generator;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.expression.AliasedExpression;
import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.BooleanOp;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.CurriedFunction;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.FunctionCall;
import com.snqlsdk.expression.Identifier;
import com.snqlsdk.expression.Lambda;
import com.snqlsdk.expression.LimitBy;
import com.snqlsdk.expression.OrderBy;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.logical.Entity;
import com.snqlsdk.logical.Join;
import com.snqlsdk.logical.Relationship;
import com.snqlsdk.logical.Storage;
import com.snqlsdk.validation.Identifiers;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders expression nodes as event-dialect text.
 *
 * <p>Rendering rules:
 * <ul>
 *   <li>strings are single-quoted and escaped by {@link Escaping}</li>
 *   <li>dates and datetimes render as {@code toDateTime('2021-01-01T00:00:00.000000')}</li>
 *   <li>arrays render as {@code array(...)}, tuples as {@code tuple(...)}, except on the
 *       right of {@code IN}/{@code NOT IN} where a sequence renders as {@code (a, b)}</li>
 *   <li>aliases are bare identifiers when possible, backticked otherwise</li>
 *   <li>boolean groups are parenthesized only under a different boolean operator</li>
 * </ul>
 *
 * <p>Two shared instances exist: one for single-entity queries and one that
 * prefixes columns and entities with their entity alias, used for joins.
 * Instances hold no mutable state.
 */
public final class ExpressionTranslator {

    private static final DateTimeFormatter DATETIME_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS", Locale.ROOT);

    private static final ExpressionTranslator PLAIN = new ExpressionTranslator(false);
    private static final ExpressionTranslator ENTITY_ALIASES = new ExpressionTranslator(true);

    private final boolean useEntityAliases;

    private ExpressionTranslator(boolean useEntityAliases) {
        this.useEntityAliases = useEntityAliases;
    }

    /**
     * Returns the translator for single-entity queries.
     *
     * @return the shared instance
     */
    public static ExpressionTranslator plain() {
        return PLAIN;
    }

    /**
     * Returns the translator for join queries, which qualifies columns with
     * their entity alias and renders entities as {@code (alias: name)}.
     *
     * @return the shared instance
     */
    public static ExpressionTranslator withEntityAliases() {
        return ENTITY_ALIASES;
    }

    /**
     * Renders an expression without entity aliases.
     *
     * @param expression the expression
     * @return the text
     */
    public static String toText(Expression expression) {
        return PLAIN.translate(expression);
    }

    public boolean usesEntityAliases() {
        return useEntityAliases;
    }

    // ==================== Expressions ====================

    /**
     * Renders an expression.
     *
     * @param expression the expression
     * @return the text
     */
    public String translate(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");

        if (expression instanceof Column) {
            return translateColumn((Column) expression);
        } else if (expression instanceof AliasedExpression) {
            AliasedExpression aliased = (AliasedExpression) expression;
            return translateColumn(aliased.expression()) + " AS " + quoteAlias(aliased.alias());
        } else if (expression instanceof ScalarLiteral) {
            return translateLiteral((ScalarLiteral) expression);
        } else if (expression instanceof FunctionCall) {
            return translateFunction((FunctionCall) expression);
        } else if (expression instanceof CurriedFunction) {
            return translateCurried((CurriedFunction) expression);
        } else if (expression instanceof Condition) {
            return translateCondition((Condition) expression);
        } else if (expression instanceof BooleanCondition) {
            return translateBoolean((BooleanCondition) expression, null);
        } else if (expression instanceof Identifier) {
            return "`" + ((Identifier) expression).name() + "`";
        } else if (expression instanceof Lambda) {
            return translateLambda((Lambda) expression);
        }
        throw new InvalidExpressionException(
            "Unsupported expression type: " + expression.getClass().getSimpleName());
    }

    /**
     * Renders a condition or boolean group that sits directly under a boolean
     * operator, e.g. an element of a WHERE list (which is an implicit AND).
     *
     * @param condition the condition
     * @param parent the enclosing boolean operator
     * @return the text
     */
    public String translateCondition(Expression condition, BooleanOp parent) {
        if (condition instanceof BooleanCondition) {
            return translateBoolean((BooleanCondition) condition, parent);
        }
        return translate(condition);
    }

    private String translateColumn(Column column) {
        if (useEntityAliases && column.entity() != null) {
            return column.entity().alias() + "." + column.name();
        }
        return column.name();
    }

    private String translateFunction(FunctionCall function) {
        return function.name() + translateList(function.parameters()) + aliasClause(function.alias());
    }

    private String translateCurried(CurriedFunction function) {
        return function.name() +
               translateList(function.initializers()) +
               translateList(function.parameters()) +
               aliasClause(function.alias());
    }

    private String translateList(List<Expression> expressions) {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (Expression expression : expressions) {
            joiner.add(translate(expression));
        }
        return joiner.toString();
    }

    private String translateCondition(Condition condition) {
        String lhs = translate(condition.lhs());
        if (condition.op().isUnary()) {
            return lhs + " " + condition.op().token();
        }
        Expression rhs = condition.rhs();
        String rhsText;
        if (condition.op().isMembership() && rhs instanceof ScalarLiteral
                && ((ScalarLiteral) rhs).kind().isSequence()) {
            rhsText = translateElements((ScalarLiteral) rhs, "(");
        } else {
            rhsText = translate(rhs);
        }
        return lhs + " " + condition.op().token() + " " + rhsText;
    }

    private String translateBoolean(BooleanCondition condition, BooleanOp parent) {
        StringJoiner joiner = new StringJoiner(" " + condition.op().token() + " ");
        for (Expression member : condition.conditions()) {
            joiner.add(translateCondition(member, condition.op()));
        }
        String text = joiner.toString();
        if (parent != null && parent != condition.op()) {
            return "(" + text + ")";
        }
        return text;
    }

    private String translateLambda(Lambda lambda) {
        StringJoiner identifiers = new StringJoiner(", ", "(", ")");
        for (String identifier : lambda.identifiers()) {
            identifiers.add("`" + identifier + "`");
        }
        return identifiers + " -> " + translate(lambda.body());
    }

    // ==================== Literals ====================

    private String translateLiteral(ScalarLiteral literal) {
        switch (literal.kind()) {
            case NULL:
                return "NULL";
            case BOOLEAN:
                return literal.asBoolean() ? "TRUE" : "FALSE";
            case INTEGER:
                return Long.toString(literal.asLong());
            case FLOAT:
                return formatFloat(literal.asDouble());
            case STRING:
                return Escaping.quote(literal.asString(), Escaping.SINGLE_QUOTE);
            case DATE:
                return "toDateTime('" + DATETIME_FORMAT.format(literal.asDate().atStartOfDay()) + "')";
            case DATETIME:
                return "toDateTime('" + DATETIME_FORMAT.format(literal.asDateTime()) + "')";
            case ARRAY:
                return translateElements(literal, "array(");
            case TUPLE:
                return translateElements(literal, "tuple(");
            default:
                throw new InvalidExpressionException("Unsupported literal kind: " + literal.kind());
        }
    }

    private String translateElements(ScalarLiteral sequence, String prefix) {
        StringJoiner joiner = new StringJoiner(", ", prefix, ")");
        for (ScalarLiteral element : sequence.elements()) {
            joiner.add(translateLiteral(element));
        }
        return joiner.toString();
    }

    /**
     * Formats a finite double without exponent notation, keeping at least one
     * fractional digit so the value reads back as a float.
     *
     * @param value the value
     * @return the text, e.g. "1.0", "0.5", "100000000000000000000.0"
     */
    static String formatFloat(double value) {
        String text = BigDecimal.valueOf(value).toPlainString();
        return text.indexOf('.') >= 0 ? text : text + ".0";
    }

    // ==================== Clauses ====================

    public String translate(OrderBy orderBy) {
        return translate(orderBy.expression()) + " " + orderBy.direction().name();
    }

    public String translate(LimitBy limitBy) {
        StringJoiner columns = new StringJoiner(",");
        for (Column column : limitBy.columns()) {
            columns.add(translateColumn(column));
        }
        return limitBy.count() + " BY " + columns;
    }

    public String translate(Entity entity) {
        StringBuilder sb = new StringBuilder("(");
        if (useEntityAliases && entity.alias() != null) {
            sb.append(entity.alias()).append(": ");
        }
        sb.append(entity.name());
        appendSample(sb, entity.sample());
        return sb.append(')').toString();
    }

    public String translate(Storage storage) {
        StringBuilder sb = new StringBuilder("STORAGE(").append(storage.name());
        appendSample(sb, storage.sample());
        return sb.append(')').toString();
    }

    private static void appendSample(StringBuilder sb, Double sample) {
        if (sample != null) {
            String format = sample % 1 == 0 ? "%.1f" : "%f";
            sb.append(" SAMPLE ").append(String.format(Locale.ROOT, format, sample));
        }
    }

    public String translate(Relationship relationship) {
        return translate(relationship.lhs()) + " -[" + relationship.name() + "]-> " + translate(relationship.rhs());
    }

    public String translate(Join join) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Relationship relationship : join.relationships()) {
            joiner.add(translate(relationship));
        }
        return joiner.toString();
    }

    // ==================== Aliases ====================

    private static String aliasClause(String alias) {
        return alias == null ? "" : " AS " + quoteAlias(alias);
    }

    /**
     * Renders an alias bare when it is a plain identifier, in backticks otherwise.
     *
     * @param alias the alias
     * @return the rendered alias
     */
    public static String quoteAlias(String alias) {
        return Identifiers.isBareIdentifier(alias) ? alias : "`" + alias + "`";
    }
}
