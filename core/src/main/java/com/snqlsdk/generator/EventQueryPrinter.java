package com.snqlsdk.generator;

import com.snqlsdk.expression.BooleanOp;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.OrderBy;
import com.snqlsdk.logical.Entity;
import com.snqlsdk.logical.Join;
import com.snqlsdk.logical.MatchClause;
import com.snqlsdk.logical.Query;
import com.snqlsdk.logical.Storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders an event {@link Query} as event-dialect text.
 *
 * <p>Clauses are emitted in a fixed order and empty clauses are skipped:
 * <pre>
 *   MATCH (events)
 *   SELECT event_id, count() AS total
 *   BY project_id
 *   ARRAY JOIN exception_frames
 *   WHERE project_id IN (1, 2) AND timestamp &gt;= toDateTime('...')
 *   HAVING total &gt; 1
 *   ORDER BY total DESC
 *   LIMIT 1 BY project_id
 *   LIMIT 10
 *   OFFSET 0
 *   GRANULARITY 60
 *   TOTALS True
 * </pre>
 * The canonical form separates clauses by a single space; the pretty form by
 * newlines. Join queries render columns and entities with their aliases.
 */
public final class EventQueryPrinter {

    private EventQueryPrinter() {} // Utility class

    /**
     * Renders the canonical single-line form.
     *
     * @param query the query
     * @return the query text
     */
    public static String serialize(Query query) {
        return render(query, " ");
    }

    /**
     * Renders the human-readable form, one clause per line.
     *
     * @param query the query
     * @return the query text
     */
    public static String print(Query query) {
        return render(query, "\n");
    }

    private static String render(Query query, String separator) {
        Objects.requireNonNull(query, "query must not be null");
        return String.join(separator, clauses(query));
    }

    private static List<String> clauses(Query query) {
        ExpressionTranslator translator = query.match() instanceof Join
            ? ExpressionTranslator.withEntityAliases()
            : ExpressionTranslator.plain();

        List<String> clauses = new ArrayList<>();
        clauses.add("MATCH " + translateMatch(query.match(), translator));

        if (!query.select().isEmpty()) {
            clauses.add("SELECT " + translateList(query.select(), translator));
        }
        if (!query.groupby().isEmpty()) {
            clauses.add("BY " + translateList(query.groupby(), translator));
        }
        if (!query.arrayJoin().isEmpty()) {
            clauses.add("ARRAY JOIN " + translateList(query.arrayJoin(), translator));
        }
        if (!query.where().isEmpty()) {
            clauses.add("WHERE " + translateConditions(query.where(), translator));
        }
        if (!query.having().isEmpty()) {
            clauses.add("HAVING " + translateConditions(query.having(), translator));
        }
        if (!query.orderby().isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ");
            for (OrderBy orderBy : query.orderby()) {
                joiner.add(translator.translate(orderBy));
            }
            clauses.add("ORDER BY " + joiner);
        }
        if (query.limitby() != null) {
            clauses.add("LIMIT " + translator.translate(query.limitby()));
        }
        if (query.limit() != null) {
            clauses.add("LIMIT " + query.limit());
        }
        if (query.offset() != null) {
            clauses.add("OFFSET " + query.offset());
        }
        if (query.granularity() != null) {
            clauses.add("GRANULARITY " + query.granularity());
        }
        if (query.totals()) {
            clauses.add("TOTALS True");
        }
        return clauses;
    }

    private static String translateMatch(MatchClause match, ExpressionTranslator translator) {
        if (match instanceof Entity) {
            return translator.translate((Entity) match);
        } else if (match instanceof Storage) {
            return translator.translate((Storage) match);
        } else if (match instanceof Join) {
            return translator.translate((Join) match);
        } else if (match instanceof Query) {
            return "{ " + serialize((Query) match) + " }";
        }
        throw new IllegalArgumentException("Unsupported match clause: " + match.getClass().getSimpleName());
    }

    private static String translateList(List<? extends Expression> expressions, ExpressionTranslator translator) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Expression expression : expressions) {
            joiner.add(translator.translate(expression));
        }
        return joiner.toString();
    }

    // A condition list is an implicit AND
    private static String translateConditions(List<Expression> conditions, ExpressionTranslator translator) {
        StringJoiner joiner = new StringJoiner(" AND ");
        for (Expression condition : conditions) {
            joiner.add(translator.translateCondition(condition, BooleanOp.AND));
        }
        return joiner.toString();
    }
}
