package com.snqlsdk.validation;

import com.snqlsdk.exception.InvalidExpressionException;

import java.util.regex.Pattern;

/**
 * Character-set rules for names appearing in a query tree.
 *
 * <p>Node constructors call the {@code check*} methods eagerly and the
 * {@link StructuralValidator} re-runs them over a whole tree, so both passes
 * share one definition of every rule.
 *
 * <ul>
 *   <li>Column names: letters, digits, {@code _ . :}, with an optional
 *       subscript, e.g. {@code tags[release]}</li>
 *   <li>Aliases: a letter or {@code _} followed by letters, digits and
 *       {@code _ . : / @ + - [ ]}</li>
 *   <li>Function names: a letter followed by at least one of word characters,
 *       spaces and {@code ( ) . , + ' " : [ ] -}</li>
 *   <li>Lambda identifiers: bare identifiers</li>
 *   <li>Entity and storage names: letters and {@code _}</li>
 * </ul>
 */
public final class Identifiers {

    private Identifiers() {} // Utility class

    public static final Pattern COLUMN_NAME =
        Pattern.compile("^[a-zA-Z_](\\w|\\.|:)*(\\[([^\\[\\]]*)\\])?$");

    public static final Pattern ALIAS =
        Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_.:/@+\\-\\[\\]]*$");

    public static final Pattern BARE_IDENTIFIER =
        Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    public static final Pattern FUNCTION_NAME =
        Pattern.compile("^[a-zA-Z](\\w|[().,+'\":]| |\\[|\\]|\\-)+$");

    public static final Pattern ENTITY_NAME =
        Pattern.compile("^[a-zA-Z_]+$");

    public static final Pattern REQUEST_FIELD =
        Pattern.compile("^[a-zA-Z0-9_.+*/:\\-\\[\\]]*$");

    public static final Pattern TAG_KEY =
        Pattern.compile("^[a-zA-Z0-9_.]+$");

    /** MRI accepted inside backticks, e.g. {@code d:transactions/duration@millisecond} */
    public static final Pattern QUOTED_MRI =
        Pattern.compile("^[^:`]+:[^/`]+/[^@,`]+@[^`]+$");

    /** MRI that can be written in MQL without backticks */
    public static final Pattern UNQUOTED_MRI =
        Pattern.compile("^[^:(){}\\[\\]\"`,\\s]+:[^/(){}\\[\\]\"`,\\s]+/[^@(){}\\[\\]\"`,\\s]+@[^(){}\\[\\]\"`,\\s]+$");

    /** Metric public name, e.g. {@code transaction.duration} */
    public static final Pattern PUBLIC_NAME =
        Pattern.compile("^[a-z_]+(\\.[a-z_]+)*$");

    /**
     * Returns true if the name can be printed without a quoting delimiter.
     *
     * @param name the name to test
     * @return true for bare identifiers
     */
    public static boolean isBareIdentifier(String name) {
        return name != null && BARE_IDENTIFIER.matcher(name).matches();
    }

    public static void checkColumnName(String name) {
        if (name == null || !COLUMN_NAME.matcher(name).matches()) {
            throw new InvalidExpressionException(
                "column '" + name + "' is empty or contains invalid characters",
                "Column", "column-name");
        }
    }

    /**
     * Checks an output alias.
     *
     * @param alias the alias
     * @param node the kind of node carrying the alias, used in the error
     */
    public static void checkAlias(String alias, String node) {
        if (alias == null || alias.isEmpty()) {
            throw new InvalidExpressionException(
                "alias of " + node + " must be a non-empty string", node, "alias");
        }
        if (!ALIAS.matcher(alias).matches()) {
            throw new InvalidExpressionException(
                "alias '" + alias + "' of " + node + " contains invalid characters", node, "alias");
        }
    }

    public static void checkFunctionName(String name) {
        if (name == null || !FUNCTION_NAME.matcher(name).matches()) {
            throw new InvalidExpressionException(
                "function name '" + name + "' contains invalid characters",
                "Function", "function-name");
        }
    }

    public static void checkIdentifier(String name) {
        if (!isBareIdentifier(name)) {
            throw new InvalidExpressionException(
                "identifier '" + name + "' contains invalid characters",
                "Identifier", "identifier-name");
        }
    }

    public static void checkEntityName(String name) {
        if (name == null || !ENTITY_NAME.matcher(name).matches()) {
            throw new InvalidExpressionException(
                "'" + name + "' is not a valid entity name", "Entity", "entity-name");
        }
    }

    public static void checkStorageName(String name) {
        if (name == null || !ENTITY_NAME.matcher(name).matches()) {
            throw new InvalidExpressionException(
                "'" + name + "' is not a valid storage name", "Storage", "storage-name");
        }
    }
}
