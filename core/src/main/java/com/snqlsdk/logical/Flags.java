package com.snqlsdk.logical;

import com.snqlsdk.exception.InvalidRequestException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Optional boolean switches sent alongside a query. Unset flags are omitted
 * from the request body.
 *
 * <p>Flag names on the wire: {@code totals}, {@code consistent}, {@code turbo},
 * {@code debug}, {@code dry_run}, {@code legacy}.
 */
public final class Flags {

    private static final Flags NONE = new Flags(null, null, null, null, null, null);

    private final Boolean totals;
    private final Boolean consistent;
    private final Boolean turbo;
    private final Boolean debug;
    private final Boolean dryRun;
    private final Boolean legacy;

    private Flags(Boolean totals, Boolean consistent, Boolean turbo,
                  Boolean debug, Boolean dryRun, Boolean legacy) {
        this.totals = totals;
        this.consistent = consistent;
        this.turbo = turbo;
        this.debug = debug;
        this.dryRun = dryRun;
        this.legacy = legacy;
    }

    public static Flags none() {
        return NONE;
    }

    /**
     * Builds flags from wire names.
     *
     * @param values flag name to boolean value
     * @return the flags
     * @throws InvalidRequestException on an unknown flag name or a non-boolean value
     */
    public static Flags fromMap(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        Flags flags = NONE;
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            if (value != null && !(value instanceof Boolean)) {
                throw new InvalidRequestException(name + " must be a boolean", "flags." + name);
            }
            Boolean flag = (Boolean) value;
            switch (name) {
                case "totals":
                    flags = new Flags(flag, flags.consistent, flags.turbo, flags.debug, flags.dryRun, flags.legacy);
                    break;
                case "consistent":
                    flags = new Flags(flags.totals, flag, flags.turbo, flags.debug, flags.dryRun, flags.legacy);
                    break;
                case "turbo":
                    flags = new Flags(flags.totals, flags.consistent, flag, flags.debug, flags.dryRun, flags.legacy);
                    break;
                case "debug":
                    flags = new Flags(flags.totals, flags.consistent, flags.turbo, flag, flags.dryRun, flags.legacy);
                    break;
                case "dry_run":
                    flags = new Flags(flags.totals, flags.consistent, flags.turbo, flags.debug, flag, flags.legacy);
                    break;
                case "legacy":
                    flags = new Flags(flags.totals, flags.consistent, flags.turbo, flags.debug, flags.dryRun, flag);
                    break;
                default:
                    throw new InvalidRequestException("unknown flag '" + name + "'", "flags." + name);
            }
        }
        return flags;
    }

    public Flags withTotals(boolean value) {
        return new Flags(value, consistent, turbo, debug, dryRun, legacy);
    }

    public Flags withConsistent(boolean value) {
        return new Flags(totals, value, turbo, debug, dryRun, legacy);
    }

    public Flags withTurbo(boolean value) {
        return new Flags(totals, consistent, value, debug, dryRun, legacy);
    }

    public Flags withDebug(boolean value) {
        return new Flags(totals, consistent, turbo, value, dryRun, legacy);
    }

    public Flags withDryRun(boolean value) {
        return new Flags(totals, consistent, turbo, debug, value, legacy);
    }

    public Flags withLegacy(boolean value) {
        return new Flags(totals, consistent, turbo, debug, dryRun, value);
    }

    public Boolean totals() {
        return totals;
    }

    public Boolean consistent() {
        return consistent;
    }

    public Boolean turbo() {
        return turbo;
    }

    public Boolean debug() {
        return debug;
    }

    public Boolean dryRun() {
        return dryRun;
    }

    public Boolean legacy() {
        return legacy;
    }

    /**
     * Returns the set flags keyed by wire name, in declaration order.
     *
     * @return flag map without unset flags
     */
    public Map<String, Boolean> toMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        putIfSet(map, "totals", totals);
        putIfSet(map, "consistent", consistent);
        putIfSet(map, "turbo", turbo);
        putIfSet(map, "debug", debug);
        putIfSet(map, "dry_run", dryRun);
        putIfSet(map, "legacy", legacy);
        return map;
    }

    private static void putIfSet(Map<String, Boolean> map, String name, Boolean value) {
        if (value != null) {
            map.put(name, value);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Flags)) return false;
        return toMap().equals(((Flags) obj).toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return "Flags" + toMap();
    }
}
