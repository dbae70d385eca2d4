package io.github.cyfko.cohortql.core.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Enumeration of the leaf operators of the wire filter grammar.
 * <p>
 * Each operator is serialized under its {@link #getCode() code} as the single key of a filter
 * object, e.g. {@code {"IN": {"sex": ["Male"]}}} or {@code {"GTE": {"age_at_censor_status": 0}}}.
 * </p>
 *
 * <p><strong>Resolver operator mapping:</strong></p>
 * <pre>{@code
 * eq, in                          -> Op.IN        (value normalized to a list)
 * gt, gte, lt, lte                -> Op.GT ... Op.LTE
 * contains, startswith, endswith  -> Op.CONTAINS  (wildcards added by the query builder)
 * anything else                   -> Op.IN
 * }</pre>
 *
 * @since 1.0.0
 */
public enum Op {

    /** Set membership: "IN" */
    IN("IN", "is one of"),

    /** Greater than or equal: "GTE" */
    GTE("GTE", "is greater than or equal to"),

    /** Less than or equal: "LTE" */
    LTE("LTE", "is less than or equal to"),

    /** Strictly greater than: "GT" */
    GT("GT", "is greater than"),

    /** Strictly less than: "LT" */
    LT("LT", "is less than"),

    /** Case-insensitive text containment: "CONTAINS" */
    CONTAINS("CONTAINS", "contains");

    private final String code;
    private final String description;

    Op(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * Returns the key under which this operator appears in the wire grammar.
     *
     * @return the wire key, e.g. {@code "IN"}
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns the phrase used when describing a condition to a human reader.
     *
     * @return description phrase, e.g. {@code "is greater than"}
     */
    public String getDescription() {
        return description;
    }

    /**
     * Indicates whether this operator expects a list of values.
     *
     * @return {@code true} for {@link #IN} only
     */
    public boolean supportsMultipleValues() {
        return this == IN;
    }

    /**
     * Indicates whether this operator is one of the range bounds {@link #GTE}/{@link #LTE}.
     *
     * @return {@code true} for inclusive bound operators
     */
    public boolean isInclusiveBound() {
        return this == GTE || this == LTE;
    }

    /**
     * Finds an operator by its exact wire key.
     *
     * @param key wire key such as {@code "GTE"}
     * @return the operator, or empty if {@code key} is not a leaf operator key
     */
    public static Optional<Op> fromWireKey(String key) {
        for (Op op : values()) {
            if (op.code.equals(key)) return Optional.of(op);
        }
        return Optional.empty();
    }

    /**
     * Maps a resolver-level operator name ({@code eq}, {@code contains}, ...) to a wire operator.
     * Unknown or missing names fall back to {@link #IN}.
     *
     * @param operator the resolver operator, case-insensitive; may be {@code null}
     * @return the wire operator, never {@code null}
     */
    public static Op fromResolverOperator(String operator) {
        if (operator == null) return IN;
        switch (operator.trim().toLowerCase(Locale.ROOT)) {
            case "gt":
                return GT;
            case "gte":
                return GTE;
            case "lt":
                return LT;
            case "lte":
                return LTE;
            case "contains":
            case "startswith":
            case "endswith":
                return CONTAINS;
            default:
                return IN;
        }
    }
}
