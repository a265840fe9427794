package co.cqlgen.generators.java;

/**
 * Optional support a generated DAO needs imports for, raised by individual column mappings
 * and unioned per table.
 */
public enum ImportFlag {
    /** A column maps to {@code java.time.Instant}. */
    TIME_SUPPORT,
    /** A blob collection round-trips its elements through Jackson. */
    STRUCTURED_SERIALIZATION
}
