package com.devcrew.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of error categories used for root-cause analysis.
 *
 * Classification is an exact lookup on the error type name (an exception's
 * simple class name, or a synthetic type such as {@code TestFailure}).
 * Free-text error messages are never inspected.
 */
public enum ErrorKind {
    TEST_FAILURE      ("high",   "One or more generated tests failed",
                                 "Fix the implementation to satisfy the failing assertions"),
    TYPE_MISMATCH     ("medium", "A value had a different type than expected",
                                 "Add type checks or convert the value before use"),
    MISSING_KEY       ("medium", "A lookup referenced a key or element that does not exist",
                                 "Guard lookups and supply defaults for absent keys"),
    INDEX_OUT_OF_RANGE("medium", "An index exceeded the bounds of a collection",
                                 "Validate indices against the collection size"),
    MISSING_DEPENDENCY("high",   "A required class or module could not be loaded",
                                 "Declare the missing dependency and rebuild"),
    INVALID_ARGUMENT  ("low",    "An operation received an argument it cannot handle",
                                 "Validate inputs at the boundary"),
    ILLEGAL_STATE     ("medium", "An operation was invoked in the wrong state",
                                 "Check preconditions before invoking the operation"),
    PERSISTENCE       ("high",   "The persistence store rejected or failed an operation",
                                 "Check store connectivity and retry the step"),
    UNKNOWN           ("medium", "Unclassified error",
                                 "Inspect the stack trace and add a classification rule");

    private static final Map<String, ErrorKind> BY_TYPE = new HashMap<>();

    static {
        BY_TYPE.put("TestFailure",                    TEST_FAILURE);
        BY_TYPE.put("ClassCastException",             TYPE_MISMATCH);
        BY_TYPE.put("TypeError",                      TYPE_MISMATCH);
        BY_TYPE.put("NumberFormatException",          TYPE_MISMATCH);
        BY_TYPE.put("NoSuchElementException",         MISSING_KEY);
        BY_TYPE.put("KeyError",                       MISSING_KEY);
        BY_TYPE.put("NullPointerException",           MISSING_KEY);
        BY_TYPE.put("IndexOutOfBoundsException",      INDEX_OUT_OF_RANGE);
        BY_TYPE.put("ArrayIndexOutOfBoundsException", INDEX_OUT_OF_RANGE);
        BY_TYPE.put("IndexError",                     INDEX_OUT_OF_RANGE);
        BY_TYPE.put("ClassNotFoundException",         MISSING_DEPENDENCY);
        BY_TYPE.put("NoClassDefFoundError",           MISSING_DEPENDENCY);
        BY_TYPE.put("ImportError",                    MISSING_DEPENDENCY);
        BY_TYPE.put("IllegalArgumentException",       INVALID_ARGUMENT);
        BY_TYPE.put("IllegalStateException",          ILLEGAL_STATE);
        BY_TYPE.put("PersistenceException",           PERSISTENCE);
        BY_TYPE.put("DataAccessException",            PERSISTENCE);
    }

    private final String severity;
    private final String rootCause;
    private final String fixStrategy;

    ErrorKind(String severity, String rootCause, String fixStrategy) {
        this.severity    = severity;
        this.rootCause   = rootCause;
        this.fixStrategy = fixStrategy;
    }

    @JsonValue
    public String wireName()    { return name().toLowerCase(); }
    public String severity()    { return severity; }
    public String rootCause()   { return rootCause; }
    public String fixStrategy() { return fixStrategy; }

    /** Classify an error type name; unknown or blank names map to {@link #UNKNOWN}. */
    public static ErrorKind classify(String errorType) {
        if (errorType == null || errorType.isBlank()) {
            return UNKNOWN;
        }
        String simple = errorType.substring(errorType.lastIndexOf('.') + 1);
        return BY_TYPE.getOrDefault(simple, UNKNOWN);
    }

    /**
     * Classify a throwable by its own type first, then by each cause in turn.
     * The first classified type wins.
     */
    public static ErrorKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            for (Class<?> c = t.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
                ErrorKind kind = BY_TYPE.get(c.getSimpleName());
                if (kind != null) {
                    return kind;
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return UNKNOWN;
    }
}
