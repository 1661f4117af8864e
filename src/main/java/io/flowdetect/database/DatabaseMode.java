package io.flowdetect.database;

/**
 * How detector computation uses the database.
 */
public enum DatabaseMode {
    /** Look situations up, compute and store the missing ones. */
    COMPUTE,
    /** Only look situations up; a missing situation is an error. */
    STRICT,
    /** Never consult the database. */
    DISABLED
}
