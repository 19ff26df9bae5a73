package com.grievancedss.resolution;

/**
 * Why two fired rules that disagree were ranked the way they were: the
 * first precedence attribute on which they differ.
 */
public enum ConflictKind {
    AUTHORITY,
    SALIENCE,
    TEMPORAL
}
