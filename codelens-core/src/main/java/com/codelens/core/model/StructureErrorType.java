package com.codelens.core.model;

/**
 * Kinds of structural problems reported by the structure validator.
 */
public enum StructureErrorType {
    /** Closing bracket encountered with no open bracket on the stack */
    UNMATCHED_CLOSING,

    /** Closing bracket does not pair with the most recently opened bracket */
    MISMATCHED,

    /** Opening bracket never closed before the end of the source */
    UNMATCHED_OPENING,

    /** The source contains no statement terminator at all */
    MISSING_TERMINATOR
}
