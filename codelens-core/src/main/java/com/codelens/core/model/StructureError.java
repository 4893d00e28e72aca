package com.codelens.core.model;

import java.util.Objects;

/**
 * A single structural problem found in the raw character stream.
 *
 * <p>Which fields are meaningful depends on {@link #type()}:
 * <ul>
 *   <li>{@code UNMATCHED_CLOSING} - {@code closed} and {@code position}</li>
 *   <li>{@code MISMATCHED} - {@code opened}, {@code closed} and {@code position} (of the closing bracket)</li>
 *   <li>{@code UNMATCHED_OPENING} - {@code opened} and {@code position}</li>
 *   <li>{@code MISSING_TERMINATOR} - none; {@code position} is {@link #NO_POSITION}</li>
 * </ul>
 *
 * <p>Positions are 0-based {@code char} offsets into the source.
 *
 * @param type error kind
 * @param opened opening bracket involved, or {@code null}
 * @param closed closing bracket involved, or {@code null}
 * @param position code point offset into the source, or {@link #NO_POSITION}
 */
public record StructureError(
    StructureErrorType type,
    Character opened,
    Character closed,
    int position
) {
    /** Position value for errors that are not tied to a location. */
    public static final int NO_POSITION = -1;

    /**
     * Compact constructor with validation.
     */
    public StructureError {
        Objects.requireNonNull(type, "type must not be null");
        if (position < NO_POSITION) {
            throw new IllegalArgumentException("position must be >= -1: " + position);
        }
    }

    public static StructureError unmatchedClosing(char closed, int position) {
        return new StructureError(StructureErrorType.UNMATCHED_CLOSING, null, closed, position);
    }

    public static StructureError mismatched(char opened, char closed, int position) {
        return new StructureError(StructureErrorType.MISMATCHED, opened, closed, position);
    }

    public static StructureError unmatchedOpening(char opened, int position) {
        return new StructureError(StructureErrorType.UNMATCHED_OPENING, opened, null, position);
    }

    public static StructureError missingTerminator() {
        return new StructureError(StructureErrorType.MISSING_TERMINATOR, null, null, NO_POSITION);
    }

    /**
     * Returns the human-readable message for this error.
     *
     * @return error message, e.g. {@code Mismatched '(' and '}' at position 4}
     */
    public String message() {
        return switch (type) {
            case UNMATCHED_CLOSING -> "Unmatched closing '" + closed + "' at position " + position;
            case MISMATCHED -> "Mismatched '" + opened + "' and '" + closed + "' at position " + position;
            case UNMATCHED_OPENING -> "Unmatched opening '" + opened + "' at position " + position;
            case MISSING_TERMINATOR -> "Missing semicolon in the code.";
        };
    }
}
