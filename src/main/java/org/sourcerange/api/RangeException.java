package org.sourcerange.api;

/**
 * Thrown when a node handed to the range engine violates the metadata contract of its parser.
 * <p>
 * This is a defect in the producer of the tree, not a recoverable condition, so the exception is
 * unchecked. No partial or approximate range is ever returned in its place.
 */
public class RangeException extends RuntimeException {

    private final RangeErrorCode code;

    /**
     * Constructs a new range exception.
     * @param code The error code identifying the kind of defect.
     * @param message The detail message.
     */
    public RangeException(RangeErrorCode code, String message) {
        super(String.format("%s: %s", code, message));
        this.code = code;
    }

    /**
     * Returns the error code of this defect.
     * @return The error code.
     */
    public RangeErrorCode getCode() {
        return code;
    }

    public static RangeException malformed(String message) {
        return new RangeException(RangeErrorCode.MALFORMED_NODE, message);
    }

    public static RangeException missingMetadata(String shape, String field) {
        return new RangeException(RangeErrorCode.MISSING_METADATA,
                String.format("%s requires metadata field '%s'", shape, field));
    }
}
