package org.sourcerange.api;

/**
 * Defines unique, testable error codes for the defects the range engine can detect.
 * This decouples the test logic from the message texts.
 */
public enum RangeErrorCode {
    /** The node's shape or tag matches none of the known categories. */
    MALFORMED_NODE,
    /** A metadata field required by the matched category is absent. */
    MISSING_METADATA,
    /** The tree is nested deeper than the configured maximum depth. */
    DEPTH_LIMIT_EXCEEDED
}
