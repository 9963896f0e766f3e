package org.Fabnet.validation;

/**
 * Typed cause of a validation error.
 */
public enum ErrorKind {
    MISSING_FLOW,
    WRONG_DIRECTION,
    MISSING_NODE,
    MISSING_LINK,
    INVALID_MATERIAL,
    CONNECTIVITY_BREAK,
    PATH_NOT_FOUND,
    POC_NOT_FOUND,
    UTILITY_MISMATCH,
    MISSING_ATTRIBUTE,
    FLOW_CONFLICT,
    PATH_TOO_SHORT,
    PATH_TOO_LONG,
    LINK_COUNT_MISMATCH,
    CIRCULAR_PATH,
    TEST_EXECUTION_FAILED
}
