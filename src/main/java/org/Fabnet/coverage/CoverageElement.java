package org.Fabnet.coverage;

/**
 * Kind of network element tracked for coverage.
 */
public enum CoverageElement {
    NODE,
    LINK
}
