package org.Fabnet.validation;

/**
 * Type of the object a finding points at.
 */
public enum ObjectType {
    NODE,
    LINK,
    POC,
    EQUIPMENT,
    PATH
}
