package org.Fabnet.validation;

public enum ValidationScope {
    FLOW,
    CONNECTIVITY,
    MATERIAL,
    QA
}
