package org.dxworks.structogram.model;

/**
 * Names of the structural fields a node can carry.
 */
public enum Slot {
    FOLLOW("followElement"),
    TRUE_CHILD("trueChild"),
    FALSE_CHILD("falseChild"),
    CHILD("child"),
    TRY_CHILD("tryChild"),
    CATCH_CHILD("catchChild"),
    CASE("cases"),
    DEFAULT_CASE("defaultNode");

    private final String fieldName;

    Slot(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
