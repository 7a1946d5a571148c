package org.bimexport.model;

public enum ViewType {
    FLOOR_PLAN,
    CEILING_PLAN,
    ENGINEERING_PLAN,
    SECTION,
    ELEVATION,
    THREE_D,
    OTHER
}
