package com.mdn.converter.models;

/**
 * Precedence of a reference kind during cascade resolution,
 * declared from least to most specific so that the ordinal is the rank.
 */
public enum Specificity {
    SHEET_WIDE,
    FULL_LINE,
    RECT_BLOCK,
    EXPLICIT_LIST_ELEMENT,
    SINGLE_CELL;

    public int rank() {
        return ordinal();
    }

    public boolean isMoreSpecificThan(Specificity other) {
        return rank() > other.rank();
    }
}
