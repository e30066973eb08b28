package com.mdn.converter.models;

/**
 * Syntactic kind of a reference string. The kind, not the size of the
 * resolved cell set, decides the specificity: a degenerate block "A1:A1"
 * still ranks as a block.
 */
public enum ReferenceKind {
    SINGLE_CELL(Specificity.SINGLE_CELL),
    RECT_BLOCK(Specificity.RECT_BLOCK),
    FULL_COLUMN(Specificity.FULL_LINE),
    FULL_ROW(Specificity.FULL_LINE),
    SHEET_WIDE(Specificity.SHEET_WIDE),
    // "A1,B4,C9": comma-separated single cells
    EXPLICIT_LIST(Specificity.EXPLICIT_LIST_ELEMENT),
    // comma-separated parts of mixed kinds; ranks as its broadest part
    UNION(null);

    private final Specificity specificity;

    ReferenceKind(Specificity specificity) {
        this.specificity = specificity;
    }

    /**
     * Fixed specificity of the kind, or null for UNION whose rank depends on its parts.
     */
    public Specificity fixedSpecificity() {
        return specificity;
    }
}
