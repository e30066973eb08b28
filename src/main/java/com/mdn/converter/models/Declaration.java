package com.mdn.converter.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A (reference, attributes) pair as it appears in a FORMULAS or FORMAT block.
 * The index is the position in document order and breaks specificity ties:
 * the later declaration wins.
 */
public final class Declaration {

    /**
     * Attribute key under which a formula declaration stores its formula.
     */
    public static final String FORMULA_KEY = "value";

    private final RangeReference reference;
    private final Map<String, Object> attributes;
    private final int index;
    private final String sourceText;

    public Declaration(RangeReference reference, Map<String, Object> attributes, int index, String sourceText) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.index = index;
        this.sourceText = sourceText == null ? reference.toText() : sourceText;
    }

    public Declaration(RangeReference reference, Map<String, Object> attributes, int index) {
        this(reference, attributes, index, null);
    }

    public static Declaration formula(RangeReference reference, String formula, int index, String sourceText) {
        return new Declaration(reference, Map.of(FORMULA_KEY, formula), index, sourceText);
    }

    public RangeReference getReference() {
        return reference;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public int getIndex() {
        return index;
    }

    /**
     * The reference exactly as written in the document.
     */
    public String getSourceText() {
        return sourceText;
    }

    /**
     * Same reference coverage, attributes and position; the source spelling is ignored.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Declaration)) return false;
        Declaration that = (Declaration) o;
        return index == that.index && reference.equals(that.reference) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, attributes, index);
    }

    @Override
    public String toString() {
        return "#" + index + " " + sourceText + " -> " + attributes;
    }
}
