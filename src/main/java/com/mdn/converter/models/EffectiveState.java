package com.mdn.converter.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolved attributes per cell. A key that no declaration defines for a
 * cell is absent, never defaulted; cells with no attribute at all are absent.
 */
public final class EffectiveState {

    private final Map<CellCoordinate, Map<String, Object>> cells;

    public EffectiveState(Map<CellCoordinate, Map<String, Object>> cells) {
        Map<CellCoordinate, Map<String, Object>> copy = new LinkedHashMap<>();
        cells.forEach((cell, attributes) -> {
            if (attributes != null && !attributes.isEmpty()) {
                copy.put(cell, Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
            }
        });
        this.cells = Collections.unmodifiableMap(copy);
    }

    public static EffectiveState empty() {
        return new EffectiveState(Collections.emptyMap());
    }

    public Map<CellCoordinate, Map<String, Object>> asMap() {
        return cells;
    }

    public Set<CellCoordinate> cells() {
        return cells.keySet();
    }

    public Map<String, Object> attributesAt(CellCoordinate cell) {
        return cells.getOrDefault(cell, Collections.emptyMap());
    }

    public Object valueAt(CellCoordinate cell, String key) {
        return attributesAt(cell).get(key);
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EffectiveState && cells.equals(((EffectiveState) o).cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
