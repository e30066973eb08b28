package com.mdn.converter.services;

import com.mdn.converter.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Expands range declarations into the effective attributes of every cell.
 * <p>
 * Each declaration adds a candidate (rank, order, value) for every (cell, key) it covers.
 * The winner per (cell, key) is the candidate with the highest specificity rank, then the
 * latest document order. Keys are resolved independently: a block that only sets a color
 * does not hide a column's number format.
 */
@Service
public class CascadeResolver {

    private static final Logger logger = LoggerFactory.getLogger(CascadeResolver.class);

    private static final Comparator<Candidate> PRECEDENCE =
            Comparator.comparingInt((Candidate c) -> c.rank.rank()).thenComparingInt(c -> c.order);

    private final ReferenceAlgebra referenceAlgebra;

    public CascadeResolver(ReferenceAlgebra referenceAlgebra) {
        this.referenceAlgebra = referenceAlgebra;
    }

    /**
     * Resolves declarations given in document order; the list position is the tie-breaker.
     * Declarations that cover no cell (or name a sheet missing from {@code extents}) are inert.
     *
     * @param extents current extent of every sheet, in sheet declaration order
     */
    public EffectiveState resolve(List<Declaration> declarations, Map<String, SheetExtent> extents) {
        Map<CellCoordinate, Map<String, List<Candidate>>> candidates = new HashMap<>();
        for (int order = 0; order < declarations.size(); order++) {
            Declaration declaration = declarations.get(order);
            SheetExtent extent = extents.get(declaration.getReference().getSheet());
            if (extent == null) {
                continue;
            }
            Specificity rank = referenceAlgebra.specificityRank(declaration.getReference());
            for (CellCoordinate cell : referenceAlgebra.resolve(declaration.getReference(), extent)) {
                Map<String, List<Candidate>> byKey = candidates.computeIfAbsent(cell, k -> new LinkedHashMap<>());
                for (Map.Entry<String, Object> attribute : declaration.getAttributes().entrySet()) {
                    if (attribute.getValue() == null) {
                        continue;
                    }
                    byKey.computeIfAbsent(attribute.getKey(), k -> new ArrayList<>())
                            .add(new Candidate(rank, order, attribute.getValue()));
                }
            }
        }

        Map<CellCoordinate, Map<String, Object>> effective =
                new TreeMap<>(CellCoordinate.inSheetOrder(new ArrayList<>(extents.keySet())));
        candidates.forEach((cell, byKey) -> {
            Map<String, Object> attributes = new TreeMap<>();
            byKey.forEach((key, keyCandidates) ->
                    attributes.put(key, Collections.max(keyCandidates, PRECEDENCE).value));
            if (!attributes.isEmpty()) {
                effective.put(cell, attributes);
            }
        });
        logger.debug("Resolved {} declarations into {} cells", declarations.size(), effective.size());
        return new EffectiveState(effective);
    }

    /**
     * Declarations that contribute no candidate at all.
     */
    public List<Declaration> inertDeclarations(List<Declaration> declarations, Map<String, SheetExtent> extents) {
        List<Declaration> inert = new ArrayList<>();
        for (Declaration declaration : declarations) {
            SheetExtent extent = extents.get(declaration.getReference().getSheet());
            if (extent == null || referenceAlgebra.resolve(declaration.getReference(), extent).isEmpty()) {
                inert.add(declaration);
            }
        }
        return inert;
    }

    private static final class Candidate {
        private final Specificity rank;
        private final int order;
        private final Object value;

        private Candidate(Specificity rank, int order, Object value) {
            this.rank = rank;
            this.order = order;
            this.value = value;
        }
    }
}
