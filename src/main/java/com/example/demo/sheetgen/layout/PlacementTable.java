package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.exception.ReferenceResolutionException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Placements of the sections of one sheet, filled in declaration order.
 * Lookups of sections that have not been placed yet fail instead of
 * returning empty coordinates, so only backward references resolve.
 */
public class PlacementTable {
    private final Map<String, SectionPlacement> placements = new LinkedHashMap<>();

    public void register(SectionPlacement placement) {
        placements.put(placement.getSectionId(), placement);
    }

    public Optional<SectionPlacement> find(String sectionId) {
        return Optional.ofNullable(placements.get(sectionId));
    }

    public boolean contains(String sectionId) {
        return placements.containsKey(sectionId);
    }

    public SectionPlacement require(String sectionId) {
        SectionPlacement placement = placements.get(sectionId);
        if (placement == null) {
            throw new ReferenceResolutionException("UNKNOWN_SECTION",
                    "Section '" + sectionId + "' has not been placed before it is referenced");
        }
        return placement;
    }

    public String resolveCellAddress(String sectionId, String fieldName, int rowOffset) {
        return require(sectionId).cellAddress(fieldName, rowOffset);
    }

    public int size() {
        return placements.size();
    }
}
