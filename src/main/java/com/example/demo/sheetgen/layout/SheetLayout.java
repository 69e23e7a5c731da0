package com.example.demo.sheetgen.layout;

import lombok.Value;

import java.util.List;

/**
 * Result of placement for one sheet.
 */
@Value
public class SheetLayout {
    String sheetName;
    List<PlannedSection> sections;
    PlacementTable placements;

    public boolean usesLocks() {
        return sections.stream().anyMatch(s -> s.getSection().usesLocks());
    }
}
