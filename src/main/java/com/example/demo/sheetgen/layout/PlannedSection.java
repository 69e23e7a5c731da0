package com.example.demo.sheetgen.layout;

import lombok.Value;

@Value
public class PlannedSection {
    ResolvedSection section;
    CellAnchor anchor;
    SectionPlacement placement;

    /**
     * First row after the last row of this section.
     */
    public int finishRow() {
        return placement.getStartRow() + placement.getDataLength();
    }
}
