package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.model.SectionConfig;

/**
 * Next-free-cell tracker shared by both layout passes and the streaming writer.
 * <p>
 * Vertical sections start in column A on the next free row. Horizontal
 * sections start on the top row in the next free column, which every
 * section moves to the right of its own span. An explicit position
 * overrides the anchor but still moves both cursors.
 */
public class LayoutCursor {
    private final boolean verticalOnly;
    private int nextRow;
    private int nextCol;

    private LayoutCursor(boolean verticalOnly) {
        this.verticalOnly = verticalOnly;
    }

    public static LayoutCursor create() {
        return new LayoutCursor(false);
    }

    /**
     * Cursor for sequential emission, where rows are never revisited.
     * Directions and explicit positions are ignored.
     */
    public static LayoutCursor verticalOnly() {
        return new LayoutCursor(true);
    }

    public CellAnchor anchorFor(ResolvedSection section) {
        SectionConfig config = section.getConfig();
        if (verticalOnly) {
            return new CellAnchor(nextRow, 0);
        }
        if (config.hasPosition()) {
            return CellAnchor.parse(config.getPosition());
        }
        if (config.isHorizontal()) {
            return new CellAnchor(0, nextCol);
        }
        return new CellAnchor(nextRow, 0);
    }

    /**
     * @param finishRow first row after the section's last row
     */
    public void advance(ResolvedSection section, CellAnchor anchor, int finishRow) {
        nextRow = Math.max(nextRow, finishRow);
        if (verticalOnly) {
            return;
        }
        nextCol = anchor.getCol() + section.span();
    }

    public int getNextRow() {
        return nextRow;
    }
}
