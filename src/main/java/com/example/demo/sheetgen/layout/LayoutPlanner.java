package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.exception.ReferenceResolutionException;
import com.example.demo.sheetgen.model.SectionConfig;
import com.example.demo.sheetgen.model.SheetTemplate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * First layout pass: resolves columns, anchors, data start rows and data
 * lengths of every section of a sheet before any cell is written.
 */
@Slf4j
public class LayoutPlanner {
    private final ColumnResolver columnResolver;

    public LayoutPlanner(ColumnResolver columnResolver) {
        this.columnResolver = columnResolver;
    }

    public SheetLayout plan(SheetTemplate sheet) {
        PlacementTable placements = new PlacementTable();
        LayoutCursor cursor = LayoutCursor.create();
        List<PlannedSection> planned = new ArrayList<>();
        List<SectionConfig> sections = sheet.getSections() != null ? sheet.getSections() : List.of();

        for (SectionConfig config : sections) {
            ResolvedSection section = columnResolver.resolve(config);
            CellAnchor anchor = cursor.anchorFor(section);
            SectionPlacement placement = place(section, anchor, dataLength(section, placements));
            if (config.hasId()) {
                placements.register(placement);
            }
            PlannedSection plannedSection = new PlannedSection(section, anchor, placement);
            cursor.advance(section, anchor, plannedSection.finishRow());
            planned.add(plannedSection);
            log.debug("Placed section '{}' of sheet '{}' at {} with {} columns and {} data rows",
                    config.getId(), sheet.getName(), anchor.formatAsString(),
                    section.getColumns().size(), placement.getDataLength());
        }
        return new SheetLayout(sheet.getName(), Collections.unmodifiableList(planned), placements);
    }

    public static SectionPlacement place(ResolvedSection section, CellAnchor anchor, int dataLength) {
        return new SectionPlacement(section.getId(), anchor.getRow(), anchor.getRow() + section.leadingRows(),
                anchor.getCol(), section.fieldOffsets(), dataLength);
    }

    /**
     * Bound data length, or the data length of the first source section when
     * the section mirrors another one. Title-only sections have no data rows.
     */
    public static int dataLength(ResolvedSection section, PlacementTable placements) {
        SectionConfig config = section.getConfig();
        if (config.isTitleOnly()) {
            return 0;
        }
        if (config.getData() != null) {
            return config.getData().size();
        }
        List<String> sources = config.getSourceSections();
        if (sources != null && !sources.isEmpty()) {
            String source = sources.get(0);
            return placements.find(source)
                    .orElseThrow(() -> new ReferenceResolutionException("UNKNOWN_SOURCE_SECTION",
                            "Source section '" + source + "' of section '" + config.getId() + "' has not been placed"))
                    .getDataLength();
        }
        return 0;
    }
}
