package com.example.demo.sheetgen.renderer;

import com.example.demo.sheetgen.layout.CellAnchor;
import com.example.demo.sheetgen.layout.LayoutCursor;
import com.example.demo.sheetgen.layout.LayoutPlanner;
import com.example.demo.sheetgen.layout.PlannedSection;
import com.example.demo.sheetgen.layout.ResolvedSection;
import com.example.demo.sheetgen.layout.SheetLayout;
import com.example.demo.sheetgen.layout.StyleResolver;
import com.example.demo.sheetgen.model.SheetTemplate;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Renders fully bound sheets into an in-memory workbook.
 * <p>
 * Each sheet is laid out first ({@link LayoutPlanner}); emission then walks the
 * sections again with a fresh cursor and writes every cell. Hidden rows are
 * hidden and the sheet is protected after all rows exist.
 */
@Slf4j
public class BatchWorkbookRenderer {
    private final LayoutPlanner layoutPlanner;
    private final StyleResolver styleResolver;

    public BatchWorkbookRenderer(LayoutPlanner layoutPlanner, StyleResolver styleResolver) {
        this.layoutPlanner = layoutPlanner;
        this.styleResolver = styleResolver;
    }

    public XSSFWorkbook render(List<SheetTemplate> sheets, Map<String, Function<Object, Object>> formatters) {
        XSSFWorkbook workbook = new XSSFWorkbook();
        CellStyleCache styles = new CellStyleCache(workbook);
        for (SheetTemplate sheetTemplate : sheets) {
            renderSheet(workbook, styles, sheetTemplate, formatters);
        }
        log.debug("Rendered {} sheets using {} distinct cell styles", sheets.size(), styles.size());
        return workbook;
    }

    private void renderSheet(XSSFWorkbook workbook, CellStyleCache styles, SheetTemplate sheetTemplate,
                             Map<String, Function<Object, Object>> formatters) {
        Sheet sheet = workbook.createSheet(sheetTemplate.getName());
        SheetLayout layout = layoutPlanner.plan(sheetTemplate);

        boolean usesLocks = layout.usesLocks();
        if (usesLocks) {
            SheetProtection.unlockUnstyledCells(workbook);
        }

        TreeSet<Integer> hiddenRows = new TreeSet<>();
        SectionEmitter emitter = new SectionEmitter(sheet, styles, styleResolver, formatters,
                layout.getPlacements(), false, hiddenRows::add);

        LayoutCursor cursor = LayoutCursor.create();
        for (PlannedSection planned : layout.getSections()) {
            ResolvedSection section = planned.getSection();
            CellAnchor anchor = cursor.anchorFor(section);
            if (!anchor.equals(planned.getAnchor())) {
                throw new IllegalStateException("Section '" + section.getId() + "' re-derived anchor "
                        + anchor.formatAsString() + " but was placed at " + planned.getAnchor().formatAsString());
            }
            emitSection(emitter, planned, anchor);
            cursor.advance(section, anchor, planned.finishRow());
        }

        for (Integer rowIndex : hiddenRows) {
            Row row = sheet.getRow(rowIndex);
            if (row != null) {
                row.setZeroHeight(true);
            }
        }
        if (usesLocks) {
            SheetProtection.protect(sheet);
        }
        log.debug("Rendered sheet '{}': {} sections, {} hidden rows, protected={}",
                sheetTemplate.getName(), layout.getSections().size(), hiddenRows.size(), usesLocks);
    }

    private void emitSection(SectionEmitter emitter, PlannedSection planned, CellAnchor anchor) {
        ResolvedSection section = planned.getSection();
        if (section.getConfig().isTitleOnly()) {
            if (section.hasTitleRow()) {
                emitter.emitTitle(section, anchor.getRow(), anchor.getCol());
            }
            return;
        }
        int dataRow = emitter.emitLeadingRows(section, anchor);
        List<?> data = section.getConfig().getData();
        int dataLength = planned.getPlacement().getDataLength();
        for (int i = 0; i < dataLength; i++) {
            Object item = data != null && i < data.size() ? data.get(i) : null;
            emitter.emitDataRow(section, dataRow + i, anchor.getCol(), item, i);
        }
        emitter.applyAutoFilter(section, anchor, dataRow + dataLength);
    }
}
