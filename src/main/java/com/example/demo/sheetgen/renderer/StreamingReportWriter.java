package com.example.demo.sheetgen.renderer;

import com.example.demo.sheetgen.exception.DataBindingException;
import com.example.demo.sheetgen.exception.ReportWriteException;
import com.example.demo.sheetgen.layout.CellAnchor;
import com.example.demo.sheetgen.layout.ColumnResolver;
import com.example.demo.sheetgen.layout.LayoutCursor;
import com.example.demo.sheetgen.layout.LayoutPlanner;
import com.example.demo.sheetgen.layout.PlacementTable;
import com.example.demo.sheetgen.layout.ResolvedSection;
import com.example.demo.sheetgen.layout.SectionPlacement;
import com.example.demo.sheetgen.layout.StyleResolver;
import com.example.demo.sheetgen.model.SectionConfig;
import com.example.demo.sheetgen.model.SheetTemplate;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.streaming.SXSSFSheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Sequential writer that accepts data batches for one section at a time.
 * <p>
 * Sections are visited in declaration order across all sheets. Sections whose
 * data is already known (bound data, no id, title-only, or mirroring an already
 * placed section) are rendered automatically; the first section with an id and
 * no data becomes the target of the next {@link #write}. Writing to a later
 * section finishes the current one and renders everything in between exactly
 * once. Writing to a section that was already passed fails.
 * <p>
 * Rows are buffered in memory and flushed every {@code flushRows} rows.
 * Sections are always stacked vertically; directions and explicit positions
 * are ignored. Not thread-safe.
 */
@Slf4j
public class StreamingReportWriter implements Closeable {
    private final List<SheetTemplate> sheets;
    private final OutputStream out;
    private final ColumnResolver columnResolver;
    private final StyleResolver styleResolver;
    private final Map<String, Function<Object, Object>> formatters;
    private final int flushRows;
    private final SXSSFWorkbook workbook;
    private final CellStyleCache styles;

    private StreamState state = StreamState.IDLE;

    private int sheetIndex = -1;
    private int sectionIndex;
    private SXSSFSheet sheet;
    private boolean sheetUsesLocks;
    private LayoutCursor cursor;
    private PlacementTable placements;
    private SectionEmitter emitter;
    private int rowsSinceFlush;

    private SectionConfig target;
    private ResolvedSection active;
    private CellAnchor activeAnchor;
    private int activeDataStart;
    private int activeRows;

    public StreamingReportWriter(List<SheetTemplate> sheets,
                                 OutputStream out,
                                 ColumnResolver columnResolver,
                                 StyleResolver styleResolver,
                                 Map<String, Function<Object, Object>> formatters,
                                 int flushRows) {
        this.sheets = sheets;
        this.out = out;
        this.columnResolver = columnResolver;
        this.styleResolver = styleResolver;
        this.formatters = formatters;
        this.flushRows = Math.max(1, flushRows);
        this.workbook = new SXSSFWorkbook(-1);
        this.styles = new CellStyleCache(workbook);
    }

    /**
     * Renders the leading static sections and positions the writer on the first streaming target.
     */
    public StreamingReportWriter start() {
        if (state != StreamState.IDLE) {
            throw new IllegalStateException("Stream already started");
        }
        log.info("Starting report stream over {} sheets (flush every {} rows)", sheets.size(), flushRows);
        advance(null);
        return this;
    }

    /**
     * Appends a batch to the given section.
     *
     * @throws DataBindingException when the stream is closed, or the section is
     *                              unknown, already passed, or has pre-bound data
     */
    public void write(String sectionId, List<?> batch) {
        if (state == StreamState.CLOSED) {
            throw new DataBindingException("STREAM_CLOSED", "Cannot write to section '" + sectionId + "': stream is closed");
        }
        if (state == StreamState.IDLE) {
            throw new DataBindingException("STREAM_NOT_STARTED", "Cannot write to section '" + sectionId + "': stream not started");
        }
        List<?> rows = batch != null ? batch : List.of();
        boolean current = target != null && sectionId != null && sectionId.equals(target.getId());
        if (!current) {
            requireUpcoming(sectionId);
            finishCurrent();
            advance(sectionId);
        }
        if (state == StreamState.AWAITING_FIRST_WRITE) {
            if (rows.isEmpty() && !hasExplicitColumns(target)) {
                log.debug("Empty batch for section '{}'; columns not known yet", sectionId);
                return;
            }
            beginTarget(rows);
        }
        appendRows(rows);
    }

    /**
     * Renders everything that is left and writes the workbook to the output stream.
     * The output stream is flushed but not closed. Calling close again has no effect.
     */
    @Override
    public void close() {
        if (state == StreamState.CLOSED) {
            return;
        }
        try {
            if (state == StreamState.IDLE) {
                advance(null);
            }
            finishCurrent();
            advance(null);
            while (target != null) {
                renderEmptyTarget();
                advance(null);
            }
            workbook.write(out);
            out.flush();
            log.info("Report stream closed after {} sheets", sheets.size());
        } catch (IOException e) {
            throw new ReportWriteException("STREAM_WRITE_FAILED", "Failed to write streamed workbook", e);
        } finally {
            state = StreamState.CLOSED;
            workbook.dispose();
            try {
                workbook.close();
            } catch (IOException e) {
                log.warn("Failed to release streamed workbook resources: {}", e.getMessage());
            }
        }
    }

    public StreamState getState() {
        return state;
    }

    /**
     * @return id of the section the next write is expected for, if any
     */
    public String getCurrentSectionId() {
        return target != null ? target.getId() : null;
    }

    private void requireUpcoming(String sectionId) {
        int fromSheet = Math.max(sheetIndex, 0);
        for (int s = fromSheet; s < sheets.size(); s++) {
            List<SectionConfig> sections = sectionsOf(sheets.get(s));
            int from = s == sheetIndex ? sectionIndex + (target != null ? 1 : 0) : 0;
            for (int i = from; i < sections.size(); i++) {
                SectionConfig section = sections.get(i);
                if (sectionId != null && sectionId.equals(section.getId())) {
                    if (section.getData() != null || section.isTitleOnly()) {
                        throw new DataBindingException("SECTION_NOT_STREAMABLE",
                                "Section '" + sectionId + "' has bound data or takes no data and cannot receive batches");
                    }
                    return;
                }
            }
        }
        throw new DataBindingException("SECTION_NOT_AHEAD",
                "Section '" + sectionId + "' is not the current or an upcoming section (already passed or unknown)");
    }

    /**
     * Renders sections until the target is reached. With a null target the walk
     * stops at the first section waiting for data; with a target id, sections
     * waiting for data before it are rendered empty.
     */
    private void advance(String targetId) {
        state = StreamState.ADVANCING;
        target = null;
        while (true) {
            if (sheet == null || sectionIndex >= sectionsOf(sheets.get(sheetIndex)).size()) {
                if (sheet != null) {
                    finishSheet();
                }
                if (sheetIndex + 1 >= sheets.size()) {
                    return;
                }
                openSheet(sheetIndex + 1);
                continue;
            }
            SectionConfig section = sectionsOf(sheets.get(sheetIndex)).get(sectionIndex);
            boolean isStatic = isStatic(section);
            boolean stop = targetId != null ? targetId.equals(section.getId()) : !isStatic;
            if (stop) {
                target = section;
                state = StreamState.AWAITING_FIRST_WRITE;
                log.debug("Stream positioned on section '{}' of sheet '{}'", section.getId(), sheet.getSheetName());
                return;
            }
            if (isStatic) {
                renderStatic(section);
            } else {
                log.debug("Section '{}' received no data; rendering it empty", section.getId());
                target = section;
                renderEmptyTarget();
                state = StreamState.ADVANCING;
            }
        }
    }

    private boolean isStatic(SectionConfig section) {
        if (section.isTitleOnly() || section.getData() != null || !section.hasId()) {
            return true;
        }
        List<String> sources = section.getSourceSections();
        return sources != null && !sources.isEmpty() && placements.contains(sources.get(0));
    }

    private void openSheet(int index) {
        sheetIndex = index;
        sectionIndex = 0;
        SheetTemplate template = sheets.get(index);
        sheet = workbook.createSheet(template.getName());
        cursor = LayoutCursor.verticalOnly();
        placements = new PlacementTable();
        rowsSinceFlush = 0;
        sheetUsesLocks = sectionsOf(template).stream()
                .anyMatch(s -> columnResolver.resolve(s, List.of()).usesLocks());
        if (sheetUsesLocks) {
            SheetProtection.unlockUnstyledCells(workbook);
        }
        emitter = new SectionEmitter(sheet, styles, styleResolver, formatters, placements, true, this::hideRow);
        log.debug("Streaming sheet '{}' with {} sections", template.getName(), sectionsOf(template).size());
    }

    private void finishSheet() {
        if (sheetUsesLocks) {
            SheetProtection.protect(sheet);
        }
        flush();
        sheet = null;
    }

    private void renderStatic(SectionConfig config) {
        ResolvedSection section = columnResolver.resolve(config);
        warnIgnoredPlacement(config);
        CellAnchor anchor = cursor.anchorFor(section);
        int dataLength = LayoutPlanner.dataLength(section, placements);
        SectionPlacement placement = LayoutPlanner.place(section, anchor, dataLength);
        if (config.hasId()) {
            placements.register(placement);
        }
        if (config.isTitleOnly()) {
            if (section.hasTitleRow()) {
                emitter.emitTitle(section, anchor.getRow(), anchor.getCol());
            }
        } else {
            int dataRow = emitter.emitLeadingRows(section, anchor);
            List<?> data = config.getData();
            for (int i = 0; i < dataLength; i++) {
                Object item = data != null && i < data.size() ? data.get(i) : null;
                emitter.emitDataRow(section, dataRow + i, anchor.getCol(), item, i);
                countRows(1);
            }
            emitter.applyAutoFilter(section, anchor, dataRow + dataLength);
        }
        countRows(section.leadingRows());
        cursor.advance(section, anchor, placement.getStartRow() + dataLength);
        sectionIndex++;
    }

    private void beginTarget(List<?> firstBatch) {
        ResolvedSection section = columnResolver.resolve(target, firstBatch);
        warnIgnoredPlacement(target);
        CellAnchor anchor = cursor.anchorFor(section);
        int dataStart = emitter.emitLeadingRows(section, anchor);
        countRows(dataStart - anchor.getRow());
        if (target.hasId()) {
            placements.register(LayoutPlanner.place(section, anchor, 0));
        }
        active = section;
        activeAnchor = anchor;
        activeDataStart = dataStart;
        activeRows = 0;
        state = StreamState.WRITING;
    }

    private void appendRows(List<?> rows) {
        for (Object item : rows) {
            emitter.emitDataRow(active, activeDataStart + activeRows, activeAnchor.getCol(), item, activeRows);
            activeRows++;
            countRows(1);
        }
    }

    private void finishCurrent() {
        if (state == StreamState.WRITING) {
            finishActive();
        } else if (state == StreamState.AWAITING_FIRST_WRITE) {
            renderEmptyTarget();
        }
    }

    private void renderEmptyTarget() {
        beginTarget(List.of());
        finishActive();
    }

    private void finishActive() {
        int dataEnd = activeDataStart + activeRows;
        emitter.applyAutoFilter(active, activeAnchor, dataEnd);
        if (active.getConfig().hasId()) {
            placements.register(LayoutPlanner.place(active, activeAnchor, activeRows));
        }
        cursor.advance(active, activeAnchor, dataEnd);
        log.debug("Finished streamed section '{}' with {} rows", active.getId(), activeRows);
        sectionIndex++;
        active = null;
        target = null;
        state = StreamState.ADVANCING;
    }

    private void countRows(int rows) {
        rowsSinceFlush += rows;
        if (rowsSinceFlush >= flushRows) {
            flush();
        }
    }

    private void flush() {
        try {
            sheet.flushRows();
            rowsSinceFlush = 0;
        } catch (IOException e) {
            throw new ReportWriteException("STREAM_FLUSH_FAILED", "Failed to flush rows of sheet '" + sheet.getSheetName() + "'", e);
        }
    }

    private void hideRow(int rowIndex) {
        Row row = sheet.getRow(rowIndex);
        if (row != null) {
            row.setZeroHeight(true);
        }
    }

    private void warnIgnoredPlacement(SectionConfig config) {
        if (config.isHorizontal() || config.hasPosition()) {
            log.debug("Section '{}' is stacked vertically; direction and position are ignored while streaming", config.getId());
        }
    }

    private static boolean hasExplicitColumns(SectionConfig section) {
        return section.getColumns() != null && !section.getColumns().isEmpty();
    }

    private static List<SectionConfig> sectionsOf(SheetTemplate sheet) {
        return sheet.getSections() != null ? sheet.getSections() : List.of();
    }
}
