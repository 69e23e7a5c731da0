package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.data.RecordAccessors;
import com.example.demo.sheetgen.exception.ReportWriteException;
import com.example.demo.sheetgen.layout.LayoutPlanner;
import com.example.demo.sheetgen.layout.PlannedSection;
import com.example.demo.sheetgen.layout.ResolvedSection;
import com.example.demo.sheetgen.layout.SheetLayout;
import com.example.demo.sheetgen.model.ColumnConfig;
import com.example.demo.sheetgen.model.SectionConfig;
import com.example.demo.sheetgen.model.SheetTemplate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Flattened CSV export of one sheet.
 * <p>
 * Each section with data or a header becomes: a single-cell title row, the
 * header row, one row per data item with formatters applied, and an empty
 * separator line.
 */
@Slf4j
public class CsvReportWriter {
    private final LayoutPlanner layoutPlanner;
    private final CSVFormat csvFormat;

    public CsvReportWriter(LayoutPlanner layoutPlanner) {
        this(layoutPlanner, CSVFormat.DEFAULT.builder().setRecordSeparator("\n").build());
    }

    public CsvReportWriter(LayoutPlanner layoutPlanner, CSVFormat csvFormat) {
        this.layoutPlanner = layoutPlanner;
        this.csvFormat = csvFormat;
    }

    /**
     * Writes the sheet to the writer. The writer is flushed but not closed.
     */
    public void write(SheetTemplate sheet, Map<String, Function<Object, Object>> formatters, Writer writer) {
        SheetLayout layout = layoutPlanner.plan(sheet);
        try {
            CSVPrinter printer = new CSVPrinter(writer, csvFormat);
            int written = 0;
            for (PlannedSection planned : layout.getSections()) {
                if (writeSection(printer, planned, formatters)) {
                    written++;
                }
            }
            printer.flush();
            log.debug("Wrote {} sections of sheet '{}' as CSV", written, sheet.getName());
        } catch (IOException e) {
            throw new ReportWriteException("CSV_WRITE_FAILED", "Failed to write CSV for sheet '" + sheet.getName() + "'", e);
        }
    }

    private boolean writeSection(CSVPrinter printer, PlannedSection planned,
                                 Map<String, Function<Object, Object>> formatters) throws IOException {
        ResolvedSection section = planned.getSection();
        SectionConfig config = section.getConfig();
        int dataLength = planned.getPlacement().getDataLength();
        if (dataLength == 0 && !config.isShowHeader()) {
            return false;
        }
        List<ColumnConfig> columns = section.getColumns();

        if (config.hasTitle()) {
            printer.printRecord(config.getTitle());
        }
        if (config.isShowHeader() && !columns.isEmpty()) {
            for (ColumnConfig column : columns) {
                printer.print(column.getHeader() != null ? column.getHeader() : "");
            }
            printer.println();
        }
        List<?> data = config.getData();
        for (int i = 0; i < dataLength; i++) {
            Object item = data != null && i < data.size() ? data.get(i) : null;
            for (ColumnConfig column : columns) {
                Object value = item != null ? RecordAccessors.valueOf(item, column.getFieldName()) : null;
                value = format(column, value, formatters);
                printer.print(value != null ? value.toString() : "");
            }
            printer.println();
        }
        printer.println();
        return true;
    }

    private Object format(ColumnConfig column, Object value, Map<String, Function<Object, Object>> formatters) {
        if (column.getFormatterFunction() != null) {
            return column.getFormatterFunction().apply(value);
        }
        if (column.getFormatter() != null) {
            Function<Object, Object> formatter = formatters.get(column.getFormatter());
            if (formatter != null) {
                return formatter.apply(value);
            }
        }
        return value;
    }
}
