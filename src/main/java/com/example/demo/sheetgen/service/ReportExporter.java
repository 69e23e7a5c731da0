package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.config.ExportSettings;
import com.example.demo.sheetgen.exception.DataBindingException;
import com.example.demo.sheetgen.exception.ReportWriteException;
import com.example.demo.sheetgen.exception.TemplateConfigException;
import com.example.demo.sheetgen.layout.ColumnResolver;
import com.example.demo.sheetgen.layout.LayoutPlanner;
import com.example.demo.sheetgen.layout.StyleResolver;
import com.example.demo.sheetgen.model.ReportTemplate;
import com.example.demo.sheetgen.model.SectionConfig;
import com.example.demo.sheetgen.model.SheetTemplate;
import com.example.demo.sheetgen.renderer.BatchWorkbookRenderer;
import com.example.demo.sheetgen.renderer.StreamingReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Entry point of the report engine: holds a report template, its bound data and
 * registered formatters, and renders it in batch or streaming mode.
 * <p>
 * An exporter owns and mutates its template; create one exporter per report.
 * Not thread-safe.
 *
 * <pre>
 * byte[] xlsx = ReportExporter.fromTemplate(template)
 *     .bindSectionData("products", products)
 *     .registerFormatter("currency", v -> String.format("$%.2f", ((Number) v).doubleValue()))
 *     .toBytes();
 * </pre>
 */
@Slf4j
public class ReportExporter {
    private final ReportTemplate template;
    private final ExportSettings settings;
    private final Map<String, Function<Object, Object>> formatters = new LinkedHashMap<>();
    private final ColumnResolver columnResolver;
    private final StyleResolver styleResolver;
    private final LayoutPlanner layoutPlanner;
    private final WorkbookOutputService outputService;

    ReportExporter(ReportTemplate template, ExportSettings settings, WorkbookOutputService outputService) {
        this.template = template;
        this.settings = settings;
        this.outputService = outputService;
        this.columnResolver = new ColumnResolver(settings.getDefaultColumnWidth());
        this.styleResolver = new StyleResolver(settings.getLockedFillColor(), settings.getHiddenFillColor());
        this.layoutPlanner = new LayoutPlanner(columnResolver);
        if (template.getSheets() == null) {
            template.setSheets(new ArrayList<>());
        }
        validate();
    }

    public static ReportExporter create() {
        return create(ExportSettings.defaults());
    }

    public static ReportExporter create(ExportSettings settings) {
        return new ReportExporter(new ReportTemplate(), settings, new WorkbookOutputService());
    }

    /**
     * @throws TemplateConfigException when sheet names or section ids are missing or duplicated
     */
    public static ReportExporter fromTemplate(ReportTemplate template) {
        return fromTemplate(template, ExportSettings.defaults());
    }

    public static ReportExporter fromTemplate(ReportTemplate template, ExportSettings settings) {
        return new ReportExporter(template, settings, new WorkbookOutputService());
    }

    public static ReportExporter fromYaml(String yaml) {
        return fromTemplate(new ReportTemplateLoader().parse(yaml));
    }

    public SheetBuilder addSheet(String name) {
        if (name == null || name.isBlank()) {
            throw new TemplateConfigException("MISSING_SHEET_NAME", "Sheet name must not be empty");
        }
        if (getSheet(name).isPresent()) {
            throw new TemplateConfigException("DUPLICATE_SHEET", "Sheet '" + name + "' already exists");
        }
        SheetTemplate sheet = SheetTemplate.builder().name(name).build();
        template.getSheets().add(sheet);
        return new SheetBuilder(this, sheet);
    }

    /**
     * Attaches rows to the section with the given id. Rows may be maps, Java
     * records, JavaBeans or {@link com.example.demo.sheetgen.data.RecordAccessor}s.
     *
     * @throws DataBindingException when no section has that id
     */
    public ReportExporter bindSectionData(String sectionId, List<?> data) {
        SectionConfig section = getSection(sectionId)
                .orElseThrow(() -> new DataBindingException("UNKNOWN_SECTION",
                        "Cannot bind data: no section with id '" + sectionId + "'"));
        section.setData(data);
        log.debug("Bound {} rows to section '{}'", data == null ? 0 : data.size(), sectionId);
        return this;
    }

    public ReportExporter registerFormatter(String name, Function<Object, Object> formatter) {
        formatters.put(name, formatter);
        return this;
    }

    public Optional<SheetTemplate> getSheet(String name) {
        return template.getSheets().stream()
                .filter(s -> s.getName() != null && s.getName().equals(name))
                .findFirst();
    }

    public Optional<SheetTemplate> getSheet(int index) {
        List<SheetTemplate> sheets = template.getSheets();
        if (index < 0 || index >= sheets.size()) {
            return Optional.empty();
        }
        return Optional.of(sheets.get(index));
    }

    /**
     * Section lookup across all sheets, for changes before rendering.
     */
    public Optional<SectionConfig> getSection(String sectionId) {
        if (sectionId == null) {
            return Optional.empty();
        }
        for (SheetTemplate sheet : template.getSheets()) {
            for (SectionConfig section : sections(sheet)) {
                if (sectionId.equals(section.getId())) {
                    return Optional.of(section);
                }
            }
        }
        return Optional.empty();
    }

    public ReportTemplate getTemplate() {
        return template;
    }

    public ExportSettings getSettings() {
        return settings;
    }

    /**
     * Renders every sheet into a new in-memory workbook. The caller owns the workbook.
     */
    public XSSFWorkbook buildWorkbook() {
        validate();
        BatchWorkbookRenderer renderer = new BatchWorkbookRenderer(layoutPlanner, styleResolver);
        XSSFWorkbook workbook = renderer.render(template.getSheets(), Collections.unmodifiableMap(formatters));
        log.info("Built workbook with {} sheets", template.getSheets().size());
        return workbook;
    }

    public byte[] toBytes() {
        try (XSSFWorkbook workbook = buildWorkbook()) {
            return outputService.toBytes(workbook);
        } catch (IOException e) {
            throw new ReportWriteException("WORKBOOK_CLOSE_FAILED", "Failed to release workbook", e);
        }
    }

    public void writeTo(OutputStream out) {
        try (XSSFWorkbook workbook = buildWorkbook()) {
            outputService.writeTo(workbook, out);
        } catch (IOException e) {
            throw new ReportWriteException("WORKBOOK_CLOSE_FAILED", "Failed to release workbook", e);
        }
    }

    public void exportToFile(Path path) {
        try (XSSFWorkbook workbook = buildWorkbook()) {
            outputService.writeToFile(workbook, path);
        } catch (IOException e) {
            throw new ReportWriteException("WORKBOOK_CLOSE_FAILED", "Failed to release workbook", e);
        }
    }

    /**
     * Writes the first sheet as CSV.
     *
     * @throws TemplateConfigException when the report has no sheets
     */
    public void toCsv(Writer writer) {
        validate();
        SheetTemplate first = getSheet(0)
                .orElseThrow(() -> new TemplateConfigException("NO_SHEETS", "Report has no sheets to export"));
        new CsvReportWriter(layoutPlanner).write(first, Collections.unmodifiableMap(formatters), writer);
    }

    /**
     * Opens a streaming session. Static sections up to the first section that
     * waits for data are rendered immediately.
     */
    public StreamingReportWriter startStream(OutputStream out) {
        validate();
        return new StreamingReportWriter(template.getSheets(), out, columnResolver, styleResolver,
                Collections.unmodifiableMap(formatters), settings.getStreamFlushRows()).start();
    }

    void ensureUniqueSectionId(String sectionId) {
        if (sectionId != null && !sectionId.isEmpty() && getSection(sectionId).isPresent()) {
            throw new TemplateConfigException("DUPLICATE_SECTION_ID", "Section id '" + sectionId + "' is already used");
        }
    }

    private void validate() {
        Set<String> sheetNames = new HashSet<>();
        Set<String> sectionIds = new HashSet<>();
        for (SheetTemplate sheet : template.getSheets()) {
            if (sheet.getName() == null || sheet.getName().isBlank()) {
                throw new TemplateConfigException("MISSING_SHEET_NAME", "Every sheet needs a name");
            }
            if (!sheetNames.add(sheet.getName())) {
                throw new TemplateConfigException("DUPLICATE_SHEET", "Sheet '" + sheet.getName() + "' is defined twice");
            }
            if (sheet.getSections() == null) {
                sheet.setSections(new ArrayList<>());
            }
            for (SectionConfig section : sheet.getSections()) {
                if (section.hasId() && !sectionIds.add(section.getId())) {
                    throw new TemplateConfigException("DUPLICATE_SECTION_ID",
                            "Section id '" + section.getId() + "' is used more than once");
                }
            }
        }
    }

    private static List<SectionConfig> sections(SheetTemplate sheet) {
        return sheet.getSections() != null ? sheet.getSections() : List.of();
    }
}
