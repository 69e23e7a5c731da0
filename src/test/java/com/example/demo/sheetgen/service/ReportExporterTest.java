package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.exception.DataBindingException;
import com.example.demo.sheetgen.exception.TemplateConfigException;
import com.example.demo.sheetgen.model.ColumnConfig;
import com.example.demo.sheetgen.model.CompareConfig;
import com.example.demo.sheetgen.model.ReportTemplate;
import com.example.demo.sheetgen.model.SectionConfig;
import com.example.demo.sheetgen.model.SectionDirection;
import com.example.demo.sheetgen.model.SectionType;
import com.example.demo.sheetgen.model.SheetTemplate;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ReportExporterTest {

    record Employee(String name, int age) {
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static ColumnConfig column(String field) {
        return ColumnConfig.builder().fieldName(field).header(field).build();
    }

    private static XSSFWorkbook reopen(byte[] bytes) throws IOException {
        return new XSSFWorkbook(new ByteArrayInputStream(bytes));
    }

    private static ReportTemplate loadTemplate(String templateId) {
        ReportTemplateLoader loader = new ReportTemplateLoader();
        return loader.parse(loader.loadTemplateSource(templateId), templateId);
    }

    private static String fillOf(Cell cell) {
        XSSFCellStyle style = (XSSFCellStyle) cell.getCellStyle();
        return style.getFillForegroundXSSFColor() != null ? style.getFillForegroundXSSFColor().getARGBHex() : null;
    }

    private static List<String> mergedRegions(XSSFSheet sheet) {
        return sheet.getMergedRegions().stream()
                .map(CellRangeAddress::formatAsString)
                .collect(Collectors.toList());
    }

    @Test
    public void testSectionWithoutTitleRendersHeaderAndRows() throws Exception {
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Data")
                .addSection(SectionConfig.builder()
                        .id("items")
                        .showHeader(true)
                        .columns(new ArrayList<>(List.of(column("ID"), column("Name"))))
                        .build())
                .build()
                .bindSectionData("items", List.of(row("ID", 1, "Name", "Alice"), row("ID", 2, "Name", "Bob")));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Data");
            assertEquals(3, sheet.getPhysicalNumberOfRows());
            assertEquals("ID", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Name", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals(1.0, sheet.getRow(1).getCell(0).getNumericCellValue());
            assertEquals("Alice", sheet.getRow(1).getCell(1).getStringCellValue());
            assertEquals("Bob", sheet.getRow(2).getCell(1).getStringCellValue());
            assertFalse(sheet.getProtect());
            assertTrue(sheet.getMergedRegions().isEmpty());
        }
    }

    @Test
    public void testIntegersBeyondDoublePrecisionAreWrittenAsText() throws Exception {
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Ids")
                .addSection(SectionConfig.builder()
                        .id("ids")
                        .columns(new ArrayList<>(List.of(column("Long"), column("Big"))))
                        .build())
                .build()
                .bindSectionData("ids", List.of(
                        row("Long", 9007199254740993L, "Big", new BigInteger("123456789012345678901234567890")),
                        row("Long", 42L, "Big", BigInteger.TEN)));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Ids");
            assertEquals(CellType.STRING, sheet.getRow(0).getCell(0).getCellType());
            assertEquals("9007199254740993", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("123456789012345678901234567890", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals(42.0, sheet.getRow(1).getCell(0).getNumericCellValue());
            assertEquals(10.0, sheet.getRow(1).getCell(1).getNumericCellValue());
        }
    }

    @Test
    public void testHorizontalSectionIsPlacedBesideVerticalSection() throws Exception {
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Side")
                .addSection(SectionConfig.builder().id("v").title("V").showHeader(true)
                        .columns(new ArrayList<>(List.of(column("a"), column("b")))).build())
                .addSection(SectionConfig.builder().id("h").title("H").showHeader(true)
                        .direction(SectionDirection.HORIZONTAL)
                        .columns(new ArrayList<>(List.of(column("c")))).build())
                .build()
                .bindSectionData("v", List.of(row("a", 1, "b", 2), row("a", 3, "b", 4)))
                .bindSectionData("h", List.of(row("c", "x")));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Side");
            assertEquals("V", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("H", sheet.getRow(0).getCell(2).getStringCellValue());
            assertEquals("c", sheet.getRow(1).getCell(2).getStringCellValue());
            assertEquals("x", sheet.getRow(2).getCell(2).getStringCellValue());
            assertEquals(3.0, sheet.getRow(3).getCell(0).getNumericCellValue());
            assertNull(sheet.getRow(4));
        }
    }

    // ---------------------------------------------------------------------
    // Comparison formulas
    // ---------------------------------------------------------------------

    @Test
    public void testComparisonAcrossHorizontalSections() throws Exception {
        ReportExporter exporter = ReportExporter.fromTemplate(loadTemplate("product-comparison"))
                .bindSectionData("section_a", List.of(row("Name", "Item1", "Value", 100), row("Name", "Item2", "Value", 200)))
                .bindSectionData("section_b", List.of(row("Name", "Item1", "Value", 100), row("Name", "Item2", "Value", 250)));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Executive Report");
            assertEquals("Section A", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Section B", sheet.getRow(0).getCell(2).getStringCellValue());
            assertEquals("Comparison", sheet.getRow(0).getCell(4).getStringCellValue());
            assertEquals("Diff Status", sheet.getRow(2).getCell(4).getStringCellValue());

            Cell first = sheet.getRow(3).getCell(4);
            Cell second = sheet.getRow(4).getCell(4);
            assertEquals(CellType.FORMULA, first.getCellType());
            assertEquals("IF(B4<>D4,\"Diff\",\"\")", first.getCellFormula());
            assertEquals("IF(B5<>D5,\"Diff\",\"\")", second.getCellFormula());

            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            assertEquals("", evaluator.evaluate(first).getStringValue());
            assertEquals("Diff", evaluator.evaluate(second).getStringValue());
        }
    }

    @Test
    public void testComparisonAcrossVerticalSections() throws Exception {
        ColumnConfig diff = ColumnConfig.builder()
                .fieldName("Diff")
                .header("Diff")
                .compareWith(new CompareConfig("a", "Value"))
                .compareAgainst(new CompareConfig("b", "Value"))
                .build();
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Compare")
                .addSection(SectionConfig.builder().id("a").title("A").showHeader(true)
                        .columns(new ArrayList<>(List.of(column("Name"), column("Value")))).build())
                .addSection(SectionConfig.builder().id("b").title("B").showHeader(true)
                        .columns(new ArrayList<>(List.of(column("Name"), column("Value")))).build())
                .addSection(SectionConfig.builder().id("cmp").title("Comparison").showHeader(true)
                        .sourceSections(List.of("a"))
                        .columns(new ArrayList<>(List.of(diff))).build())
                .build()
                .bindSectionData("a", List.of(row("Name", "Item1", "Value", 100)))
                .bindSectionData("b", List.of(row("Name", "Item1", "Value", 150)));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Compare");
            Cell cell = sheet.getRow(8).getCell(0);
            assertEquals("IF(B3<>B6,\"Diff\",\"\")", cell.getCellFormula());
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            assertEquals("Diff", evaluator.evaluate(cell).getStringValue());
        }
    }

    @Test
    public void testUnresolvableComparisonWritesErrorMarker() throws Exception {
        ColumnConfig diff = ColumnConfig.builder()
                .fieldName("Diff")
                .compareWith(new CompareConfig("a", "Value"))
                .compareAgainst(new CompareConfig("missing", "Value"))
                .build();
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Compare")
                .addSection(SectionConfig.builder().id("a").columns(new ArrayList<>(List.of(column("Value")))).build())
                .addSection(SectionConfig.builder().id("cmp").sourceSections(List.of("a"))
                        .columns(new ArrayList<>(List.of(diff))).build())
                .build()
                .bindSectionData("a", List.of(row("Value", 1)));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            Cell cell = workbook.getSheet("Compare").getRow(1).getCell(0);
            assertEquals(CellType.STRING, cell.getCellType());
            assertTrue(cell.getStringCellValue().startsWith("Error: "));
        }
    }

    // ---------------------------------------------------------------------
    // Locks, hidden rows and styles
    // ---------------------------------------------------------------------

    @Test
    public void testHiddenFieldRowIsLockedAndInvisible() throws Exception {
        ReportExporter exporter = ReportExporter.fromTemplate(loadTemplate("product-comparison"))
                .bindSectionData("section_a", List.of(row("Name", "Item1", "Value", 1)))
                .bindSectionData("section_b", List.of(row("Name", "Item1", "Value", 1)));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheetAt(0);
            assertTrue(sheet.getRow(1).getZeroHeight());
            assertFalse(sheet.getRow(0).getZeroHeight());
            assertFalse(sheet.getRow(3).getZeroHeight());

            Cell hidden = sheet.getRow(1).getCell(0);
            assertEquals("h_name", hidden.getStringCellValue());
            assertEquals("h_diff", sheet.getRow(1).getCell(4).getStringCellValue());
            assertTrue(hidden.getCellStyle().getLocked());
            assertEquals("FFFFFF00", fillOf(hidden));

            assertFalse(sheet.getRow(3).getCell(0).getCellStyle().getLocked());
            assertFalse(workbook.getCellStyleAt(0).getLocked());

            assertTrue(sheet.getProtect());
            assertFalse(sheet.isFormatColumnsLocked());
            assertFalse(sheet.isFormatRowsLocked());
            assertFalse(sheet.isAutoFilterLocked());
            assertFalse(sheet.isSelectLockedCellsLocked());
            assertFalse(sheet.isSelectUnlockedCellsLocked());
            assertTrue(sheet.isInsertRowsLocked());
            assertTrue(sheet.isDeleteRowsLocked());
            assertTrue(sheet.isFormatCellsLocked());
        }
    }

    @Test
    public void testStyledLockedSection() throws Exception {
        ReportExporter exporter = ReportExporter.fromTemplate(loadTemplate("styled-report"))
                .registerFormatter("currency", v -> String.format(Locale.ROOT, "$%.2f", ((Number) v).doubleValue()))
                .bindSectionData("employees", List.of(
                        row("id", 1, "name", "Ann", "salary", 1000.5),
                        row("id", 2, "name", "Ben", "salary", 2000),
                        row("id", 3, "name", "Cid", "salary", 3000.25)));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Employees");

            Cell title = sheet.getRow(0).getCell(0);
            XSSFCellStyle titleStyle = (XSSFCellStyle) title.getCellStyle();
            assertEquals("Employees", title.getStringCellValue());
            assertEquals("FF4472C4", fillOf(title));
            assertTrue(titleStyle.getFont().getBold());
            assertEquals("FFFFFFFF", titleStyle.getFont().getXSSFColor().getARGBHex());
            assertTrue(titleStyle.getLocked());
            assertTrue(mergedRegions(sheet).contains("A1:C1"));

            assertEquals(30f, sheet.getRow(0).getHeightInPoints());
            assertEquals(22f, sheet.getRow(1).getHeightInPoints());
            assertEquals(24f, sheet.getRow(2).getHeightInPoints());

            Cell header = sheet.getRow(1).getCell(0);
            assertEquals("Employee ID", header.getStringCellValue());
            assertEquals(HorizontalAlignment.LEFT, header.getCellStyle().getAlignment());

            Cell lockedCell = sheet.getRow(2).getCell(0);
            assertTrue(lockedCell.getCellStyle().getLocked());
            assertEquals("FFE0E0E0", fillOf(lockedCell));

            Cell editable = sheet.getRow(2).getCell(1);
            assertEquals("Ann", editable.getStringCellValue());
            assertFalse(editable.getCellStyle().getLocked());
            assertNotEquals(FillPatternType.SOLID_FOREGROUND, editable.getCellStyle().getFillPattern());

            assertEquals("$1000.50", sheet.getRow(2).getCell(2).getStringCellValue());
            assertEquals("$2000.00", sheet.getRow(3).getCell(2).getStringCellValue());

            assertEquals(12 * 256, sheet.getColumnWidth(0));
            assertEquals(30 * 256, sheet.getColumnWidth(1));

            assertEquals("A2:C5", sheet.getCTWorksheet().getAutoFilter().getRef());
            assertTrue(sheet.getProtect());
        }
    }

    @Test
    public void testHiddenSectionRowsAreHiddenAndHighlighted() throws Exception {
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Data")
                .addSection(SectionConfig.builder().id("meta").title("Meta").type(SectionType.HIDDEN).showHeader(true)
                        .columns(new ArrayList<>(List.of(column("key")))).build())
                .addSection(SectionConfig.builder().id("visible").title("Visible")
                        .columns(new ArrayList<>(List.of(column("key")))).build())
                .build()
                .bindSectionData("meta", List.of(row("key", "k1"), row("key", "k2")))
                .bindSectionData("visible", List.of(row("key", "v1")));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Data");
            for (int r = 0; r <= 3; r++) {
                assertTrue(sheet.getRow(r).getZeroHeight(), "row " + r);
                assertTrue(sheet.getRow(r).getCell(0).getCellStyle().getLocked(), "row " + r);
            }
            assertEquals("FFFFFF00", fillOf(sheet.getRow(2).getCell(0)));
            assertFalse(sheet.getRow(4).getZeroHeight());
            assertEquals("Visible", sheet.getRow(4).getCell(0).getStringCellValue());
            assertFalse(sheet.getRow(5).getCell(0).getCellStyle().getLocked());
            assertTrue(sheet.getProtect());
        }
    }

    @Test
    public void testTitlesAreMergedAcrossColumns() throws Exception {
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Titles")
                .addSection(SectionConfig.builder().title("Quarterly Report").type(SectionType.TITLE).colSpan(3).build())
                .addSection(SectionConfig.builder().id("items").title("Items")
                        .columns(new ArrayList<>(List.of(column("ID"), column("Name")))).build())
                .addSection(SectionConfig.builder().id("single").title("Single")
                        .columns(new ArrayList<>(List.of(column("ID")))).build())
                .build()
                .bindSectionData("items", List.of(row("ID", 1, "Name", "A")));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Titles");
            List<String> merged = mergedRegions(sheet);
            assertEquals(2, merged.size());
            assertTrue(merged.contains("A1:C1"));
            assertTrue(merged.contains("A2:B2"));
            assertEquals("Quarterly Report", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Single", sheet.getRow(3).getCell(0).getStringCellValue());
        }
    }

    // ---------------------------------------------------------------------
    // Data binding and formatters
    // ---------------------------------------------------------------------

    @Test
    public void testColumnsAreDiscoveredFromRecords() throws Exception {
        ReportExporter exporter = ReportExporter.create()
                .addSheet("People")
                .addSection(SectionConfig.builder().id("people").showHeader(true).build())
                .build()
                .bindSectionData("people", List.of(new Employee("Alice", 30), new Employee("Bob", 41)));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("People");
            assertEquals("name", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("age", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals("Bob", sheet.getRow(2).getCell(0).getStringCellValue());
            assertEquals(41.0, sheet.getRow(2).getCell(1).getNumericCellValue());
            assertEquals(20 * 256, sheet.getColumnWidth(0));
        }
    }

    @Test
    public void testNamedAndProgrammaticFormatters() throws Exception {
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Formatted")
                .addSection(SectionConfig.builder().id("items").columns(new ArrayList<>(List.of(
                        ColumnConfig.builder().fieldName("price").formatter("currency").build(),
                        ColumnConfig.builder().fieldName("name").build(),
                        ColumnConfig.builder().fieldName("qty").formatter("unregistered").build()))).build())
                .build()
                .registerFormatter("currency", v -> String.format(Locale.ROOT, "$%.2f", ((Number) v).doubleValue()))
                .bindSectionData("items", List.of(row("price", 9.5, "name", "widget", "qty", 4)));

        exporter.getSection("items")
                .flatMap(section -> section.getColumn("name"))
                .orElseThrow()
                .setFormatterFunction(v -> v.toString().toUpperCase());

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Formatted");
            assertEquals("$9.50", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("WIDGET", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals(4.0, sheet.getRow(0).getCell(2).getNumericCellValue());
        }
    }

    @Test
    public void testSectionsCanBeChangedBeforeRendering() throws Exception {
        ReportExporter exporter = ReportExporter.fromTemplate(loadTemplate("product-comparison"))
                .bindSectionData("section_a", List.of(row("Name", "Item1", "Value", 1)))
                .bindSectionData("section_b", List.of(row("Name", "Item1", "Value", 2)));

        SectionConfig sectionA = exporter.getSection("section_a").orElseThrow();
        sectionA.setTitle("Baseline");
        sectionA.getColumn("Value").orElseThrow().setHeader("Amount");

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheetAt(0);
            assertEquals("Baseline", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Amount", sheet.getRow(2).getCell(1).getStringCellValue());
        }
    }

    @Test
    public void testBindingUnknownSectionFails() {
        ReportExporter exporter = ReportExporter.create()
                .addSheet("Data")
                .addSection(SectionConfig.builder().id("items").build())
                .build();

        DataBindingException e = assertThrows(DataBindingException.class,
                () -> exporter.bindSectionData("nope", List.of()));
        assertEquals("UNKNOWN_SECTION", e.getCode());
    }

    @Test
    public void testDuplicateNamesAreRejected() {
        ReportExporter exporter = ReportExporter.create();
        SheetBuilder builder = exporter.addSheet("Data").addSection(SectionConfig.builder().id("items").build());

        TemplateConfigException duplicateSection = assertThrows(TemplateConfigException.class,
                () -> builder.addSection(SectionConfig.builder().id("items").build()));
        assertEquals("DUPLICATE_SECTION_ID", duplicateSection.getCode());

        TemplateConfigException duplicateSheet = assertThrows(TemplateConfigException.class,
                () -> exporter.addSheet("Data"));
        assertEquals("DUPLICATE_SHEET", duplicateSheet.getCode());

        ReportTemplate template = ReportTemplate.builder().sheets(new ArrayList<>(List.of(
                SheetTemplate.builder().name("One").sections(new ArrayList<>(List.of(
                        SectionConfig.builder().id("x").build()))).build(),
                SheetTemplate.builder().name("Two").sections(new ArrayList<>(List.of(
                        SectionConfig.builder().id("x").build()))).build()))).build();
        TemplateConfigException acrossSheets = assertThrows(TemplateConfigException.class,
                () -> ReportExporter.fromTemplate(template));
        assertEquals("DUPLICATE_SECTION_ID", acrossSheets.getCode());
    }

    // ---------------------------------------------------------------------
    // Output targets
    // ---------------------------------------------------------------------

    @Test
    public void testMultipleSheetsAndOutputTargets(@TempDir Path tempDir) throws Exception {
        ReportExporter exporter = ReportExporter.create();
        exporter.addSheet("First").addSection(SectionConfig.builder().id("one")
                .columns(new ArrayList<>(List.of(column("v")))).build());
        exporter.addSheet("Second").addSection(SectionConfig.builder().id("two")
                .columns(new ArrayList<>(List.of(column("v")))).build());
        exporter.bindSectionData("one", List.of(row("v", "first")))
                .bindSectionData("two", List.of(row("v", "second")));

        assertEquals("Second", exporter.getSheet(1).orElseThrow().getName());
        assertTrue(exporter.getSheet(2).isEmpty());

        Path target = tempDir.resolve("reports").resolve("report.xlsx");
        exporter.exportToFile(target);
        assertTrue(Files.isRegularFile(target));
        try (InputStream in = Files.newInputStream(target); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            assertEquals(2, workbook.getNumberOfSheets());
            assertEquals("first", workbook.getSheet("First").getRow(0).getCell(0).getStringCellValue());
            assertEquals("second", workbook.getSheet("Second").getRow(0).getCell(0).getStringCellValue());
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        exporter.writeTo(out);
        try (XSSFWorkbook workbook = reopen(out.toByteArray())) {
            assertEquals("Second", workbook.getSheetName(1));
        }
    }

    @Test
    public void testYamlTemplateRoundTrip() throws Exception {
        String yaml = "sheets:\n"
                + "  - name: \"Inline\"\n"
                + "    sections:\n"
                + "      - id: \"rows\"\n"
                + "        title: \"Rows\"\n"
                + "        show_header: true\n"
                + "        columns:\n"
                + "          - field_name: \"code\"\n"
                + "            header: \"Code\"\n";

        ReportExporter exporter = ReportExporter.fromYaml(yaml).bindSectionData("rows", List.of(row("code", "X1")));

        try (XSSFWorkbook workbook = reopen(exporter.toBytes())) {
            XSSFSheet sheet = workbook.getSheet("Inline");
            assertEquals("Rows", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Code", sheet.getRow(1).getCell(0).getStringCellValue());
            assertEquals("X1", sheet.getRow(2).getCell(0).getStringCellValue());
        }
    }
}
