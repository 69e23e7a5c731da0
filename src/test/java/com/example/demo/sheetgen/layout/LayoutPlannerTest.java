package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.exception.ReferenceResolutionException;
import com.example.demo.sheetgen.model.ColumnConfig;
import com.example.demo.sheetgen.model.SectionConfig;
import com.example.demo.sheetgen.model.SectionDirection;
import com.example.demo.sheetgen.model.SectionType;
import com.example.demo.sheetgen.model.SheetTemplate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LayoutPlannerTest {

    private final LayoutPlanner planner = new LayoutPlanner(new ColumnResolver(20));

    private static ColumnConfig column(String field) {
        return ColumnConfig.builder().fieldName(field).header(field).build();
    }

    private static SectionConfig.SectionConfigBuilder section(String id, String... fields) {
        List<ColumnConfig> columns = new ArrayList<>();
        for (String field : fields) {
            columns.add(column(field));
        }
        return SectionConfig.builder().id(id).title(id.toUpperCase()).showHeader(true).columns(columns);
    }

    private static SheetTemplate sheet(SectionConfig... sections) {
        return SheetTemplate.builder().name("Layout").sections(new ArrayList<>(List.of(sections))).build();
    }

    private static List<Map<String, Object>> rows(int count) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(Map.of("ID", i, "Name", "n" + i));
        }
        return rows;
    }

    @Test
    public void testSingleVerticalSectionStartsAtOrigin() {
        SheetLayout layout = planner.plan(sheet(section("s1", "ID", "Name").data(rows(3)).build()));

        PlannedSection planned = layout.getSections().get(0);
        assertEquals(new CellAnchor(0, 0), planned.getAnchor());

        SectionPlacement placement = layout.getPlacements().require("s1");
        assertEquals(0, placement.getAnchorRow());
        assertEquals(2, placement.getStartRow());
        assertEquals(0, placement.getStartCol());
        assertEquals(3, placement.getDataLength());
        assertEquals(Map.of("ID", 0, "Name", 1), placement.getFieldOffsets());
        assertEquals(5, planned.finishRow());
    }

    @Test
    public void testVerticalSectionsStackBelowEachOther() {
        SheetLayout layout = planner.plan(sheet(
                section("s1", "ID", "Name").data(rows(2)).build(),
                section("s2", "ID").data(rows(4)).build(),
                section("s3", "ID").build()));

        assertEquals(new CellAnchor(0, 0), layout.getSections().get(0).getAnchor());
        assertEquals(new CellAnchor(4, 0), layout.getSections().get(1).getAnchor());
        assertEquals(new CellAnchor(10, 0), layout.getSections().get(2).getAnchor());
        assertEquals(0, layout.getPlacements().require("s3").getDataLength());
    }

    @Test
    public void testHorizontalSectionsShareABand() {
        SheetLayout layout = planner.plan(sheet(
                section("a", "ID", "Name").direction(SectionDirection.HORIZONTAL).data(rows(2)).build(),
                section("b", "ID", "Name").direction(SectionDirection.HORIZONTAL).data(rows(5)).build(),
                section("c", "Diff").direction(SectionDirection.HORIZONTAL).build(),
                section("d", "ID").data(rows(1)).build()));

        assertEquals(new CellAnchor(0, 0), layout.getSections().get(0).getAnchor());
        assertEquals(new CellAnchor(0, 2), layout.getSections().get(1).getAnchor());
        assertEquals(new CellAnchor(0, 4), layout.getSections().get(2).getAnchor());
        // below the tallest member of the band
        assertEquals(new CellAnchor(7, 0), layout.getSections().get(3).getAnchor());
    }

    @Test
    public void testHorizontalSectionAfterVerticalSectionStartsInNextFreeColumn() {
        SheetLayout layout = planner.plan(sheet(
                section("v", "ID").data(rows(1)).build(),
                section("h1", "ID", "Name").direction(SectionDirection.HORIZONTAL).data(rows(1)).build(),
                section("h2", "ID", "Name").direction(SectionDirection.HORIZONTAL).data(rows(3)).build(),
                section("after", "ID").build()));

        // v spans ID plus the discovered Name column
        assertEquals(new CellAnchor(0, 0), layout.getSections().get(0).getAnchor());
        assertEquals(new CellAnchor(0, 2), layout.getSections().get(1).getAnchor());
        assertEquals(new CellAnchor(0, 4), layout.getSections().get(2).getAnchor());
        assertEquals(2, layout.getPlacements().require("h1").getStartCol());
        assertEquals(new CellAnchor(5, 0), layout.getSections().get(3).getAnchor());
    }

    @Test
    public void testSourceSectionsProvideDataLength() {
        SheetLayout layout = planner.plan(sheet(
                section("a", "Name", "Value").data(rows(3)).build(),
                section("cmp", "Diff").sourceSections(List.of("a")).build()));

        assertEquals(3, layout.getPlacements().require("cmp").getDataLength());
    }

    @Test
    public void testBoundDataWinsOverSourceSections() {
        SheetLayout layout = planner.plan(sheet(
                section("a", "Name").data(rows(3)).build(),
                section("cmp", "Name").sourceSections(List.of("a")).data(rows(1)).build()));

        assertEquals(1, layout.getPlacements().require("cmp").getDataLength());
    }

    @Test
    public void testUnplacedSourceSectionFails() {
        SheetTemplate template = sheet(
                section("cmp", "Diff").sourceSections(List.of("later")).build(),
                section("later", "Name").data(rows(2)).build());

        ReferenceResolutionException e = assertThrows(ReferenceResolutionException.class, () -> planner.plan(template));
        assertEquals("UNKNOWN_SOURCE_SECTION", e.getCode());
    }

    @Test
    public void testExplicitPositionOverridesAnchor() {
        SheetLayout layout = planner.plan(sheet(
                section("s1", "ID").position("C5").data(rows(2)).build(),
                section("s2", "ID").build()));

        assertEquals(new CellAnchor(4, 2), layout.getSections().get(0).getAnchor());
        SectionPlacement placement = layout.getPlacements().require("s1");
        assertEquals(6, placement.getStartRow());
        assertEquals(2, placement.getStartCol());
        assertEquals(new CellAnchor(8, 0), layout.getSections().get(1).getAnchor());
    }

    @Test
    public void testInvalidPositionFails() {
        SheetTemplate template = sheet(section("s1", "ID").position("not-a-cell").build());

        LayoutException e = assertThrows(LayoutException.class, () -> planner.plan(template));
        assertEquals("INVALID_POSITION", e.getCode());
    }

    @Test
    public void testTitleOnlySectionOccupiesOneRow() {
        SectionConfig banner = SectionConfig.builder()
                .title("Quarterly Report")
                .type(SectionType.TITLE)
                .colSpan(3)
                .build();
        SheetLayout layout = planner.plan(sheet(banner, section("s1", "ID").data(rows(1)).build()));

        PlannedSection planned = layout.getSections().get(0);
        assertEquals(0, planned.getPlacement().getDataLength());
        assertEquals(3, planned.getSection().titleSpan());
        assertEquals(1, planned.finishRow());
        assertEquals(new CellAnchor(1, 0), layout.getSections().get(1).getAnchor());
        assertEquals(1, layout.getPlacements().size());
    }

    @Test
    public void testHiddenFieldRowAddsLeadingRow() {
        SectionConfig config = section("s1").columns(new ArrayList<>(List.of(
                ColumnConfig.builder().fieldName("Name").header("Name").hiddenFieldName("h_name").build())))
                .data(rows(1))
                .build();

        SheetLayout layout = planner.plan(sheet(config));

        assertEquals(3, layout.getPlacements().require("s1").getStartRow());
    }

    @Test
    public void testSectionsWithoutIdAreNotRegistered() {
        SectionConfig anonymous = SectionConfig.builder().title("Notes").showHeader(true)
                .columns(new ArrayList<>(List.of(column("ID")))).data(rows(2)).build();

        SheetLayout layout = planner.plan(sheet(anonymous, section("s1", "ID").build()));

        assertEquals(1, layout.getPlacements().size());
        assertEquals(4, layout.getPlacements().require("s1").getAnchorRow());
    }

    @Test
    public void testPlanningIsRepeatable() {
        SheetTemplate template = sheet(
                section("a", "Name", "Value").direction(SectionDirection.HORIZONTAL).data(rows(2)).build(),
                section("b", "Name", "Value").direction(SectionDirection.HORIZONTAL).data(rows(2)).build(),
                section("c", "ID").position("H2").data(rows(3)).build());

        SheetLayout first = planner.plan(template);
        SheetLayout second = planner.plan(template);

        for (String id : List.of("a", "b", "c")) {
            assertEquals(first.getPlacements().require(id), second.getPlacements().require(id));
        }
    }

    @Test
    public void testDiscoveredColumnsAreAppendedToOffsets() {
        SectionConfig config = section("s1", "Name").data(rows(1)).build();

        SectionPlacement placement = planner.plan(sheet(config)).getPlacements().require("s1");

        assertEquals(0, placement.getFieldOffsets().get("Name"));
        assertEquals(1, placement.getFieldOffsets().get("ID"));
    }

    @Test
    public void testUnknownSectionLookupFails() {
        PlacementTable placements = planner.plan(sheet(section("s1", "ID").build())).getPlacements();

        assertFalse(placements.contains("missing"));
        ReferenceResolutionException e = assertThrows(ReferenceResolutionException.class,
                () -> placements.resolveCellAddress("missing", "ID", 0));
        assertEquals("UNKNOWN_SECTION", e.getCode());
    }
}
