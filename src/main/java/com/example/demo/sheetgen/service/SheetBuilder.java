package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.model.SectionConfig;
import com.example.demo.sheetgen.model.SheetTemplate;

/**
 * Fluent helper returned by {@link ReportExporter#addSheet(String)}.
 *
 * <pre>
 * ReportExporter exporter = ReportExporter.create()
 *     .addSheet("Products")
 *     .addSection(SectionConfig.builder().id("products").title("Products").showHeader(true).build())
 *     .build();
 * </pre>
 */
public class SheetBuilder {
    private final ReportExporter exporter;
    private final SheetTemplate sheet;

    SheetBuilder(ReportExporter exporter, SheetTemplate sheet) {
        this.exporter = exporter;
        this.sheet = sheet;
    }

    /**
     * @throws com.example.demo.sheetgen.exception.TemplateConfigException when the section id is already used
     */
    public SheetBuilder addSection(SectionConfig section) {
        exporter.ensureUniqueSectionId(section.getId());
        sheet.getSections().add(section);
        return this;
    }

    public ReportExporter build() {
        return exporter;
    }
}
