package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.aspect.LogExecutionTime;
import com.example.demo.sheetgen.config.ReportExportProperties;
import com.example.demo.sheetgen.model.ReportTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates exporters configured from application properties.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportExporterFactory {
    private final ReportTemplateLoader templateLoader;
    private final ReportExportProperties exportProperties;
    private final WorkbookOutputService outputService;

    public ReportExporter create() {
        return fromTemplate(new ReportTemplate());
    }

    public ReportExporter fromTemplate(ReportTemplate template) {
        return new ReportExporter(template, exportProperties.toSettings(), outputService);
    }

    /**
     * Exporter over a fresh copy of the template with the given id.
     */
    @LogExecutionTime("Creating Exporter From Template")
    public ReportExporter fromTemplateId(String templateId) {
        byte[] source = templateLoader.loadTemplateSource(templateId);
        ReportTemplate template = templateLoader.parse(source, templateId);
        log.info("Loaded report template '{}' with {} sheets", templateId, template.getSheets().size());
        return fromTemplate(template);
    }

    public ReportExporter fromYaml(String yaml) {
        return fromTemplate(templateLoader.parse(yaml));
    }
}
