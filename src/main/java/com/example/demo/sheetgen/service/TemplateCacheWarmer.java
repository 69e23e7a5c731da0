package com.example.demo.sheetgen.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Warms the template source cache at startup to avoid latency on the first export.
 *
 * sheetgen.templates.preload-ids=monthly-report,comparison-report
 */
@Slf4j
@Component
public class TemplateCacheWarmer {

    private final ReportTemplateLoader templateLoader;

    @Value("${sheetgen.templates.preload-ids:}")
    private List<String> preloadTemplateIds;

    @Value("${sheetgen.templates.cache-enabled:true}")
    private boolean cacheEnabled;

    public TemplateCacheWarmer(ReportTemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmCache() {
        if (!cacheEnabled) {
            log.info("Template cache warming skipped (caching disabled)");
            return;
        }
        if (preloadTemplateIds == null || preloadTemplateIds.isEmpty()) {
            log.info("Template cache warming skipped (no templates configured)");
            return;
        }
        log.info("Starting template cache warming for {} templates", preloadTemplateIds.size());
        long startTime = System.currentTimeMillis();
        int warmed = 0;
        for (String templateId : preloadTemplateIds) {
            if (warmTemplate(templateId.trim())) {
                warmed++;
            }
        }
        log.info("Template cache warming completed: {}/{} in {}ms", warmed, preloadTemplateIds.size(),
                System.currentTimeMillis() - startTime);
    }

    private boolean warmTemplate(String templateId) {
        try {
            byte[] source = templateLoader.loadTemplateSource(templateId);
            templateLoader.parse(source, templateId);
            log.info("  Warmed: {}", templateId);
            return true;
        } catch (Exception e) {
            log.error("  Failed to warm template: {}", templateId, e);
            return false;
        }
    }
}
