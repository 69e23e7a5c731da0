package com.example.demo.sheetgen.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Export defaults bound from application.yml.
 *
 * Example application.yml:
 *
 * sheetgen:
 *   export:
 *     default-column-width: 20
 *     locked-fill-color: E0E0E0
 *     hidden-fill-color: FFFF00
 *     stream-flush-rows: 500
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "sheetgen.export")
public class ReportExportProperties {

    /**
     * Width in characters of columns discovered from data
     */
    private double defaultColumnWidth = 20;

    /**
     * Fill applied to locked cells that have no explicit fill
     */
    private String lockedFillColor = "E0E0E0";

    /**
     * Fill of hidden metadata rows and hidden sections
     */
    private String hiddenFillColor = "FFFF00";

    /**
     * Row-count boundary at which the streaming writer flushes buffered rows
     */
    private int streamFlushRows = 500;

    public ExportSettings toSettings() {
        return ExportSettings.builder()
                .defaultColumnWidth(defaultColumnWidth)
                .lockedFillColor(lockedFillColor)
                .hiddenFillColor(hiddenFillColor)
                .streamFlushRows(streamFlushRows)
                .build();
    }
}
