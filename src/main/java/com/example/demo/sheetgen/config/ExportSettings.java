package com.example.demo.sheetgen.config;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning values of one exporter. Immutable; the Spring-free defaults match
 * the defaults of {@link ReportExportProperties}.
 */
@Value
@Builder(toBuilder = true)
public class ExportSettings {
    @Builder.Default
    double defaultColumnWidth = 20;

    @Builder.Default
    String lockedFillColor = "E0E0E0";

    @Builder.Default
    String hiddenFillColor = "FFFF00";

    /**
     * Rows kept in memory by the streaming writer between flushes
     */
    @Builder.Default
    int streamFlushRows = 500;

    public static ExportSettings defaults() {
        return ExportSettings.builder().build();
    }
}
