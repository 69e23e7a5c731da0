package com.example.demo.sheetgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Authoring-level cell style. Every part is optional; unset parts are
 * inherited from the default style of the row class being rendered.
 * Value equality is relied upon to share POI cell styles.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StyleTemplate {
    private FontTemplate font;
    private FillTemplate fill;
    private AlignmentTemplate alignment;

    /**
     * Accepted for template compatibility only. The effective lock state is
     * decided by the layout (section/column lock), never by the style.
     */
    private Boolean locked;
}
