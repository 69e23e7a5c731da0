package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.model.AlignmentTemplate;
import com.example.demo.sheetgen.model.FillTemplate;
import com.example.demo.sheetgen.model.FontTemplate;
import com.example.demo.sheetgen.model.StyleTemplate;

/**
 * Cascades explicit and default styles into the concrete style of a cell class.
 * The lock flag always comes from the layout, never from either style input.
 */
public class StyleResolver {
    private final String lockedFillColor;
    private final String hiddenFillColor;

    public StyleResolver(String lockedFillColor, String hiddenFillColor) {
        this.lockedFillColor = lockedFillColor;
        this.hiddenFillColor = hiddenFillColor;
    }

    public StyleTemplate resolve(StyleTemplate explicit, StyleTemplate defaultStyle, boolean locked) {
        StyleTemplate.StyleTemplateBuilder builder;
        if (explicit == null) {
            builder = defaultStyle != null ? defaultStyle.toBuilder() : StyleTemplate.builder();
        } else {
            builder = explicit.toBuilder();
            if (defaultStyle != null) {
                if (explicit.getFont() == null) {
                    builder.font(defaultStyle.getFont());
                }
                if (explicit.getFill() == null) {
                    builder.fill(defaultStyle.getFill());
                }
                if (explicit.getAlignment() == null) {
                    builder.alignment(defaultStyle.getAlignment());
                }
            }
        }
        StyleTemplate resolved = builder.locked(locked).build();
        if (locked && resolved.getFill() == null) {
            resolved.setFill(FillTemplate.builder().color(lockedFillColor).build());
        }
        return resolved;
    }

    /** Bold, centered horizontally, top aligned. Used for titles and headers. */
    public StyleTemplate titleDefault() {
        return StyleTemplate.builder()
                .font(FontTemplate.builder().bold(true).build())
                .alignment(AlignmentTemplate.builder().horizontal("center").vertical("top").build())
                .build();
    }

    public StyleTemplate headerDefault() {
        return titleDefault();
    }

    /** Highlight for hidden metadata rows and hidden-section data. */
    public StyleTemplate hiddenDefault() {
        return StyleTemplate.builder()
                .fill(FillTemplate.builder().color(hiddenFillColor).build())
                .build();
    }

    public StyleTemplate hiddenFieldRowStyle() {
        return resolve(null, hiddenDefault(), true);
    }
}
