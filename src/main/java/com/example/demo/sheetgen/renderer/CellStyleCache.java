package com.example.demo.sheetgen.renderer;

import com.example.demo.sheetgen.model.AlignmentTemplate;
import com.example.demo.sheetgen.model.FontTemplate;
import com.example.demo.sheetgen.model.StyleTemplate;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;

import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Converts resolved style templates into workbook cell styles, creating each
 * distinct style once per workbook.
 */
@Slf4j
public class CellStyleCache {
    private final Workbook workbook;
    private final Map<StyleTemplate, CellStyle> styles = new HashMap<>();

    public CellStyleCache(Workbook workbook) {
        this.workbook = workbook;
    }

    public CellStyle get(StyleTemplate template) {
        return styles.computeIfAbsent(template, this::create);
    }

    public int size() {
        return styles.size();
    }

    private CellStyle create(StyleTemplate template) {
        XSSFCellStyle style = (XSSFCellStyle) workbook.createCellStyle();
        FontTemplate font = template.getFont();
        if (font != null) {
            XSSFFont xssfFont = (XSSFFont) workbook.createFont();
            xssfFont.setBold(font.isBold());
            XSSFColor color = toColor(font.getColor());
            if (color != null) {
                xssfFont.setColor(color);
            }
            style.setFont(xssfFont);
        }
        if (template.getFill() != null) {
            XSSFColor color = toColor(template.getFill().getColor());
            if (color != null) {
                style.setFillForegroundColor(color);
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            }
        }
        AlignmentTemplate alignment = template.getAlignment();
        if (alignment != null) {
            HorizontalAlignment horizontal = horizontal(alignment.getHorizontal());
            if (horizontal != null) {
                style.setAlignment(horizontal);
            }
            VerticalAlignment vertical = vertical(alignment.getVertical());
            if (vertical != null) {
                style.setVerticalAlignment(vertical);
            }
        }
        style.setLocked(Boolean.TRUE.equals(template.getLocked()));
        return style;
    }

    private XSSFColor toColor(String hex) {
        if (hex == null || hex.isBlank()) {
            return null;
        }
        String rgb = hex.trim();
        if (rgb.startsWith("#")) {
            rgb = rgb.substring(1);
        }
        if (rgb.length() != 6) {
            log.warn("Ignoring color '{}': expected six hex digits", hex);
            return null;
        }
        try {
            return new XSSFColor(HexFormat.of().parseHex(rgb), null);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring color '{}': {}", hex, e.getMessage());
            return null;
        }
    }

    private HorizontalAlignment horizontal(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "left":
                return HorizontalAlignment.LEFT;
            case "center":
            case "centre":
                return HorizontalAlignment.CENTER;
            case "right":
                return HorizontalAlignment.RIGHT;
            case "fill":
                return HorizontalAlignment.FILL;
            case "justify":
                return HorizontalAlignment.JUSTIFY;
            case "distributed":
                return HorizontalAlignment.DISTRIBUTED;
            case "centercontinuous":
            case "center_continuous":
                return HorizontalAlignment.CENTER_SELECTION;
            case "general":
                return HorizontalAlignment.GENERAL;
            default:
                log.warn("Unknown horizontal alignment '{}'", value);
                return null;
        }
    }

    private VerticalAlignment vertical(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "top":
                return VerticalAlignment.TOP;
            case "center":
            case "middle":
                return VerticalAlignment.CENTER;
            case "bottom":
                return VerticalAlignment.BOTTOM;
            case "justify":
                return VerticalAlignment.JUSTIFY;
            case "distributed":
                return VerticalAlignment.DISTRIBUTED;
            default:
                log.warn("Unknown vertical alignment '{}'", value);
                return null;
        }
    }
}
