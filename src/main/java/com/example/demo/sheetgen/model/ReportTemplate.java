package com.example.demo.sheetgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a declarative report template. Sheets render in list order.
 *
 * <pre>
 * sheets:
 *   - name: "Summary"
 *     sections:
 *       - id: "products"
 *         title: "Products"
 *         show_header: true
 *         columns:
 *           - field_name: "Name"
 *             header: "Product"
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportTemplate {
    @Builder.Default
    private List<SheetTemplate> sheets = new ArrayList<>();
}
