package com.example.demo.sheetgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Points at one field of another section; the row is implied by the row of
 * the comparison cell being rendered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareConfig {
    private String sectionId;
    private String fieldName;
}
