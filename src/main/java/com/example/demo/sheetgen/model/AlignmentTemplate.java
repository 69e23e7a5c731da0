package com.example.demo.sheetgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlignmentTemplate {
    /** left, center, right */
    private String horizontal;
    /** top, center, bottom */
    private String vertical;
}
