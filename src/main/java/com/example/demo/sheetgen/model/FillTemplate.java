package com.example.demo.sheetgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FillTemplate {
    /** Hex RGB of a solid pattern fill. */
    private String color;
}
