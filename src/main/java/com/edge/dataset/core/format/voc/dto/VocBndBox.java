package com.edge.dataset.core.format.voc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 绝对像素坐标的角点框
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"xmin", "ymin", "xmax", "ymax"})
public class VocBndBox {
    private String xmin;
    private String ymin;
    private String xmax;
    private String ymax;
}
