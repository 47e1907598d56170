package com.edge.dataset.core.format.coco.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * COCO 图片信息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "file_name", "width", "height"})
public class CocoImage {
    private Integer id;
    @JsonProperty("file_name")
    private String fileName;
    private Integer width;
    private Integer height;
}
