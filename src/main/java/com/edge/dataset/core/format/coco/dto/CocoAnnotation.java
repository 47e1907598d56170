package com.edge.dataset.core.format.coco.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * COCO 标注信息
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "image_id", "category_id", "bbox", "area", "iscrowd", "segmentation"})
public class CocoAnnotation {
    private Integer id;
    @JsonProperty("image_id")
    private Integer imageId;
    @JsonProperty("category_id")
    private Integer categoryId;
    private List<Double> bbox;     // [x, y, width, height] 像素坐标
    private Double area;
    private Integer iscrowd;
    private Object segmentation = new ArrayList<>();  // 多边形或 RLE，不解析，写出时为空数组
}
