package com.edge.dataset.core.format.coco.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * COCO 格式数据集（JSON 顶层对象）
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"info", "licenses", "categories", "images", "annotations"})
public class CocoDocument {
    private Map<String, Object> info;
    private List<Object> licenses;
    private List<CocoCategory> categories;
    private List<CocoImage> images;
    private List<CocoAnnotation> annotations;
}
