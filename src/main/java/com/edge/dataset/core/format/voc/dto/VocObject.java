package com.edge.dataset.core.format.voc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

/**
 * &lt;object&gt; 元素，一个目标
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "pose", "truncated", "difficult", "bndbox"})
public class VocObject {
    private String name;
    private String pose;
    private String truncated;   // 0/1
    private String difficult;   // 0/1
    private VocBndBox bndbox;
}
