package com.edge.dataset.core.format.voc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Pascal VOC 标注文件根元素 &lt;annotation&gt;
 * <p>
 * 数值字段按字符串绑定，由 VocReader 统一解析并报告格式错误
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "annotation")
@JsonPropertyOrder({"folder", "filename", "path", "source", "size", "segmented", "objects"})
public class VocAnnotation {
    private String folder;
    private String filename;
    private String path;
    private VocSource source;
    private VocSize size;
    private String segmented;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "object")
    private List<VocObject> objects = new ArrayList<>();

    /**
     * 不相邻的多段 &lt;object&gt; 会分多次调用，这里追加而不是替换
     */
    public void setObjects(List<VocObject> objects) {
        if (objects != null) {
            this.objects.addAll(objects);
        }
    }
}
