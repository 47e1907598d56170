package com.edge.dataset.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 图片及其标注
 * <p>
 * width / height 为空表示读取时尚未得知尺寸，可在转换过程中再推断
 */
public class Image {
    private final String fileName;
    private Integer width;
    private Integer height;
    private Integer imageId;   // 来源格式中的图片 ID（仅 COCO 有）
    private final List<Annotation> annotations = new ArrayList<>();

    public Image(String fileName, Integer width, Integer height) {
        this.fileName = fileName;
        this.width = width;
        this.height = height;
    }

    public Image(String fileName) {
        this(fileName, null, null);
    }

    public void addAnnotation(Annotation annotation) {
        annotations.add(annotation);
    }

    public boolean hasKnownSize() {
        return width != null && height != null && width > 0 && height > 0;
    }

    public void setSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    /**
     * 去掉扩展名的文件名，用作 YOLO/VOC 标注文件名
     */
    public String getBaseName() {
        String name = fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public String getFileName() { return fileName; }
    public Integer getWidth() { return width; }
    public Integer getHeight() { return height; }

    public Integer getImageId() { return imageId; }
    public void setImageId(Integer imageId) { this.imageId = imageId; }

    public List<Annotation> getAnnotations() {
        return Collections.unmodifiableList(annotations);
    }

    @Override
    public String toString() {
        return "Image{" + fileName + " " + width + "x" + height +
                ", annotations=" + annotations.size() + '}';
    }
}
