package com.edge.dataset.core.model;

/**
 * 单个目标标注
 * <p>
 * categoryName 是 categoryId 的冗余副本，供按名称索引的格式（VOC）直接使用。
 * difficult / truncated 为 Pascal VOC 语义，默认 false；COCO 写出时丢弃
 */
public class Annotation {
    private final BBox bbox;
    private int categoryId;
    private String categoryName;
    private boolean difficult;
    private boolean truncated;
    private Double area;          // 为空时按 bbox 面积计算
    private int iscrowd;

    public Annotation(BBox bbox, int categoryId, String categoryName) {
        this.bbox = bbox;
        this.categoryId = categoryId;
        this.categoryName = categoryName;
    }

    public Annotation(BBox bbox, int categoryId, String categoryName, boolean difficult, boolean truncated) {
        this(bbox, categoryId, categoryName);
        this.difficult = difficult;
        this.truncated = truncated;
    }

    public BBox getBbox() { return bbox; }

    public int getCategoryId() { return categoryId; }
    public void setCategoryId(int categoryId) { this.categoryId = categoryId; }

    public String getCategoryName() { return categoryName; }
    public void setCategoryName(String categoryName) { this.categoryName = categoryName; }

    public boolean isDifficult() { return difficult; }
    public void setDifficult(boolean difficult) { this.difficult = difficult; }

    public boolean isTruncated() { return truncated; }
    public void setTruncated(boolean truncated) { this.truncated = truncated; }

    public double getArea() {
        return area != null ? area : bbox.getArea();
    }

    public void setArea(Double area) { this.area = area; }

    public int getIscrowd() { return iscrowd; }
    public void setIscrowd(int iscrowd) { this.iscrowd = iscrowd; }

    @Override
    public String toString() {
        return "Annotation{" +
                "category=" + categoryId + "/'" + categoryName + '\'' +
                ", bbox=" + bbox +
                (difficult ? ", difficult" : "") +
                (truncated ? ", truncated" : "") +
                '}';
    }
}
