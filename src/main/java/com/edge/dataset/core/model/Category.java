package com.edge.dataset.core.model;

import java.util.Objects;

/**
 * 类别
 * <p>
 * id 在同一数据集内唯一；name 按惯例唯一但不强制
 */
public class Category {
    private int id;
    private final String name;
    private final String supercategory;

    public Category(int id, String name) {
        this(id, name, null);
    }

    public Category(int id, String name, String supercategory) {
        this.id = id;
        this.name = name;
        this.supercategory = supercategory;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public String getSupercategory() { return supercategory; }

    /**
     * 仅供 Dataset 在重新编号时调用
     */
    void setId(int id) { this.id = id; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Category)) {
            return false;
        }
        Category other = (Category) o;
        return id == other.id && Objects.equals(name, other.name)
            && Objects.equals(supercategory, other.supercategory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, supercategory);
    }

    @Override
    public String toString() {
        return "Category{id=" + id + ", name='" + name + "'}";
    }
}
