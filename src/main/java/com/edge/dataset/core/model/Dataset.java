package com.edge.dataset.core.model;

import com.edge.dataset.exception.CategoryNotFoundException;
import com.edge.dataset.exception.DuplicateCategoryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 数据集
 * <p>
 * 一次转换过程中由 Reader 构建、由 Writer 消费，格式无关。
 * 类别列表是类别 ID 与名称对应关系的唯一依据
 */
public class Dataset {
    private final List<Image> images = new ArrayList<>();
    private final List<Category> categories = new ArrayList<>();
    private final Map<Integer, Category> categoryIndex = new LinkedHashMap<>();
    private final Map<String, Object> info = new LinkedHashMap<>();

    /**
     * 添加类别
     *
     * @throws DuplicateCategoryException 类别 ID 已存在
     */
    public void addCategory(Category category) {
        if (categoryIndex.containsKey(category.getId())) {
            throw new DuplicateCategoryException(category.getId());
        }
        categories.add(category);
        categoryIndex.put(category.getId(), category);
    }

    /**
     * 追加图片，不检查文件名重复
     */
    public void addImage(Image image) {
        images.add(image);
    }

    public Category getCategoryById(int id) {
        Category category = categoryIndex.get(id);
        if (category == null) {
            throw CategoryNotFoundException.forId(id);
        }
        return category;
    }

    public Category getCategoryByName(String name) {
        return findCategoryByName(name).orElseThrow(() -> CategoryNotFoundException.forName(name));
    }

    public Optional<Category> findCategoryByName(String name) {
        for (Category category : categories) {
            if (category.getName().equals(name)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public boolean hasCategory(int id) {
        return categoryIndex.containsKey(id);
    }

    /**
     * 下一个可用的类别 ID（当前最大 ID + 1，空数据集为 0）
     */
    public int nextCategoryId() {
        return categories.stream().mapToInt(Category::getId).max().orElse(-1) + 1;
    }

    /**
     * 类别 ID 是否恰好为按列表顺序排列的 0..n-1
     */
    public boolean hasDenseCategoryIds() {
        for (int i = 0; i < categories.size(); i++) {
            if (categories.get(i).getId() != i) {
                return false;
            }
        }
        return true;
    }

    /**
     * 按原 ID 升序将类别重新编号为 0..n-1，并同步所有标注的 categoryId
     *
     * @return 旧 ID 到新 ID 的映射
     */
    public Map<Integer, Integer> compactCategoryIds() {
        List<Category> sorted = new ArrayList<>(categories);
        sorted.sort(Comparator.comparingInt(Category::getId));

        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            mapping.put(sorted.get(i).getId(), i);
        }

        for (Image image : images) {
            for (Annotation annotation : image.getAnnotations()) {
                Integer newId = mapping.get(annotation.getCategoryId());
                if (newId == null) {
                    throw CategoryNotFoundException.forId(annotation.getCategoryId());
                }
                annotation.setCategoryId(newId);
            }
        }

        categories.clear();
        categoryIndex.clear();
        for (Category category : sorted) {
            category.setId(mapping.get(category.getId()));
            categories.add(category);
            categoryIndex.put(category.getId(), category);
        }
        return mapping;
    }

    public int getAnnotationCount() {
        return images.stream().mapToInt(img -> img.getAnnotations().size()).sum();
    }

    public List<Image> getImages() {
        return Collections.unmodifiableList(images);
    }

    public List<Category> getCategories() {
        return Collections.unmodifiableList(categories);
    }

    /**
     * COCO 的 info 块，仅 COCO 之间转换时保留
     */
    public Map<String, Object> getInfo() {
        return info;
    }

    @Override
    public String toString() {
        return "Dataset{images=" + images.size() +
                ", categories=" + categories.size() +
                ", annotations=" + getAnnotationCount() + '}';
    }
}
