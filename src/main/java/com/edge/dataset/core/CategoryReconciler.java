package com.edge.dataset.core;

import com.edge.dataset.core.format.DatasetFormat;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.Category;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.edge.dataset.exception.ReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 类别对齐
 * <p>
 * 写出前以数据集的类别列表为准：
 * 1. 每个标注的 categoryId 必须能找到对应类别，categoryName 以类别列表为准重新同步；
 * 2. 目标格式以行号作为类别 ID（YOLO）时，将类别重新编号为连续的 0..n-1
 */
public class CategoryReconciler {
    private static final Logger logger = LoggerFactory.getLogger(CategoryReconciler.class);

    public void reconcile(Dataset dataset, DatasetFormat target) {
        syncAnnotationNames(dataset);

        if (target == DatasetFormat.YOLO && !dataset.hasDenseCategoryIds()) {
            Map<Integer, Integer> mapping = dataset.compactCategoryIds();
            logger.info("Renumbered {} categories for {} output: {}", mapping.size(), target, mapping);
        }
    }

    /**
     * 校验标注引用并同步冗余的类别名
     *
     * @throws ReferenceException 标注引用了不存在的类别
     */
    void syncAnnotationNames(Dataset dataset) {
        for (Image image : dataset.getImages()) {
            for (Annotation annotation : image.getAnnotations()) {
                if (!dataset.hasCategory(annotation.getCategoryId())) {
                    throw new ReferenceException("Annotation in " + image.getFileName()
                        + " references unknown category_id " + annotation.getCategoryId());
                }
                Category category = dataset.getCategoryById(annotation.getCategoryId());
                if (!category.getName().equals(annotation.getCategoryName())) {
                    logger.debug("Annotation category name '{}' replaced by '{}' (id {})",
                        annotation.getCategoryName(), category.getName(), category.getId());
                    annotation.setCategoryName(category.getName());
                }
            }
        }
    }
}
