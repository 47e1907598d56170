package com.edge.dataset.core.format.coco;

import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.format.DatasetFormat;
import com.edge.dataset.core.format.FormatReader;
import com.edge.dataset.core.format.coco.dto.CocoAnnotation;
import com.edge.dataset.core.format.coco.dto.CocoCategory;
import com.edge.dataset.core.format.coco.dto.CocoDocument;
import com.edge.dataset.core.format.coco.dto.CocoImage;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.BBox;
import com.edge.dataset.core.model.Category;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.edge.dataset.exception.FormatException;
import com.edge.dataset.exception.MissingResourceException;
import com.edge.dataset.exception.ReferenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * COCO 格式读取
 * <p>
 * 单个 JSON 文件，顶层包含 images / annotations / categories 三个数组。
 * 标注的 bbox 为 [x, y, width, height]，读入后转换为角点坐标
 */
public class CocoReader implements FormatReader {
    private static final Logger logger = LoggerFactory.getLogger(CocoReader.class);

    private final ObjectMapper objectMapper;

    public CocoReader() {
        // 宽高、ID 为整数，小数值报格式错误而不是截断
        this(new ObjectMapper().disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT));
    }

    public CocoReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DatasetFormat getFormat() {
        return DatasetFormat.COCO;
    }

    @Override
    public Dataset read(Path source, ConvertOptions options) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new MissingResourceException("COCO annotation file not found", source);
        }

        CocoDocument document;
        try (InputStream in = Files.newInputStream(source)) {
            document = objectMapper.readValue(in, CocoDocument.class);
        } catch (JsonProcessingException e) {
            throw new FormatException("Malformed COCO JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new FormatException("Empty COCO document: " + source);
        }

        Dataset dataset = toDataset(document, source);
        logger.info("Read COCO dataset from {}: {}", source, dataset);
        return dataset;
    }

    Dataset toDataset(CocoDocument document, Path source) {
        requireArray(document.getImages(), "images", source);
        requireArray(document.getAnnotations(), "annotations", source);
        requireArray(document.getCategories(), "categories", source);

        Dataset dataset = new Dataset();
        if (document.getInfo() != null) {
            dataset.getInfo().putAll(document.getInfo());
        }

        for (CocoCategory cat : document.getCategories()) {
            if (cat == null || cat.getId() == null || cat.getName() == null) {
                throw new FormatException("Category requires 'id' and 'name' in " + source + ": " + cat);
            }
            dataset.addCategory(new Category(cat.getId(), cat.getName(), cat.getSupercategory()));
        }

        Map<Integer, Image> imageMap = new HashMap<>();
        for (CocoImage img : document.getImages()) {
            if (img == null || img.getId() == null || img.getFileName() == null) {
                throw new FormatException("Image requires 'id' and 'file_name' in " + source + ": " + img);
            }
            if (imageMap.containsKey(img.getId())) {
                throw new FormatException("Duplicate image id " + img.getId() + " in " + source);
            }
            Image image = new Image(img.getFileName(), img.getWidth(), img.getHeight());
            image.setImageId(img.getId());
            dataset.addImage(image);
            imageMap.put(img.getId(), image);
        }

        int index = 0;
        for (CocoAnnotation ann : document.getAnnotations()) {
            index++;
            if (ann == null || ann.getImageId() == null || ann.getCategoryId() == null || ann.getBbox() == null) {
                throw new FormatException("Annotation #" + index + " requires 'image_id', 'category_id' and 'bbox' in " + source);
            }

            Image image = imageMap.get(ann.getImageId());
            if (image == null) {
                throw new ReferenceException("Annotation #" + index + " references unknown image_id " + ann.getImageId());
            }
            if (!dataset.hasCategory(ann.getCategoryId())) {
                throw new ReferenceException("Annotation #" + index + " references unknown category_id " + ann.getCategoryId());
            }
            Category category = dataset.getCategoryById(ann.getCategoryId());

            Annotation annotation = new Annotation(toBBox(ann.getBbox(), index), category.getId(), category.getName());
            annotation.setArea(ann.getArea());
            annotation.setIscrowd(ann.getIscrowd() != null ? ann.getIscrowd() : 0);
            image.addAnnotation(annotation);
        }

        return dataset;
    }

    private static BBox toBBox(List<Double> bbox, int index) {
        if (bbox.size() != 4 || bbox.contains(null)) {
            throw new FormatException("Annotation #" + index + " bbox must be [x, y, width, height], got " + bbox);
        }
        return BBox.fromXywh(bbox.get(0), bbox.get(1), bbox.get(2), bbox.get(3));
    }

    private static void requireArray(List<?> value, String key, Path source) {
        if (value == null) {
            throw new FormatException("Missing required key '" + key + "' in " + source);
        }
    }
}
