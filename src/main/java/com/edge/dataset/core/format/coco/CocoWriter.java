package com.edge.dataset.core.format.coco;

import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.format.DatasetFormat;
import com.edge.dataset.core.format.FormatWriter;
import com.edge.dataset.core.format.coco.dto.CocoAnnotation;
import com.edge.dataset.core.format.coco.dto.CocoCategory;
import com.edge.dataset.core.format.coco.dto.CocoDocument;
import com.edge.dataset.core.format.coco.dto.CocoImage;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.Category;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * COCO 格式写出
 * <p>
 * difficult / truncated 不属于 COCO 规范，写出时丢弃
 */
public class CocoWriter implements FormatWriter {
    private static final Logger logger = LoggerFactory.getLogger(CocoWriter.class);

    private final ObjectMapper objectMapper;
    private final boolean prettyPrint;

    public CocoWriter(boolean prettyPrint) {
        this(new ObjectMapper(), prettyPrint);
    }

    public CocoWriter(ObjectMapper objectMapper, boolean prettyPrint) {
        this.objectMapper = objectMapper;
        this.prettyPrint = prettyPrint;
    }

    @Override
    public DatasetFormat getFormat() {
        return DatasetFormat.COCO;
    }

    @Override
    public void write(Dataset dataset, Path target, ConvertOptions options) throws IOException {
        CocoDocument document = toDocument(dataset);

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectWriter writer = prettyPrint ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
        writer.writeValue(target.toFile(), document);

        logger.info("Wrote COCO dataset to {}: {} images, {} annotations, {} categories",
            target, document.getImages().size(), document.getAnnotations().size(), document.getCategories().size());
    }

    CocoDocument toDocument(Dataset dataset) {
        CocoDocument document = new CocoDocument();
        document.setInfo(new LinkedHashMap<>(dataset.getInfo()));
        document.setLicenses(new ArrayList<>());

        List<CocoCategory> categories = new ArrayList<>();
        for (Category category : dataset.getCategories()) {
            categories.add(new CocoCategory(category.getId(), category.getName(), category.getSupercategory()));
        }
        document.setCategories(categories);

        // 保留来源 ID；没有来源 ID 或冲突时顺序分配
        Set<Integer> usedImageIds = new HashSet<>();
        for (Image image : dataset.getImages()) {
            if (image.getImageId() != null) {
                usedImageIds.add(image.getImageId());
            }
        }

        List<CocoImage> images = new ArrayList<>();
        List<CocoAnnotation> annotations = new ArrayList<>();
        Set<Integer> emittedImageIds = new HashSet<>();
        int nextImageId = 1;
        int annotationId = 1;

        for (Image image : dataset.getImages()) {
            Integer imageId = image.getImageId();
            if (imageId == null || !emittedImageIds.add(imageId)) {
                while (usedImageIds.contains(nextImageId) || emittedImageIds.contains(nextImageId)) {
                    nextImageId++;
                }
                imageId = nextImageId;
                emittedImageIds.add(imageId);
            }
            images.add(new CocoImage(imageId, image.getFileName(), image.getWidth(), image.getHeight()));

            for (Annotation annotation : image.getAnnotations()) {
                double[] xywh = annotation.getBbox().toXywh();
                CocoAnnotation ann = new CocoAnnotation();
                ann.setId(annotationId++);
                ann.setImageId(imageId);
                ann.setCategoryId(annotation.getCategoryId());
                ann.setBbox(List.of(xywh[0], xywh[1], xywh[2], xywh[3]));
                ann.setArea(annotation.getArea());
                ann.setIscrowd(annotation.getIscrowd());
                annotations.add(ann);
            }
        }

        document.setImages(images);
        document.setAnnotations(annotations);
        return document;
    }
}
