package com.edge.dataset.core.format.voc;

import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.format.DatasetFormat;
import com.edge.dataset.core.format.FormatReader;
import com.edge.dataset.core.format.voc.dto.VocAnnotation;
import com.edge.dataset.core.format.voc.dto.VocBndBox;
import com.edge.dataset.core.format.voc.dto.VocObject;
import com.edge.dataset.core.format.voc.dto.VocSize;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.BBox;
import com.edge.dataset.core.model.Category;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.edge.dataset.exception.FormatException;
import com.edge.dataset.exception.MissingResourceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Pascal VOC 格式读取
 * <p>
 * 目录下每张图片一个 XML 文件。VOC 只有类别名称没有 ID，
 * 类别名首次出现时按出现顺序分配下一个可用 ID
 */
public class VocReader implements FormatReader {
    private static final Logger logger = LoggerFactory.getLogger(VocReader.class);

    private final XmlMapper xmlMapper;

    public VocReader() {
        this(new XmlMapper());
    }

    public VocReader(XmlMapper xmlMapper) {
        this.xmlMapper = xmlMapper;
    }

    @Override
    public DatasetFormat getFormat() {
        return DatasetFormat.VOC;
    }

    @Override
    public Dataset read(Path annotationsDir, ConvertOptions options) throws IOException {
        if (!Files.isDirectory(annotationsDir)) {
            throw new MissingResourceException("VOC annotations directory not found", annotationsDir);
        }

        List<Path> xmlFiles;
        try (Stream<Path> stream = Files.list(annotationsDir)) {
            xmlFiles = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".xml"))
                    .sorted()
                    .collect(Collectors.toList());
        }

        Dataset dataset = new Dataset();
        for (Path xmlFile : xmlFiles) {
            dataset.addImage(readFile(xmlFile, dataset));
        }

        logger.info("Read VOC dataset from {}: {}", annotationsDir, dataset);
        return dataset;
    }

    private Image readFile(Path xmlFile, Dataset dataset) throws IOException {
        VocAnnotation doc;
        try (InputStream in = Files.newInputStream(xmlFile)) {
            doc = xmlMapper.readValue(in, VocAnnotation.class);
        } catch (JsonProcessingException e) {
            throw new FormatException("Malformed VOC XML in " + xmlFile + ": " + e.getOriginalMessage(), e);
        }
        if (doc == null) {
            throw new FormatException("Empty VOC document: " + xmlFile);
        }

        String filename = required(doc.getFilename(), "filename", xmlFile);
        VocSize size = doc.getSize();
        if (size == null) {
            throw new FormatException("Missing required element 'size' in " + xmlFile);
        }
        int width = parseInt(required(size.getWidth(), "size/width", xmlFile), "size/width", xmlFile);
        int height = parseInt(required(size.getHeight(), "size/height", xmlFile), "size/height", xmlFile);

        Image image = new Image(filename, width, height);

        if (doc.getObjects() != null) {
            for (VocObject obj : doc.getObjects()) {
                image.addAnnotation(toAnnotation(obj, dataset, xmlFile));
            }
        }

        logger.debug("Parsed {} objects from {}", image.getAnnotations().size(), xmlFile);
        return image;
    }

    private static Annotation toAnnotation(VocObject obj, Dataset dataset, Path xmlFile) {
        if (obj == null) {
            throw new FormatException("Empty 'object' element in " + xmlFile);
        }
        String name = required(obj.getName(), "object/name", xmlFile);

        VocBndBox box = obj.getBndbox();
        if (box == null) {
            throw new FormatException("Missing required element 'object/bndbox' for '" + name + "' in " + xmlFile);
        }
        BBox bbox = BBox.of(
            parseDouble(required(box.getXmin(), "bndbox/xmin", xmlFile), "bndbox/xmin", xmlFile),
            parseDouble(required(box.getYmin(), "bndbox/ymin", xmlFile), "bndbox/ymin", xmlFile),
            parseDouble(required(box.getXmax(), "bndbox/xmax", xmlFile), "bndbox/xmax", xmlFile),
            parseDouble(required(box.getYmax(), "bndbox/ymax", xmlFile), "bndbox/ymax", xmlFile));

        Category category = dataset.findCategoryByName(name).orElseGet(() -> {
            Category created = new Category(dataset.nextCategoryId(), name);
            dataset.addCategory(created);
            return created;
        });

        return new Annotation(bbox, category.getId(), category.getName(),
            parseFlag(obj.getDifficult(), "difficult", xmlFile),
            parseFlag(obj.getTruncated(), "truncated", xmlFile));
    }

    private static String required(String value, String element, Path xmlFile) {
        if (value == null || value.trim().isEmpty()) {
            throw new FormatException("Missing required element '" + element + "' in " + xmlFile);
        }
        return value.trim();
    }

    private static double parseDouble(String value, String element, Path xmlFile) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new FormatException("Invalid number for '" + element + "' in " + xmlFile + ": " + value, e);
        }
    }

    private static int parseInt(String value, String element, Path xmlFile) {
        return (int) Math.round(parseDouble(value, element, xmlFile));
    }

    /**
     * 缺省为 false，接受 0/1/true/false
     */
    static boolean parseFlag(String value, String element, Path xmlFile) {
        if (value == null || value.trim().isEmpty()) {
            return false;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "true":
                return true;
            case "0":
            case "false":
                return false;
            default:
                throw new FormatException("Invalid value for '" + element + "' in " + xmlFile + ": " + value);
        }
    }
}
