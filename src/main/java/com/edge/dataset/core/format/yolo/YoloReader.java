package com.edge.dataset.core.format.yolo;

import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.format.DatasetFormat;
import com.edge.dataset.core.format.FormatReader;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.BBox;
import com.edge.dataset.core.model.Category;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.edge.dataset.exception.FormatException;
import com.edge.dataset.exception.MissingResourceException;
import com.edge.dataset.util.ImageSize;
import com.edge.dataset.util.ImageSizeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * YOLO 格式标注读取
 * <p>
 * YOLO 标注格式:
 * <class_id> <center_x> <center_y> <width> <height>
 * <p>
 * 坐标值为归一化值 (0.0 - 1.0)，需要对应图片的像素尺寸才能还原，
 * 因此除标注目录外还需要图片目录和类别文件（行号 = 类别 ID）
 */
public class YoloReader implements FormatReader {
    private static final Logger logger = LoggerFactory.getLogger(YoloReader.class);

    private final ImageSizeReader imageSizeReader;
    private final String defaultImageExt;

    public YoloReader(ImageSizeReader imageSizeReader, String defaultImageExt) {
        this.imageSizeReader = imageSizeReader;
        this.defaultImageExt = defaultImageExt;
    }

    @Override
    public DatasetFormat getFormat() {
        return DatasetFormat.YOLO;
    }

    @Override
    public Dataset read(Path labelsDir, ConvertOptions options) throws IOException {
        Path imagesDir = options != null ? options.getImagesDir() : null;
        Path classesFile = options != null ? options.getClassesFile() : null;
        String imageExt = options != null && options.getImageExt() != null ? options.getImageExt() : defaultImageExt;

        if (imagesDir == null) {
            throw new MissingResourceException("YOLO source requires an images directory");
        }
        if (classesFile == null) {
            throw new MissingResourceException("YOLO source requires a classes file");
        }
        if (!Files.isDirectory(labelsDir)) {
            throw new MissingResourceException("YOLO labels directory not found", labelsDir);
        }
        if (!Files.isDirectory(imagesDir)) {
            throw new MissingResourceException("Images directory not found", imagesDir);
        }
        if (!Files.isRegularFile(classesFile)) {
            throw new MissingResourceException("Classes file not found", classesFile);
        }

        Dataset dataset = new Dataset();
        List<String> classNames = readClassNames(classesFile);
        for (int i = 0; i < classNames.size(); i++) {
            dataset.addCategory(new Category(i, classNames.get(i)));
        }

        for (Path labelFile : listLabelFiles(labelsDir, classesFile)) {
            dataset.addImage(readLabelFile(labelFile, imagesDir, imageExt, classNames));
        }

        logger.info("Read YOLO dataset from {}: {}", labelsDir, dataset);
        return dataset;
    }

    /**
     * 读取类别文件，每个非空行一个类别名
     */
    static List<String> readClassNames(Path classesFile) throws IOException {
        return Files.readAllLines(classesFile, StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }

    private List<Path> listLabelFiles(Path labelsDir, Path classesFile) throws IOException {
        Path classesAbs = classesFile.toAbsolutePath().normalize();
        try (Stream<Path> stream = Files.list(labelsDir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".txt"))
                    .filter(p -> !p.toAbsolutePath().normalize().equals(classesAbs))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private Image readLabelFile(Path labelFile, Path imagesDir, String imageExt, List<String> classNames) throws IOException {
        String fileName = labelFile.getFileName().toString();
        String baseName = fileName.substring(0, fileName.length() - ".txt".length());

        Path imagePath = imageSizeReader.locate(imagesDir, baseName, imageExt);
        if (imagePath == null) {
            throw new MissingResourceException("No image found for label file " + fileName, imagesDir.resolve(baseName + imageExt));
        }
        ImageSize size = imageSizeReader.readSize(imagePath);

        Image image = new Image(imagePath.getFileName().toString(), size.getWidth(), size.getHeight());

        List<String> lines = Files.readAllLines(labelFile, StandardCharsets.UTF_8);
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            image.addAnnotation(parseLine(line, size, classNames, labelFile, lineNumber));
        }

        logger.debug("Parsed {} objects from {}", image.getAnnotations().size(), labelFile);
        return image;
    }

    /**
     * 解析单行标注
     */
    private static Annotation parseLine(String line, ImageSize size, List<String> classNames,
                                        Path labelFile, int lineNumber) {
        String[] parts = line.split("\\s+");
        if (parts.length != 5) {
            throw new FormatException(String.format("Invalid YOLO line %d in %s: expected 5 fields, got %d: '%s'",
                lineNumber, labelFile, parts.length, line));
        }

        int classId;
        double[] values = new double[4];
        try {
            classId = Integer.parseInt(parts[0]);
            for (int i = 0; i < 4; i++) {
                values[i] = Double.parseDouble(parts[i + 1]);
            }
        } catch (NumberFormatException e) {
            throw new FormatException(String.format("Invalid number on line %d in %s: '%s'",
                lineNumber, labelFile, line), e);
        }

        if (classId < 0 || classId >= classNames.size()) {
            throw new FormatException(String.format("Class id %d out of range [0, %d) on line %d in %s",
                classId, classNames.size(), lineNumber, labelFile));
        }

        BBox bbox = BBox.fromNormalized(values[0], values[1], values[2], values[3],
            size.getWidth(), size.getHeight());
        return new Annotation(bbox, classId, classNames.get(classId));
    }
}
