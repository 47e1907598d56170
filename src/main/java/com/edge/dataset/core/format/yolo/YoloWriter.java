package com.edge.dataset.core.format.yolo;

import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.format.DatasetFormat;
import com.edge.dataset.core.format.FormatWriter;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.Category;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.edge.dataset.exception.InvalidStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * YOLO 格式写出
 * <p>
 * 每张图片一个同名 .txt，每行 class_id x_center y_center width height（归一化），
 * 另写一个类别文件，按类别 ID 顺序每行一个名称
 */
public class YoloWriter implements FormatWriter {
    private static final Logger logger = LoggerFactory.getLogger(YoloWriter.class);

    private final String lineFormat;
    private final String classesFileName;

    /**
     * @param precision       归一化坐标保留的小数位数
     * @param classesFileName 未指定类别文件时使用的默认文件名
     */
    public YoloWriter(int precision, String classesFileName) {
        String number = "%." + precision + "f";
        this.lineFormat = "%d " + number + " " + number + " " + number + " " + number;
        this.classesFileName = classesFileName;
    }

    @Override
    public DatasetFormat getFormat() {
        return DatasetFormat.YOLO;
    }

    @Override
    public void write(Dataset dataset, Path labelsDir, ConvertOptions options) throws IOException {
        // 类别文件行号即类别 ID
        if (!dataset.hasDenseCategoryIds()) {
            throw new InvalidStateException("YOLO requires category ids 0..n-1 in list order, got "
                + dataset.getCategories());
        }
        Files.createDirectories(labelsDir);

        Path classesFile = resolveClassesFile(labelsDir, options);
        writeClassesFile(dataset, classesFile);

        for (Image image : dataset.getImages()) {
            if (!image.hasKnownSize()) {
                throw new InvalidStateException("Cannot normalize boxes for " + image.getFileName()
                    + ": image size is unknown");
            }
            Path labelPath = labelsDir.resolve(image.getBaseName() + ".txt");
            try (BufferedWriter writer = Files.newBufferedWriter(labelPath, StandardCharsets.UTF_8)) {
                for (Annotation annotation : image.getAnnotations()) {
                    writer.write(formatLine(annotation, image.getWidth(), image.getHeight()));
                    writer.newLine();
                }
            }
            logger.debug("Wrote {} objects to {}", image.getAnnotations().size(), labelPath);
        }

        logger.info("Wrote YOLO labels for {} images to {} (classes: {})",
            dataset.getImages().size(), labelsDir, classesFile);
    }

    String formatLine(Annotation annotation, int imageWidth, int imageHeight) {
        double[] norm = annotation.getBbox().toNormalized(imageWidth, imageHeight);
        return String.format(Locale.ROOT, lineFormat, annotation.getCategoryId(), norm[0], norm[1], norm[2], norm[3]);
    }

    private Path resolveClassesFile(Path labelsDir, ConvertOptions options) {
        if (options != null && options.getOutputClassesFile() != null) {
            return options.getOutputClassesFile();
        }
        if (options != null && options.getClassesFile() != null) {
            return options.getClassesFile();
        }
        Path parent = labelsDir.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(classesFileName) : labelsDir.resolve(classesFileName);
    }

    private void writeClassesFile(Dataset dataset, Path classesFile) throws IOException {
        Path parent = classesFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        List<String> names = new ArrayList<>();
        for (Category category : dataset.getCategories()) {
            names.add(category.getName());
        }
        Files.write(classesFile, names, StandardCharsets.UTF_8);
    }
}
