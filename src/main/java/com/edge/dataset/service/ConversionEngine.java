package com.edge.dataset.service;

import com.edge.dataset.config.ConverterConfig;
import com.edge.dataset.core.CategoryReconciler;
import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.format.DatasetFormat;
import com.edge.dataset.core.format.FormatReader;
import com.edge.dataset.core.format.FormatWriter;
import com.edge.dataset.core.format.coco.CocoReader;
import com.edge.dataset.core.format.coco.CocoWriter;
import com.edge.dataset.core.format.voc.VocReader;
import com.edge.dataset.core.format.voc.VocWriter;
import com.edge.dataset.core.format.yolo.YoloReader;
import com.edge.dataset.core.format.yolo.YoloWriter;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.edge.dataset.exception.MissingResourceException;
import com.edge.dataset.util.ImageSize;
import com.edge.dataset.util.ImageSizeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * 转换引擎
 * <p>
 * 流程：按格式选择 Reader 构建数据集 → 类别对齐、推断未知图片尺寸 → 按格式选择 Writer 写出。
 * 格式集合固定，Reader/Writer 通过显式映射选择
 */
@Service
public class ConversionEngine {
    private static final Logger logger = LoggerFactory.getLogger(ConversionEngine.class);

    private final Map<DatasetFormat, FormatReader> readers = new EnumMap<>(DatasetFormat.class);
    private final Map<DatasetFormat, FormatWriter> writers = new EnumMap<>(DatasetFormat.class);
    private final CategoryReconciler reconciler = new CategoryReconciler();
    private final ImageSizeReader imageSizeReader;
    private final ConverterConfig config;

    public ConversionEngine(ConverterConfig config) {
        this.config = config;
        ConverterConfig.YoloConfig yolo = config.getYolo();
        this.imageSizeReader = new ImageSizeReader(yolo.getFallbackImageExts());

        readers.put(DatasetFormat.COCO, new CocoReader());
        readers.put(DatasetFormat.YOLO, new YoloReader(imageSizeReader, yolo.getImageExt()));
        readers.put(DatasetFormat.VOC, new VocReader());

        writers.put(DatasetFormat.COCO, new CocoWriter(config.getCoco().isPrettyPrint()));
        writers.put(DatasetFormat.YOLO, new YoloWriter(yolo.getPrecision(), yolo.getClassesFileName()));
        writers.put(DatasetFormat.VOC, new VocWriter(config.getVoc()));
    }

    /**
     * 执行一次完整转换
     *
     * @param sourceFormat 源格式标识（coco / yolo / voc）
     * @param targetFormat 目标格式标识
     * @param sourcePath   源路径
     * @param targetPath   目标路径
     * @param options      辅助参数
     * @return 转换使用的数据集，便于调用方统计
     */
    public Dataset convert(String sourceFormat, String targetFormat, Path sourcePath, Path targetPath,
                           ConvertOptions options) throws IOException {
        DatasetFormat source = DatasetFormat.fromId(sourceFormat);
        DatasetFormat target = DatasetFormat.fromId(targetFormat);
        ConvertOptions opts = options != null ? options : new ConvertOptions();

        logger.info("Converting {} -> {}: {} -> {}", source, target, sourcePath, targetPath);

        Dataset dataset = read(source, sourcePath, opts);
        reconciler.reconcile(dataset, target);
        inferImageSizes(dataset, opts);
        write(target, dataset, targetPath, opts);

        logger.info("Conversion completed: {}", dataset);
        return dataset;
    }

    public Dataset read(String format, Path sourcePath, ConvertOptions options) throws IOException {
        return read(DatasetFormat.fromId(format), sourcePath, options != null ? options : new ConvertOptions());
    }

    public void write(String format, Dataset dataset, Path targetPath, ConvertOptions options) throws IOException {
        DatasetFormat target = DatasetFormat.fromId(format);
        ConvertOptions opts = options != null ? options : new ConvertOptions();
        reconciler.reconcile(dataset, target);
        inferImageSizes(dataset, opts);
        write(target, dataset, targetPath, opts);
    }

    private Dataset read(DatasetFormat format, Path sourcePath, ConvertOptions options) throws IOException {
        return readers.get(format).read(sourcePath, options);
    }

    private void write(DatasetFormat format, Dataset dataset, Path targetPath, ConvertOptions options) throws IOException {
        writers.get(format).write(dataset, targetPath, options);
    }

    /**
     * 对尺寸未知的图片，从图片目录中查找对应文件读取尺寸；
     * 没有图片目录或找不到文件时保持未知，由需要尺寸的 Writer 报错
     */
    void inferImageSizes(Dataset dataset, ConvertOptions options) {
        Path imagesDir = options.getImagesDir();
        if (imagesDir == null || !Files.isDirectory(imagesDir)) {
            return;
        }
        String imageExt = options.getImageExt() != null ? options.getImageExt() : config.getYolo().getImageExt();

        int inferred = 0;
        for (Image image : dataset.getImages()) {
            if (image.hasKnownSize()) {
                continue;
            }
            Path direct = imagesDir.resolve(image.getFileName());
            Path imagePath = Files.isRegularFile(direct)
                ? direct
                : imageSizeReader.locate(imagesDir, image.getBaseName(), imageExt);
            if (imagePath == null) {
                logger.warn("Image size unknown and no image file found for {}", image.getFileName());
                continue;
            }
            try {
                ImageSize size = imageSizeReader.readSize(imagePath);
                image.setSize(size.getWidth(), size.getHeight());
                inferred++;
            } catch (MissingResourceException e) {
                logger.warn("Cannot infer size of {}: {}", image.getFileName(), e.getMessage());
            }
        }
        if (inferred > 0) {
            logger.info("Inferred image size for {} images from {}", inferred, imagesDir);
        }
    }
}
