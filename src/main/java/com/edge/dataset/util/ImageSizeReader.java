package com.edge.dataset.util;

import com.edge.dataset.config.NativeLibraryLoader;
import com.edge.dataset.exception.MissingResourceException;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 图片定位与尺寸读取
 * <p>
 * 尺寸优先通过 ImageIO 只读取文件头获得；ImageIO 不支持的格式（webp 等）
 * 再交给 OpenCV 完整解码
 */
public class ImageSizeReader {
    private static final Logger logger = LoggerFactory.getLogger(ImageSizeReader.class);

    private final List<String> fallbackExts;

    public ImageSizeReader(List<String> fallbackExts) {
        this.fallbackExts = fallbackExts != null ? new ArrayList<>(fallbackExts) : new ArrayList<>();
    }

    /**
     * 在图片目录中按文件名（不含扩展名）查找图片
     * 先试指定扩展名，再依次尝试备用扩展名
     *
     * @return 图片路径，找不到返回 null
     */
    public Path locate(Path imagesDir, String baseName, String preferredExt) {
        Set<String> candidates = new LinkedHashSet<>();
        if (preferredExt != null && !preferredExt.isEmpty()) {
            candidates.add(normalizeExt(preferredExt));
        }
        candidates.addAll(fallbackExts);

        for (String ext : candidates) {
            Path candidate = imagesDir.resolve(baseName + ext);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * 读取图片尺寸
     *
     * @throws MissingResourceException 文件不存在或无法解析尺寸
     */
    public ImageSize readSize(Path imagePath) {
        if (!Files.isRegularFile(imagePath)) {
            throw new MissingResourceException("Image file not found", imagePath);
        }

        ImageSize size = readHeader(imagePath);
        if (size == null) {
            size = readWithOpenCv(imagePath);
        }
        if (size == null) {
            throw new MissingResourceException("Cannot determine image dimensions", imagePath);
        }
        logger.debug("Image size {} for {}", size, imagePath);
        return size;
    }

    private ImageSize readHeader(Path imagePath) {
        try (ImageInputStream in = ImageIO.createImageInputStream(imagePath.toFile())) {
            if (in == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return new ImageSize(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            logger.debug("ImageIO could not read header of {}: {}", imagePath, e.getMessage());
            return null;
        }
    }

    private ImageSize readWithOpenCv(Path imagePath) {
        if (!NativeLibraryLoader.loadOpenCv()) {
            return null;
        }
        Mat mat = Imgcodecs.imread(imagePath.toString());
        try {
            if (mat.empty()) {
                logger.warn("OpenCV failed to decode image: {}", imagePath);
                return null;
            }
            return new ImageSize(mat.cols(), mat.rows());
        } finally {
            mat.release();
        }
    }

    private static String normalizeExt(String ext) {
        return ext.startsWith(".") ? ext : "." + ext;
    }
}
