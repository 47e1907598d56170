package com.edge.dataset.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库（openpnp 打包）
 * <p>
 * 加载失败不抛异常，调用方根据 {@link #loadOpenCv()} 的返回值判断是否可用
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean attempted = false;
    private static boolean openCvLoaded = false;

    /**
     * 加载 OpenCV，只尝试一次
     *
     * @return 是否加载成功
     */
    public static synchronized boolean loadOpenCv() {
        if (attempted) {
            return openCvLoaded;
        }
        attempted = true;

        try {
            // JDK 12+ 不能再修改 java.library.path，使用 loadLocally 解压到临时目录加载
            nu.pattern.OpenCV.loadLocally();
            openCvLoaded = true;
            logger.info("OpenCV loaded successfully via openpnp");
        } catch (Exception | LinkageError e) {
            logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
            openCvLoaded = false;
        }
        return openCvLoaded;
    }
}
