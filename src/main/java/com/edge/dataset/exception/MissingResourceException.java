package com.edge.dataset.exception;

import java.nio.file.Path;

/**
 * 必需的输入资源缺失（类别文件、图片目录、对应图片等）
 */
public class MissingResourceException extends ConverterException {
    private final Path path;

    public MissingResourceException(String message, Path path) {
        super(path != null ? message + ": " + path : message);
        this.path = path;
    }

    public MissingResourceException(String message) {
        this(message, null);
    }

    public Path getPath() {
        return path;
    }
}
