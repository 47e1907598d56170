package com.edge.dataset.core.format;

import com.edge.dataset.exception.UnsupportedFormatException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 支持的标注格式（固定集合）
 */
public enum DatasetFormat {
    COCO("coco"),
    YOLO("yolo"),
    VOC("voc", "pascal_voc");

    private final String id;
    private final String[] aliases;

    DatasetFormat(String id, String... aliases) {
        this.id = id;
        this.aliases = aliases;
    }

    public String getId() {
        return id;
    }

    /**
     * 按格式标识解析，忽略大小写
     *
     * @throws UnsupportedFormatException 非 coco / yolo / voc
     */
    public static DatasetFormat fromId(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DatasetFormat format : values()) {
                if (format.id.equals(normalized) || Arrays.asList(format.aliases).contains(normalized)) {
                    return format;
                }
            }
        }
        throw new UnsupportedFormatException(value, supportedIds());
    }

    public static String supportedIds() {
        return Arrays.stream(values()).map(DatasetFormat::getId).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return id;
    }
}
