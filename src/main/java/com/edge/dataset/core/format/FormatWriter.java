package com.edge.dataset.core.format;

import com.edge.dataset.core.model.Dataset;

import java.io.IOException;
import java.nio.file.Path;

public interface FormatWriter {
    /**
     * 将数据集写出到目标位置，已有文件会被覆盖
     *
     * @param dataset 数据集
     * @param target  目标路径（COCO 为 JSON 文件，YOLO/VOC 为输出目录）
     * @param options 辅助输出（类别文件位置等）
     */
    void write(Dataset dataset, Path target, ConvertOptions options) throws IOException;

    DatasetFormat getFormat();
}
