package com.edge.dataset.core.format;

import com.edge.dataset.core.model.Dataset;

import java.io.IOException;
import java.nio.file.Path;

public interface FormatReader {
    /**
     * 解析源数据为数据集
     *
     * @param source  源路径（COCO 为 JSON 文件，YOLO/VOC 为标注目录）
     * @param options 辅助输入（图片目录、类别文件等）
     * @return 新构建的数据集
     */
    Dataset read(Path source, ConvertOptions options) throws IOException;

    DatasetFormat getFormat();
}
