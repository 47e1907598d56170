package com.edge.dataset.core.format;

import lombok.Data;

import java.nio.file.Path;

/**
 * 转换的辅助输入/输出参数
 */
@Data
public class ConvertOptions {
    /** 图片目录：YOLO 作为源时必需，也用于推断未知的图片尺寸 */
    private Path imagesDir;

    /** 类别文件：YOLO 作为源时读取；作为目标且未指定 outputClassesFile 时写入 */
    private Path classesFile;

    /** YOLO 输出的类别文件，为空时退回 classesFile，再退回 <输出目录父目录>/classes.txt */
    private Path outputClassesFile;

    /** 图片扩展名，为空时使用配置中的默认值 */
    private String imageExt;
}
