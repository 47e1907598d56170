package com.edge.dataset.exception;

/**
 * 输入格式错误（JSON/XML 损坏、缺少必需字段、标注行格式非法等）
 */
public class FormatException extends ConverterException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
