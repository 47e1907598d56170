package com.edge.dataset.exception;

/**
 * 操作所需的数据尚不可用（例如写 YOLO 时图片尺寸未知）
 */
public class InvalidStateException extends ConverterException {

    public InvalidStateException(String message) {
        super(message);
    }
}
