package com.edge.dataset.exception;

/**
 * 标注引用了不存在的图片或类别 ID
 */
public class ReferenceException extends ConverterException {

    public ReferenceException(String message) {
        super(message);
    }
}
