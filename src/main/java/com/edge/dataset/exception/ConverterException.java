package com.edge.dataset.exception;

/**
 * 转换异常基类
 * <p>
 * 所有格式读写、数据模型操作中的业务错误都继承自此类，
 * 在检测到的位置立即抛出，原样传递给调用方
 */
public class ConverterException extends RuntimeException {

    public ConverterException(String message) {
        super(message);
    }

    public ConverterException(String message, Throwable cause) {
        super(message, cause);
    }
}
