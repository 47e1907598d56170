package com.edge.dataset.exception;

/**
 * 不支持的格式标识
 */
public class UnsupportedFormatException extends ConverterException {
    private final String format;

    public UnsupportedFormatException(String format, String supported) {
        super("Unsupported format: " + format + ". Supported formats: " + supported);
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
