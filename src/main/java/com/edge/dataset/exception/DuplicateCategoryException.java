package com.edge.dataset.exception;

public class DuplicateCategoryException extends ConverterException {
    private final int categoryId;

    public DuplicateCategoryException(int categoryId) {
        super("Duplicate category id: " + categoryId);
        this.categoryId = categoryId;
    }

    public int getCategoryId() {
        return categoryId;
    }
}
