package com.edge.dataset.exception;

public class CategoryNotFoundException extends ConverterException {

    public CategoryNotFoundException(String message) {
        super(message);
    }

    public static CategoryNotFoundException forId(int id) {
        return new CategoryNotFoundException("Category not found: id=" + id);
    }

    public static CategoryNotFoundException forName(String name) {
        return new CategoryNotFoundException("Category not found: name=" + name);
    }
}
