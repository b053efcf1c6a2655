package com.library.books.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String entityName, long id) {
        super(entityName + " with ID " + id + " not found");
    }
}
