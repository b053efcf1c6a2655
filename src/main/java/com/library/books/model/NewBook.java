package com.library.books.model;

/**
 * Field values for a record that has not been assigned an id or timestamps yet.
 */
public record NewBook(
    String title,
    String author,
    String isbn,
    int publishedYear,
    String genre,
    String description
) {}
