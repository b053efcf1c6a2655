package com.library.books.dto.request;

/**
 * Partial book payload of an update. Which of its values are applied depends on the field mask
 * sent alongside it; see {@link com.library.books.service.BookField}.
 */
public record BookPatch(
    String title,
    String author,
    String isbn,
    int publishedYear,
    String genre,
    String description
) {

    public BookPatch {
        title = nullToEmpty(title);
        author = nullToEmpty(author);
        isbn = nullToEmpty(isbn);
        genre = nullToEmpty(genre);
        description = nullToEmpty(description);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
