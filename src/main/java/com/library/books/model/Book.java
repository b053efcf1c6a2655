package com.library.books.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Immutable catalog record.
 *
 * <p>Optional text fields are never {@code null}: an absent isbn, genre or description is the
 * empty string, and an unknown {@code publishedYear} is {@code 0}. Updates build a new value via
 * {@link #toBuilder()} and replace the stored one wholesale, so a reader never sees a
 * half-applied change.
 */
@Builder(toBuilder = true)
public record Book(
    long id,
    String title,
    String author,
    String isbn,
    int publishedYear,
    String genre,
    String description,
    Instant createdAt,
    Instant updatedAt
) {

    public Book {
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
