package com.library.books.dto.request;

/**
 * Filters and page window for a catalog listing.
 *
 * @param genreFilter  case-insensitive substring of the genre; empty or {@code null} matches all
 * @param authorFilter case-insensitive substring of the author; empty or {@code null} matches all
 * @param limit        page size; zero or negative means unbounded
 * @param offset       records to skip; zero or negative means start at the first
 */
public record ListBooksQuery(
    String genreFilter,
    String authorFilter,
    int limit,
    int offset
) {}
