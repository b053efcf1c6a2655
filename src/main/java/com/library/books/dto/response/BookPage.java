package com.library.books.dto.response;

import com.library.books.model.Book;

import java.util.List;

/**
 * One page of a listing.
 *
 * @param totalCount number of records matching the filters, before the page window is applied
 */
public record BookPage(
    List<Book> books,
    int totalCount
) {

    public BookPage {
        books = List.copyOf(books);
    }
}
