package com.library.books.client;

import com.library.books.model.Book;

import java.util.Optional;

/**
 * Outcome of a create, update or delete call as reported in the response payload.
 *
 * @param book the stored record; absent on failure and for deletes
 */
public record MutationResult(boolean success, String message, Optional<Book> book) {}
