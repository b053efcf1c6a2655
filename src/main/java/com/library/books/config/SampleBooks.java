package com.library.books.config;

import com.library.books.model.NewBook;
import com.library.books.repository.BookRepository;

import java.util.List;

/**
 * Fixed records loaded into an empty catalog at startup. They bypass create-time validation.
 */
public final class SampleBooks {

    public static final List<NewBook> BOOKS = List.of(
        new NewBook("The Python Handbook", "Jane Doe", "978-1234567890", 2023,
            "Technology", "A comprehensive guide to Python programming"),
        new NewBook("Microservices Architecture", "John Smith", "978-0987654321", 2022,
            "Technology", "Building scalable distributed systems"),
        new NewBook("The Great Adventure", "Alice Johnson", "978-1122334455", 2021,
            "Fiction", "An epic tale of discovery")
    );

    private SampleBooks() {}

    public static void seed(BookRepository repository) {
        BOOKS.forEach(repository::insert);
    }
}
