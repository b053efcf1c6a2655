package com.library.books.repository;

import com.library.books.model.Book;
import com.library.books.model.NewBook;

import java.util.List;
import java.util.Optional;

/**
 * Record store for catalog books.
 *
 * <p>Identifiers come from a monotonically increasing allocator and are never reused, not even
 * after the record holding them has been removed.
 */
public interface BookRepository {

    /**
     * Allocates the next id and stores a record whose {@code createdAt} and {@code updatedAt}
     * are the same instant.
     */
    Book insert(NewBook book);

    Optional<Book> findById(long id);

    /**
     * Stores {@code book} under its existing id, keeping the record's position in
     * {@link #findAll()} order.
     *
     * @throws IllegalStateException if no live record has {@code book.id()}
     */
    Book replace(Book book);

    boolean remove(long id);

    /**
     * Snapshot of every live record in insertion order.
     */
    List<Book> findAll();

    long count();

    /**
     * Whether a live record other than {@code excludeId} already carries {@code isbn}.
     * An empty isbn never conflicts. Comparison is exact and case-sensitive.
     *
     * @param excludeId id to ignore, or {@code null} to check every record
     */
    boolean isbnConflict(String isbn, Long excludeId);
}
