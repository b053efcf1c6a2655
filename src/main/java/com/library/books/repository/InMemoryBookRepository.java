package com.library.books.repository;

import com.library.books.model.Book;
import com.library.books.model.NewBook;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link BookRepository} held entirely in process memory. Its contents live exactly as long as
 * the instance.
 *
 * <p>The map and the id allocator are guarded by one read/write lock. Each method is atomic on
 * its own; callers that need a check followed by a write (an isbn check before an insert, say)
 * must serialise those sequences themselves.
 */
public class InMemoryBookRepository implements BookRepository {

    private final Map<Long, Book> books = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private long nextId = 1;

    public InMemoryBookRepository(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Book insert(NewBook book) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Book stored = Book.builder()
                .id(nextId++)
                .title(book.title())
                .author(book.author())
                .isbn(book.isbn())
                .publishedYear(book.publishedYear())
                .genre(book.genre())
                .description(book.description())
                .createdAt(now)
                .updatedAt(now)
                .build();
            books.put(stored.id(), stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Book> findById(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(books.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Book replace(Book book) {
        lock.writeLock().lock();
        try {
            // LinkedHashMap keeps the original insertion slot when an existing key is re-put.
            if (!books.containsKey(book.id())) {
                throw new IllegalStateException("No live book with id " + book.id());
            }
            books.put(book.id(), book);
            return book;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(long id) {
        lock.writeLock().lock();
        try {
            return books.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Book> findAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(books.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return books.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isbnConflict(String isbn, Long excludeId) {
        if (isbn == null || isbn.isEmpty()) {
            return false;
        }
        lock.readLock().lock();
        try {
            return books.values().stream()
                .filter(book -> excludeId == null || book.id() != excludeId)
                .anyMatch(book -> book.isbn().equals(isbn));
        } finally {
            lock.readLock().unlock();
        }
    }
}
