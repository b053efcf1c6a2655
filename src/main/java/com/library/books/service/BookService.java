package com.library.books.service;

import com.library.books.dto.request.BookPatch;
import com.library.books.dto.request.CreateBookCommand;
import com.library.books.dto.request.ListBooksQuery;
import com.library.books.dto.request.UpdateBookCommand;
import com.library.books.dto.response.BookPage;
import com.library.books.exception.DuplicateIsbnException;
import com.library.books.exception.InvalidBookException;
import com.library.books.exception.ResourceNotFoundException;
import com.library.books.model.Book;
import com.library.books.repository.BookRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    private final BookRepository bookRepository;
    private final Validator validator;
    private final Clock clock;

    // Serialises check-then-write sequences; the repository only makes single calls atomic.
    private final Lock mutationLock = new ReentrantLock();

    public Book create(CreateBookCommand command) {
        List<String> violations = validator.validate(command).stream()
            .map(ConstraintViolation::getMessage)
            .distinct()
            .toList();
        if (!violations.isEmpty()) {
            throw new InvalidBookException(violations);
        }

        mutationLock.lock();
        try {
            if (bookRepository.isbnConflict(command.isbn(), null)) {
                throw new DuplicateIsbnException(command.isbn());
            }
            Book saved = bookRepository.insert(command.toNewBook());
            log.info("Book created with ID: {}", saved.id());
            return saved;
        } finally {
            mutationLock.unlock();
        }
    }

    public Optional<Book> findById(long id) {
        return bookRepository.findById(id);
    }

    public BookPage findAll() {
        List<Book> books = bookRepository.findAll();
        return new BookPage(books, books.size());
    }

    public BookPage list(ListBooksQuery query) {
        List<Book> filtered = bookRepository.findAll().stream()
            .filter(book -> containsIgnoreCase(book, Book::genre, query.genreFilter()))
            .filter(book -> containsIgnoreCase(book, Book::author, query.authorFilter()))
            .toList();

        int size = filtered.size();
        long start = Math.max(query.offset(), 0);
        long end = query.limit() > 0 ? start + query.limit() : size;
        int from = (int) Math.min(start, size);
        int to = (int) Math.min(Math.max(end, from), size);

        return new BookPage(filtered.subList(from, to), size);
    }

    public Book update(UpdateBookCommand command) {
        mutationLock.lock();
        try {
            Book current = bookRepository.findById(command.id())
                .orElseThrow(() -> new ResourceNotFoundException("Book", command.id()));

            BookPatch patch = command.book();
            Set<BookField> fields = command.hasFieldMask()
                ? resolveFieldMask(command.paths())
                : presentFields(patch);

            if (fields.contains(BookField.ISBN)
                    && bookRepository.isbnConflict(patch.isbn(), command.id())) {
                throw new DuplicateIsbnException(patch.isbn());
            }

            Book.BookBuilder builder = current.toBuilder();
            fields.forEach(field -> field.copy(patch, builder));
            builder.updatedAt(latest(current.createdAt(), clock.instant()));

            Book saved = bookRepository.replace(builder.build());
            log.info("Book {} updated successfully", saved.id());
            return saved;
        } finally {
            mutationLock.unlock();
        }
    }

    public void delete(long id) {
        mutationLock.lock();
        try {
            if (!bookRepository.remove(id)) {
                throw new ResourceNotFoundException("Book", id);
            }
        } finally {
            mutationLock.unlock();
        }
    }

    private Set<BookField> resolveFieldMask(List<String> paths) {
        Set<BookField> fields = EnumSet.noneOf(BookField.class);
        for (String path : paths) {
            BookField.fromPath(path).ifPresentOrElse(
                fields::add,
                () -> log.warn("Ignoring unknown field path: {}", path));
        }
        return fields;
    }

    private Set<BookField> presentFields(BookPatch patch) {
        log.warn("No field mask provided, falling back to non-empty field updates");
        Set<BookField> fields = EnumSet.noneOf(BookField.class);
        for (BookField field : BookField.values()) {
            if (field.isPresentIn(patch)) {
                fields.add(field);
            }
        }
        return fields;
    }

    // Substring match, unlike the exact isbn comparison used for uniqueness.
    private static boolean containsIgnoreCase(Book book, Function<Book, String> attribute, String filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        return attribute.apply(book).toLowerCase(Locale.ROOT).contains(filter.toLowerCase(Locale.ROOT));
    }

    private static Instant latest(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
