package com.library.books.unit.service;

import com.library.books.dto.request.BookPatch;
import com.library.books.dto.request.CreateBookCommand;
import com.library.books.dto.request.UpdateBookCommand;
import com.library.books.exception.DuplicateIsbnException;
import com.library.books.exception.InvalidBookException;
import com.library.books.exception.ResourceNotFoundException;
import com.library.books.model.Book;
import com.library.books.model.NewBook;
import com.library.books.repository.BookRepository;
import com.library.books.service.BookService;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookServiceTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static ValidatorFactory validatorFactory;

    @Mock
    private BookRepository bookRepository;

    private BookService bookService;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        Validator validator = validatorFactory.getValidator();
        bookService = new BookService(bookRepository, validator, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createBook_withValidCommand_insertsAndReturnsStoredBook() {
        when(bookRepository.isbnConflict("978-1111111111", null)).thenReturn(false);
        when(bookRepository.insert(any(NewBook.class))).thenAnswer(invocation -> {
            NewBook book = invocation.getArgument(0);
            return createTestBook(4L, book.title(), book.isbn());
        });

        Book created = bookService.create(new CreateBookCommand("gRPC in Action", "Tech Writer",
            "978-1111111111", 2024, "Technology", "Learn gRPC with practical examples"));

        assertThat(created.id()).isEqualTo(4L);
        assertThat(created.title()).isEqualTo("gRPC in Action");
        verify(bookRepository).insert(new NewBook("gRPC in Action", "Tech Writer",
            "978-1111111111", 2024, "Technology", "Learn gRPC with practical examples"));
    }

    @Test
    void createBook_withEmptyTitle_throwsInvalidBookException() {
        var command = new CreateBookCommand("", "Tech Writer", "", 0, "", "");

        assertThatThrownBy(() -> bookService.create(command))
            .isInstanceOf(InvalidBookException.class)
            .hasMessage("Title and author are required");

        verify(bookRepository, never()).insert(any());
    }

    @Test
    void createBook_withEmptyTitleAndAuthor_reportsMessageOnce() {
        var command = new CreateBookCommand("", "", "", 0, "", "");

        assertThatThrownBy(() -> bookService.create(command))
            .isInstanceOf(InvalidBookException.class)
            .satisfies(ex -> assertThat(((InvalidBookException) ex).getViolations())
                .containsExactly("Title and author are required"));
    }

    @Test
    void createBook_withDuplicateIsbn_throwsDuplicateIsbnException() {
        when(bookRepository.isbnConflict(eq("978-1234567890"), isNull())).thenReturn(true);

        var command = new CreateBookCommand("Copycat", "Someone", "978-1234567890", 0, "", "");

        assertThatThrownBy(() -> bookService.create(command))
            .isInstanceOf(DuplicateIsbnException.class)
            .hasMessage("Book with ISBN 978-1234567890 already exists");

        verify(bookRepository, never()).insert(any());
    }

    @Test
    void findById_whenNotFound_returnsEmpty() {
        when(bookRepository.findById(999L)).thenReturn(Optional.empty());

        assertThat(bookService.findById(999L)).isEmpty();
    }

    @Test
    void findAll_reportsEveryRecordAndCount() {
        when(bookRepository.findAll()).thenReturn(List.of(
            createTestBook(1L, "A", ""), createTestBook(2L, "B", "")));

        var page = bookService.findAll();

        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.books()).extracting(Book::id).containsExactly(1L, 2L);
    }

    @Test
    void updateBook_whenNotFound_throwsResourceNotFoundException() {
        when(bookRepository.findById(99L)).thenReturn(Optional.empty());

        var command = new UpdateBookCommand(99L, new BookPatch("T", "", "", 0, "", ""), List.of());

        assertThatThrownBy(() -> bookService.update(command))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Book with ID 99 not found");

        verify(bookRepository, never()).replace(any());
    }

    @Test
    void updateBook_withConflictingIsbn_neverReplaces() {
        when(bookRepository.findById(1L)).thenReturn(Optional.of(createTestBook(1L, "Mine", "111")));
        when(bookRepository.isbnConflict("222", 1L)).thenReturn(true);

        var command = new UpdateBookCommand(1L, new BookPatch("Renamed", "", "222", 0, "", ""),
            List.of("title", "isbn"));

        assertThatThrownBy(() -> bookService.update(command))
            .isInstanceOf(DuplicateIsbnException.class)
            .hasMessageContaining("222");

        verify(bookRepository, never()).replace(any());
    }

    @Test
    void updateBook_withoutIsbnInMask_skipsConflictCheck() {
        when(bookRepository.findById(1L)).thenReturn(Optional.of(createTestBook(1L, "Mine", "111")));
        when(bookRepository.replace(any(Book.class))).thenAnswer(invocation -> invocation.getArgument(0));

        var command = new UpdateBookCommand(1L, new BookPatch("", "", "222", 0, "Poetry", ""),
            List.of("genre"));
        Book updated = bookService.update(command);

        assertThat(updated.isbn()).isEqualTo("111");
        assertThat(updated.genre()).isEqualTo("Poetry");
        assertThat(updated.updatedAt()).isEqualTo(NOW);
        verify(bookRepository, never()).isbnConflict(any(), any());
    }

    @Test
    void deleteBook_whenPresent_removes() {
        when(bookRepository.remove(2L)).thenReturn(true);

        bookService.delete(2L);

        verify(bookRepository).remove(2L);
    }

    @Test
    void deleteBook_whenNotFound_throwsResourceNotFoundException() {
        when(bookRepository.remove(2L)).thenReturn(false);

        assertThatThrownBy(() -> bookService.delete(2L))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Book with ID 2 not found");
    }

    private Book createTestBook(long id, String title, String isbn) {
        return Book.builder()
            .id(id)
            .title(title)
            .author("Tech Writer")
            .isbn(isbn)
            .createdAt(CREATED)
            .updatedAt(CREATED)
            .build();
    }
}
