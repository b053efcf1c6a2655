package com.library.books.mapper;

import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import com.library.books.dto.request.BookPatch;
import com.library.books.dto.request.CreateBookCommand;
import com.library.books.dto.request.ListBooksQuery;
import com.library.books.dto.request.UpdateBookCommand;
import com.library.books.dto.response.BookPage;
import com.library.books.grpc.v1.CreateBookRequest;
import com.library.books.grpc.v1.ListBooksRequest;
import com.library.books.grpc.v1.ListBooksResponse;
import com.library.books.grpc.v1.UpdateBookRequest;
import com.library.books.model.Book;

import java.time.Instant;

/**
 * Converts between the {@code books.proto} wire messages and the catalog's domain types.
 */
public final class BookMapper {

    private BookMapper() {}

    public static CreateBookCommand toCommand(CreateBookRequest request) {
        return new CreateBookCommand(
            request.getTitle(),
            request.getAuthor(),
            request.getIsbn(),
            request.getPublishedYear(),
            request.getGenre(),
            request.getDescription()
        );
    }

    public static UpdateBookCommand toCommand(UpdateBookRequest request) {
        com.library.books.grpc.v1.Book payload = request.getBook();
        BookPatch patch = new BookPatch(
            payload.getTitle(),
            payload.getAuthor(),
            payload.getIsbn(),
            payload.getPublishedYear(),
            payload.getGenre(),
            payload.getDescription()
        );
        return new UpdateBookCommand(request.getId(), patch, request.getUpdateMask().getPathsList());
    }

    public static ListBooksQuery toQuery(ListBooksRequest request) {
        return new ListBooksQuery(
            request.getGenreFilter(),
            request.getAuthorFilter(),
            request.getLimit(),
            request.getOffset()
        );
    }

    public static com.library.books.grpc.v1.Book toMessage(Book book) {
        return com.library.books.grpc.v1.Book.newBuilder()
            .setId(book.id())
            .setTitle(book.title())
            .setAuthor(book.author())
            .setIsbn(book.isbn())
            .setPublishedYear(book.publishedYear())
            .setGenre(book.genre())
            .setDescription(book.description())
            .setCreatedAt(toTimestamp(book.createdAt()))
            .setUpdatedAt(toTimestamp(book.updatedAt()))
            .build();
    }

    public static ListBooksResponse toMessage(BookPage page) {
        ListBooksResponse.Builder response = ListBooksResponse.newBuilder()
            .setTotalCount(page.totalCount());
        page.books().forEach(book -> response.addBooks(toMessage(book)));
        return response.build();
    }

    public static Book toDomain(com.library.books.grpc.v1.Book message) {
        return Book.builder()
            .id(message.getId())
            .title(message.getTitle())
            .author(message.getAuthor())
            .isbn(message.getIsbn())
            .publishedYear(message.getPublishedYear())
            .genre(message.getGenre())
            .description(message.getDescription())
            .createdAt(toInstant(message.getCreatedAt()))
            .updatedAt(toInstant(message.getUpdatedAt()))
            .build();
    }

    static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
            .setSeconds(instant.getEpochSecond())
            .setNanos(instant.getNano())
            .build();
    }

    static Instant toInstant(Timestamp timestamp) {
        Timestamps.checkValid(timestamp);
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }
}
