package com.library.books.service;

import com.library.books.dto.request.BookPatch;
import com.library.books.model.Book;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * The updatable fields of a {@link Book}, keyed by their field-mask path.
 *
 * <p>Each constant knows how to copy its value from a {@link BookPatch} onto a builder and whether
 * the patch carries a non-empty value for it. The latter drives legacy updates that arrive
 * without a field mask.
 */
public enum BookField {

    TITLE("title",
        (builder, patch) -> builder.title(patch.title()),
        patch -> !patch.title().isEmpty()),
    AUTHOR("author",
        (builder, patch) -> builder.author(patch.author()),
        patch -> !patch.author().isEmpty()),
    ISBN("isbn",
        (builder, patch) -> builder.isbn(patch.isbn()),
        patch -> !patch.isbn().isEmpty()),
    PUBLISHED_YEAR("published_year",
        (builder, patch) -> builder.publishedYear(patch.publishedYear()),
        patch -> patch.publishedYear() != 0),
    GENRE("genre",
        (builder, patch) -> builder.genre(patch.genre()),
        patch -> !patch.genre().isEmpty()),
    DESCRIPTION("description",
        (builder, patch) -> builder.description(patch.description()),
        patch -> !patch.description().isEmpty());

    private static final Map<String, BookField> BY_PATH = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BookField::path, Function.identity()));

    private final String path;
    private final BiConsumer<Book.BookBuilder, BookPatch> copier;
    private final Predicate<BookPatch> presentIn;

    BookField(String path, BiConsumer<Book.BookBuilder, BookPatch> copier, Predicate<BookPatch> presentIn) {
        this.path = path;
        this.copier = copier;
        this.presentIn = presentIn;
    }

    public String path() {
        return path;
    }

    public void copy(BookPatch source, Book.BookBuilder target) {
        copier.accept(target, source);
    }

    public boolean isPresentIn(BookPatch patch) {
        return presentIn.test(patch);
    }

    /**
     * Exact, case-sensitive lookup of a field-mask path.
     */
    public static Optional<BookField> fromPath(String path) {
        return path == null ? Optional.empty() : Optional.ofNullable(BY_PATH.get(path));
    }
}
