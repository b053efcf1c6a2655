package com.library.books.dto.request;

import com.library.books.model.NewBook;
import jakarta.validation.constraints.NotEmpty;

public record CreateBookCommand(

    @NotEmpty(message = "Title and author are required")
    String title,

    @NotEmpty(message = "Title and author are required")
    String author,

    String isbn,

    int publishedYear,

    String genre,

    String description
) {

    public NewBook toNewBook() {
        return new NewBook(title, author, isbn, publishedYear, genre, description);
    }
}
