package com.library.books.dto.request;

import java.util.List;

/**
 * @param paths field-mask paths; an empty list selects the legacy "apply non-empty values" mode
 */
public record UpdateBookCommand(
    long id,
    BookPatch book,
    List<String> paths
) {

    public UpdateBookCommand {
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public boolean hasFieldMask() {
        return !paths.isEmpty();
    }
}
