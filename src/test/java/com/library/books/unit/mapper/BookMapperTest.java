package com.library.books.unit.mapper;

import com.google.protobuf.FieldMask;
import com.google.protobuf.Timestamp;
import com.library.books.dto.request.UpdateBookCommand;
import com.library.books.grpc.v1.UpdateBookRequest;
import com.library.books.mapper.BookMapper;
import com.library.books.model.Book;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookMapperTest {

    @Test
    void toMessage_carriesEveryFieldAndNanosecondTimestamps() {
        Instant created = Instant.parse("2023-07-14T09:30:00.000000123Z");
        Instant updated = Instant.parse("2023-07-15T09:30:00Z");
        Book book = Book.builder()
            .id(3L)
            .title("The Great Adventure")
            .author("Alice Johnson")
            .isbn("978-1122334455")
            .publishedYear(2021)
            .genre("Fiction")
            .description("An epic tale of discovery")
            .createdAt(created)
            .updatedAt(updated)
            .build();

        var message = BookMapper.toMessage(book);

        assertThat(message.getId()).isEqualTo(3L);
        assertThat(message.getPublishedYear()).isEqualTo(2021);
        assertThat(message.getCreatedAt().getSeconds()).isEqualTo(created.getEpochSecond());
        assertThat(message.getCreatedAt().getNanos()).isEqualTo(123);
        assertThat(BookMapper.toDomain(message)).isEqualTo(book);
    }

    @Test
    void toCommand_withoutMask_selectsLegacyMode() {
        UpdateBookCommand command = BookMapper.toCommand(UpdateBookRequest.newBuilder().setId(5L).build());

        assertThat(command.id()).isEqualTo(5L);
        assertThat(command.hasFieldMask()).isFalse();
        assertThat(command.book().title()).isEmpty();
    }

    @Test
    void toCommand_keepsMaskPathsInOrder() {
        UpdateBookCommand command = BookMapper.toCommand(UpdateBookRequest.newBuilder()
            .setId(5L)
            .setUpdateMask(FieldMask.newBuilder().addPaths("isbn").addPaths("title"))
            .build());

        assertThat(command.paths()).containsExactly("isbn", "title");
    }

    @Test
    void toDomain_rejectsInvalidTimestamp() {
        var message = com.library.books.grpc.v1.Book.newBuilder()
            .setId(1L)
            .setCreatedAt(Timestamp.newBuilder().setSeconds(0).setNanos(-1))
            .build();

        assertThatThrownBy(() -> BookMapper.toDomain(message))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
