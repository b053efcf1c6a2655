package com.library.books.grpc;

import com.google.protobuf.Empty;
import com.library.books.grpc.handler.GrpcExceptionHandler;
import com.library.books.grpc.v1.BookId;
import com.library.books.grpc.v1.BooksServiceGrpc;
import com.library.books.grpc.v1.CreateBookRequest;
import com.library.books.grpc.v1.CreateBookResponse;
import com.library.books.grpc.v1.DeleteBookResponse;
import com.library.books.grpc.v1.GetBookResponse;
import com.library.books.grpc.v1.ListBooksRequest;
import com.library.books.grpc.v1.ListBooksResponse;
import com.library.books.grpc.v1.UpdateBookRequest;
import com.library.books.grpc.v1.UpdateBookResponse;
import com.library.books.mapper.BookMapper;
import com.library.books.model.Book;
import com.library.books.service.BookService;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * {@code books.BooksService} endpoint. Translates wire messages to service calls and back; every
 * catalog rule lives in {@link BookService}.
 */
@Component
@RequiredArgsConstructor
public class BookGrpcService extends BooksServiceGrpc.BooksServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(BookGrpcService.class);

    private final BookService bookService;
    private final GrpcExceptionHandler exceptionHandler;

    @Override
    public void createBook(CreateBookRequest request, StreamObserver<CreateBookResponse> responseObserver) {
        log.info("Creating book: {} by {}", request.getTitle(), request.getAuthor());
        CreateBookResponse response;
        try {
            Book book = bookService.create(BookMapper.toCommand(request));
            response = CreateBookResponse.newBuilder()
                .setBook(BookMapper.toMessage(book))
                .setSuccess(true)
                .setMessage("Book created successfully")
                .build();
        } catch (RuntimeException e) {
            response = CreateBookResponse.newBuilder()
                .setSuccess(false)
                .setMessage(exceptionHandler.toFailureMessage(e, "creating book"))
                .build();
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    @Override
    public void getBook(BookId request, StreamObserver<GetBookResponse> responseObserver) {
        log.info("Getting book with ID: {}", request.getId());
        GetBookResponse response;
        try {
            Optional<Book> book = bookService.findById(request.getId());
            response = book
                .map(found -> GetBookResponse.newBuilder().setBook(BookMapper.toMessage(found)).setFound(true).build())
                .orElseGet(() -> GetBookResponse.newBuilder().setFound(false).build());
        } catch (RuntimeException e) {
            responseObserver.onError(exceptionHandler.toStatus(e, "getting book"));
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    @Override
    public void updateBook(UpdateBookRequest request, StreamObserver<UpdateBookResponse> responseObserver) {
        log.info("Updating book with ID: {}", request.getId());
        UpdateBookResponse response;
        try {
            Book book = bookService.update(BookMapper.toCommand(request));
            response = UpdateBookResponse.newBuilder()
                .setBook(BookMapper.toMessage(book))
                .setSuccess(true)
                .setMessage("Book updated successfully")
                .build();
        } catch (RuntimeException e) {
            response = UpdateBookResponse.newBuilder()
                .setSuccess(false)
                .setMessage(exceptionHandler.toFailureMessage(e, "updating book"))
                .build();
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    @Override
    public void deleteBook(BookId request, StreamObserver<DeleteBookResponse> responseObserver) {
        log.info("Deleting book with ID: {}", request.getId());
        DeleteBookResponse response;
        try {
            bookService.delete(request.getId());
            response = DeleteBookResponse.newBuilder()
                .setSuccess(true)
                .setMessage("Book deleted successfully")
                .build();
        } catch (RuntimeException e) {
            response = DeleteBookResponse.newBuilder()
                .setSuccess(false)
                .setMessage(exceptionHandler.toFailureMessage(e, "deleting book"))
                .build();
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    @Override
    public void listBooks(ListBooksRequest request, StreamObserver<ListBooksResponse> responseObserver) {
        log.info("Listing books - limit: {}, offset: {}", request.getLimit(), request.getOffset());
        ListBooksResponse response;
        try {
            response = BookMapper.toMessage(bookService.list(BookMapper.toQuery(request)));
        } catch (RuntimeException e) {
            responseObserver.onError(exceptionHandler.toStatus(e, "listing books"));
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    @Override
    public void getAllBooks(Empty request, StreamObserver<ListBooksResponse> responseObserver) {
        log.info("Getting all books");
        ListBooksResponse response;
        try {
            response = BookMapper.toMessage(bookService.findAll());
        } catch (RuntimeException e) {
            responseObserver.onError(exceptionHandler.toStatus(e, "getting all books"));
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
