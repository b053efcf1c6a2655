package com.library.books.client;

import com.google.protobuf.Empty;
import com.google.protobuf.FieldMask;
import com.library.books.dto.request.BookPatch;
import com.library.books.dto.request.CreateBookCommand;
import com.library.books.dto.request.ListBooksQuery;
import com.library.books.dto.response.BookPage;
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
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.Closeable;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Blocking client for {@code books.BooksService}.
 *
 * <p>Running {@link #main(String[])} performs a smoke test against a live server: it lists the
 * catalog, fetches, creates and updates a book, lists by genre, and checks a missing id.
 */
@SuppressWarnings("PMD.SystemPrintln")
public class BookCatalogClient implements Closeable {

    private static final String DEFAULT_HOST = "localhost";
    private static final int DEFAULT_PORT = 50052;

    private final ManagedChannel channel;
    private final BooksServiceGrpc.BooksServiceBlockingStub stub;

    public BookCatalogClient(ManagedChannel channel) {
        this.channel = channel;
        this.stub = BooksServiceGrpc.newBlockingStub(channel);
    }

    public static BookCatalogClient connect(String host, int port) {
        return new BookCatalogClient(ManagedChannelBuilder.forAddress(host, port).usePlaintext().build());
    }

    public BookPage getAllBooks() {
        return toPage(stub.getAllBooks(Empty.getDefaultInstance()));
    }

    public Optional<Book> getBook(long id) {
        GetBookResponse response = stub.getBook(BookId.newBuilder().setId(id).build());
        return response.getFound() ? Optional.of(BookMapper.toDomain(response.getBook())) : Optional.empty();
    }

    public MutationResult createBook(CreateBookCommand command) {
        CreateBookRequest request = CreateBookRequest.newBuilder()
            .setTitle(nullToEmpty(command.title()))
            .setAuthor(nullToEmpty(command.author()))
            .setIsbn(nullToEmpty(command.isbn()))
            .setPublishedYear(command.publishedYear())
            .setGenre(nullToEmpty(command.genre()))
            .setDescription(nullToEmpty(command.description()))
            .build();
        CreateBookResponse response = stub.createBook(request);
        return new MutationResult(response.getSuccess(), response.getMessage(),
            response.hasBook() ? Optional.of(BookMapper.toDomain(response.getBook())) : Optional.empty());
    }

    /**
     * Updates book {@code id}. With no {@code paths} the server applies only the non-empty values
     * of {@code patch}; otherwise exactly the named fields are written, empty values included.
     */
    public MutationResult updateBook(long id, BookPatch patch, String... paths) {
        com.library.books.grpc.v1.Book payload = com.library.books.grpc.v1.Book.newBuilder()
            .setTitle(patch.title())
            .setAuthor(patch.author())
            .setIsbn(patch.isbn())
            .setPublishedYear(patch.publishedYear())
            .setGenre(patch.genre())
            .setDescription(patch.description())
            .build();
        UpdateBookRequest request = UpdateBookRequest.newBuilder()
            .setId(id)
            .setBook(payload)
            .setUpdateMask(FieldMask.newBuilder().addAllPaths(List.of(paths)))
            .build();
        UpdateBookResponse response = stub.updateBook(request);
        return new MutationResult(response.getSuccess(), response.getMessage(),
            response.hasBook() ? Optional.of(BookMapper.toDomain(response.getBook())) : Optional.empty());
    }

    public MutationResult deleteBook(long id) {
        DeleteBookResponse response = stub.deleteBook(BookId.newBuilder().setId(id).build());
        return new MutationResult(response.getSuccess(), response.getMessage(), Optional.empty());
    }

    public BookPage listBooks(ListBooksQuery query) {
        ListBooksRequest request = ListBooksRequest.newBuilder()
            .setGenreFilter(nullToEmpty(query.genreFilter()))
            .setAuthorFilter(nullToEmpty(query.authorFilter()))
            .setLimit(query.limit())
            .setOffset(query.offset())
            .build();
        return toPage(stub.listBooks(request));
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs the smoke-test sequence and prints what the server returned.
     */
    public void runSmokeTest(PrintStream out) {
        out.println("=== Testing Books gRPC Service ===");
        out.println();

        out.println("1. Getting all books:");
        getAllBooks().books().forEach(book ->
            out.printf("   ID: %d, Title: %s, Author: %s%n", book.id(), book.title(), book.author()));
        out.println();

        out.println("2. Getting book with ID 1:");
        getBook(1).ifPresentOrElse(
            book -> out.printf("   Found: %s by %s (%s)%n", book.title(), book.author(), book.genre()),
            () -> out.println("   Book not found"));
        out.println();

        out.println("3. Creating a new book:");
        MutationResult created = createBook(new CreateBookCommand("gRPC in Action", "Tech Writer",
            "978-1111111111", 2024, "Technology", "Learn gRPC with practical examples"));
        if (created.success()) {
            Book book = created.book().orElseThrow();
            out.printf("   Created: %s with ID %d%n", book.title(), book.id());
        } else {
            out.printf("   Failed: %s%n", created.message());
        }
        out.println();

        out.println("4. Updating the new book with field mask:");
        if (created.success()) {
            long bookId = created.book().orElseThrow().id();
            BookPatch patch = new BookPatch(null, null, null, 0, "Programming",
                "Updated: Learn gRPC with hands-on examples and best practices");
            MutationResult updated = updateBook(bookId, patch, "description", "genre");
            if (updated.success()) {
                Book book = updated.book().orElseThrow();
                out.printf("   Updated book %d:%n", bookId);
                out.printf("   - Description: %s%n", book.description());
                out.printf("   - Genre: %s%n", book.genre());
                out.printf("   - Title unchanged: %s%n", book.title());
            } else {
                out.printf("   Update failed: %s%n", updated.message());
            }
        }
        out.println();

        out.println("5. Listing Technology books:");
        BookPage technology = listBooks(new ListBooksQuery("Technology", null, 10, 0));
        out.printf("   Found %d technology books:%n", technology.totalCount());
        technology.books().forEach(book -> out.printf("   - %s by %s%n", book.title(), book.author()));
        out.println();

        out.println("6. Testing error case - get book ID 999:");
        getBook(999).ifPresentOrElse(
            book -> out.printf("   Unexpected: Found book %s%n", book.title()),
            () -> out.println("   Correctly returned 'not found'"));
        out.println();

        out.println("=== All tests completed ===");
    }

    public static void main(String[] args) {
        Options options = new Options();
        Option help = new Option("h", "help", false, "Output this help message.");
        options.addOption(help);
        Option hostOption = Option.builder().option("s").longOpt("host").hasArg(true)
            .desc("Server host; default=" + DEFAULT_HOST + ".").build();
        options.addOption(hostOption);
        Option portOption = Option.builder().option("p").longOpt("port").hasArg(true).type(Number.class)
            .desc("Server port; default=" + DEFAULT_PORT + ".").build();
        options.addOption(portOption);

        CommandLineParser parser = new DefaultParser();
        CommandLine cli;
        int port;
        try {
            cli = parser.parse(options, args);
            port = cli.hasOption(portOption.getOpt())
                ? ((Number) cli.getParsedOptionValue(portOption.getOpt())).intValue()
                : DEFAULT_PORT;
        } catch (ParseException pe) {
            System.err.println("Parse of command-line failed: " + pe.getMessage());
            System.exit(1);
            return;
        }
        if (cli.hasOption(help.getOpt())) {
            new HelpFormatter().printHelp("book-catalog-client", options, true);
            return;
        }
        String host = cli.getOptionValue(hostOption.getOpt(), DEFAULT_HOST);

        try (BookCatalogClient client = connect(host, port)) {
            client.runSmokeTest(System.out);
        }
    }

    private static BookPage toPage(ListBooksResponse response) {
        List<Book> books = response.getBooksList().stream()
            .map(BookMapper::toDomain)
            .toList();
        return new BookPage(books, response.getTotalCount());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
