package com.library.books;

import com.library.books.integration.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BookCatalogApplicationTests extends AbstractIntegrationTest {

    @Test
    void contextLoads() {
        // Verifies: Spring context starts, the catalog is seeded and the gRPC listener is bound.
        assertThat(grpcServer.isRunning()).isTrue();
        assertThat(grpcServer.getPort()).isPositive();
    }
}
