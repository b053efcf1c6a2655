package com.library.books.config;

import com.library.books.repository.BookRepository;
import com.library.books.repository.InMemoryBookRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BookRepository bookRepository(Clock clock, CatalogProperties properties) {
        InMemoryBookRepository repository = new InMemoryBookRepository(clock);
        if (properties.seedSampleData()) {
            SampleBooks.seed(repository);
            log.info("Seeded catalog with {} sample books", repository.count());
        }
        return repository;
    }
}
