package com.library.books.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "books.catalog")
public record CatalogProperties(
    @DefaultValue("true") boolean seedSampleData
) {}
