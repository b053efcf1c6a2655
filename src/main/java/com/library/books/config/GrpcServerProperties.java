package com.library.books.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param port                port of the plaintext listener; {@code 0} binds an ephemeral port
 * @param reflectionEnabled   whether to register the gRPC server reflection service
 * @param shutdownGracePeriod how long in-flight calls may run after shutdown begins
 */
@ConfigurationProperties(prefix = "books.grpc")
public record GrpcServerProperties(
    @DefaultValue("50052") int port,
    @DefaultValue("true") boolean reflectionEnabled,
    @DefaultValue("5s") Duration shutdownGracePeriod
) {}
