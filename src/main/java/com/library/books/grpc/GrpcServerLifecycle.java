package com.library.books.grpc;

import com.library.books.config.GrpcServerProperties;
import com.library.books.grpc.v1.BooksServiceGrpc;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.grpc.util.TransmitStatusRuntimeExceptionInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs the gRPC listener for as long as the Spring context is running.
 *
 * <p>Besides the book catalog the server hosts the standard health service and, when enabled,
 * server reflection. {@link TransmitStatusRuntimeExceptionInterceptor} is installed so that a
 * {@code StatusRuntimeException} raised by a service reaches the client with its real status and
 * description instead of a bare {@code UNKNOWN}.
 */
@Component
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);

    private final GrpcServerProperties properties;
    private final BookGrpcService bookGrpcService;
    private final HealthStatusManager healthStatusManager = new HealthStatusManager();

    private volatile Server server;

    public GrpcServerLifecycle(GrpcServerProperties properties, BookGrpcService bookGrpcService) {
        this.properties = properties;
        this.bookGrpcService = bookGrpcService;
    }

    @Override
    public void start() {
        ServerBuilder<?> builder = ServerBuilder.forPort(properties.port())
            .addService(healthStatusManager.getHealthService())
            .addService(bookGrpcService)
            .intercept(TransmitStatusRuntimeExceptionInterceptor.instance());
        if (properties.reflectionEnabled()) {
            builder.addService(reflectionService());
        }
        Server built = builder.build();
        try {
            built.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start gRPC server on port " + properties.port(), e);
        }
        this.server = built;
        healthStatusManager.setStatus(BooksServiceGrpc.SERVICE_NAME, HealthCheckResponse.ServingStatus.SERVING);
        healthStatusManager.setStatus(HealthStatusManager.SERVICE_NAME_ALL_SERVICES,
            HealthCheckResponse.ServingStatus.SERVING);

        if (log.isInfoEnabled()) {
            log.info("Starting Books gRPC server on port {} with services: {}", built.getPort(), serviceNames(built));
        }
    }

    @Override
    public void stop() {
        Server running = this.server;
        if (running == null) {
            return;
        }
        log.info("Shutting down gRPC server...");
        healthStatusManager.enterTerminalState();
        running.shutdown();
        try {
            long graceMillis = properties.shutdownGracePeriod().toMillis();
            if (!running.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.warn("gRPC server did not terminate within {}, forcing shutdown", properties.shutdownGracePeriod());
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            running.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            this.server = null;
        }
    }

    @Override
    public boolean isRunning() {
        Server running = this.server;
        return running != null && !running.isShutdown();
    }

    /**
     * Port the listener is bound to. Differs from the configured port when that is {@code 0}.
     *
     * @throws IllegalStateException if the server is not running
     */
    public int getPort() {
        Server running = this.server;
        if (running == null) {
            throw new IllegalStateException("gRPC server is not running");
        }
        return running.getPort();
    }

    @SuppressWarnings("deprecation")
    private static BindableService reflectionService() {
        return ProtoReflectionService.newInstance();
    }

    private static String serviceNames(Server server) {
        List<String> names = server.getServices().stream()
            .map(definition -> definition.getServiceDescriptor().getName())
            .collect(Collectors.toList());
        return String.join(", ", names);
    }
}
