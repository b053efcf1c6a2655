package com.library.books.grpc.handler;

import com.library.books.exception.DuplicateIsbnException;
import com.library.books.exception.InvalidBookException;
import com.library.books.exception.ResourceNotFoundException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Central translation of service exceptions for the gRPC layer.
 *
 * <p>Business failures travel inside the response payload ({@code success=false} plus a message)
 * while the call itself completes with {@code OK}. Anything else is unexpected: mutating calls
 * still answer with a payload failure, read calls abort with {@link Status#INTERNAL}.
 */
@Component
public class GrpcExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionHandler.class);

    static final String INTERNAL_ERROR_PREFIX = "Internal error: ";

    public String toFailureMessage(RuntimeException ex, String operation) {
        if (ex instanceof InvalidBookException
                || ex instanceof DuplicateIsbnException
                || ex instanceof ResourceNotFoundException) {
            log.debug("Rejected {}: {}", operation, ex.getMessage());
            return ex.getMessage();
        }
        log.error("Error {}", operation, ex);
        return INTERNAL_ERROR_PREFIX + ex.getMessage();
    }

    public StatusRuntimeException toStatus(RuntimeException ex, String operation) {
        if (ex instanceof StatusRuntimeException sre) {
            return sre;
        }
        log.error("Error {}", operation, ex);
        return Status.INTERNAL
            .withDescription(INTERNAL_ERROR_PREFIX + ex.getMessage())
            .withCause(ex)
            .asRuntimeException();
    }
}
