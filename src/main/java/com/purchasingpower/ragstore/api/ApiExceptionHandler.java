package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.exception.ErrorCode;
import com.purchasingpower.ragstore.exception.RagStoreException;
import com.purchasingpower.ragstore.util.Futures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Maps failures to {@code {error, detail}} bodies with the status bound to
 * each {@link ErrorCode}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(RagStoreException.class)
    public ResponseEntity<ApiError> handleRagStore(RagStoreException ex) {
        ErrorCode code = ex.getErrorCode();
        if (code == ErrorCode.UPSTREAM_ERROR || code == ErrorCode.UPSTREAM_TIMEOUT) {
            log.warn("Upstream failure: {}", ex.getMessage());
        } else {
            log.debug("Request failed with {}: {}", code, ex.getMessage());
        }
        return respond(code, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return respond(ErrorCode.VALIDATION_ERROR, detail);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        return respond(ErrorCode.VALIDATION_ERROR, ex.getMessage());
    }

    @ExceptionHandler({CompletionException.class, ExecutionException.class})
    public ResponseEntity<ApiError> handleWrapped(Exception ex) {
        Throwable cause = Futures.unwrap(ex);
        if (cause instanceof RagStoreException ragError) {
            return handleRagStore(ragError);
        }
        return handleUnexpected(cause);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleOther(Exception ex) {
        return handleUnexpected(ex);
    }

    private ResponseEntity<ApiError> handleUnexpected(Throwable ex) {
        if (ex instanceof ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
            HttpStatusCode status = framework.getStatusCode();
            ErrorCode code = status.value() == 404 ? ErrorCode.NOT_FOUND : ErrorCode.VALIDATION_ERROR;
            return ResponseEntity.status(status).body(new ApiError(code, ex.getMessage()));
        }
        log.error("Unhandled error", ex);
        return respond(ErrorCode.INTERNAL_ERROR, ex.getMessage());
    }

    private static ResponseEntity<ApiError> respond(ErrorCode code, String detail) {
        return ResponseEntity.status(code.getStatus()).body(new ApiError(code, detail));
    }
}
