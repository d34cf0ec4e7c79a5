package com.taskline.dispatch.api;

import com.taskline.core.error.ErrorCode;
import com.taskline.core.error.ErrorResponse;
import com.taskline.core.error.TasklineException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;

import java.time.Clock;

/**
 * Maps failures to the {@code {error, code, details, timestamp}} body with the
 * status carried by each {@link ErrorCode}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(TasklineException.class)
    public ResponseEntity<ErrorResponse> handleTasklineException(TasklineException ex, HttpServletRequest request) {
        int status = ex.code().httpStatus();
        if (status >= 500) {
            log.error("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                    request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(),
                    ex.code(), ex.getMessage(), ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                    request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(),
                    ex.code(), ex.getMessage());
        }
        return body(status, ErrorResponse.of(ex, clock.instant()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableBody(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(),
                ErrorCode.VALIDATION_ERROR, truncate(ex.getMessage(), 300));
        return body(HttpStatus.BAD_REQUEST.value(),
                ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Request body is not valid JSON", clock.instant()));
    }

    /** The client of a stream went away; there is nobody to answer. */
    @ExceptionHandler(AsyncRequestNotUsableException.class)
    public void handleClientGone(AsyncRequestNotUsableException ex, HttpServletRequest request) {
        log.debug("Client disconnected from {}: {}", request.getRequestURI(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknownException(Exception ex, HttpServletRequest request) {
        // framework rejections (unknown route, wrong method, missing parameter) keep their 4xx status
        if (ex instanceof org.springframework.web.ErrorResponse framework
                && framework.getStatusCode().is4xxClientError()) {
            log.warn("HTTP_ERROR path={}, method={}, errorType={}, status={}",
                    request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(),
                    framework.getStatusCode().value());
            return body(framework.getStatusCode().value(),
                    ErrorResponse.of(ErrorCode.VALIDATION_ERROR, truncate(ex.getMessage(), 300), clock.instant()));
        }
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(),
                ErrorCode.INTERNAL_ERROR, truncate(ex.getMessage(), 300), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR.value(),
                ErrorResponse.of(ErrorCode.INTERNAL_ERROR, "Internal server error", clock.instant()));
    }

    private static ResponseEntity<ErrorResponse> body(int status, ErrorResponse error) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(error);
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
