package info.mouts.orderprocessing.exception;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import info.mouts.orderprocessing.queue.QueueUnavailableException;
import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the REST controllers.
 * Uses {@link RestControllerAdvice} to centralize exception handling logic.
 * Maps specific exceptions to appropriate HTTP status codes and formats
 * responses using the Problem Details for HTTP APIs standard (RFC 7807).
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {
    /**
     * Capture {@link OrderNotFoundException} and returns HTTP 404 Not Found.
     *
     * @param ex      The caught {@link OrderNotFoundException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(OrderNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleOrderNotFoundException(OrderNotFoundException ex, WebRequest request) {
        log.warn("Handling OrderNotFoundException: {}", ex.getMessage());

        return problemDetail(HttpStatus.NOT_FOUND, "Order Not Found", ex.getMessage(), request);
    }

    /**
     * Capture {@link MethodArgumentNotValidException} raised by an invalid order
     * submission and returns HTTP 400 Bad Request. The detail carries the first
     * violated rule, the {@code errors} property lists all violations of that
     * validation step.
     *
     * @param ex      The caught {@link MethodArgumentNotValidException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentNotValidException(MethodArgumentNotValidException ex,
            WebRequest request) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .distinct()
                .collect(Collectors.toList());
        String detail = errors.isEmpty() ? "Invalid order request" : errors.get(0);

        log.warn("Rejected order request: {}", errors);

        ProblemDetail problemDetail = problemDetail(HttpStatus.BAD_REQUEST, "Invalid Order Request", detail, request);
        problemDetail.setProperty("errors", errors);

        return problemDetail;
    }

    /**
     * Capture {@link HttpMessageNotReadableException}, i.e. a request body that
     * is not valid JSON or has values of the wrong type, and returns HTTP 400
     * Bad Request.
     *
     * @param ex      The caught {@link HttpMessageNotReadableException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleHttpMessageNotReadableException(HttpMessageNotReadableException ex,
            WebRequest request) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());

        return problemDetail(HttpStatus.BAD_REQUEST, "Malformed Request Body",
                "Request body is not a valid order document", request);
    }

    @ExceptionHandler(InvalidPaginationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleInvalidPaginationException(InvalidPaginationException ex, WebRequest request) {
        log.warn("Handling InvalidPaginationException: {}", ex.getMessage());

        return problemDetail(HttpStatus.BAD_REQUEST, "Invalid Pagination", ex.getMessage(), request);
    }

    /**
     * Capture {@link MethodArgumentTypeMismatchException} and returns HTTP 400 Bad
     * Request.
     * This occurs when a request parameter such as {@code page} is not a number.
     *
     * @param ex      The caught {@link MethodArgumentTypeMismatchException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentTypeMismatchException(MethodArgumentTypeMismatchException ex,
            WebRequest request) {
        log.warn("Handling MethodArgumentTypeMismatchException: {}", ex.getMessage());

        return problemDetail(HttpStatus.BAD_REQUEST, "Invalid Parameter",
                String.format("Parameter '%s' has an invalid value", ex.getName()), request);
    }

    /**
     * Capture {@link QueueUnavailableException} raised while enqueueing an order
     * and returns HTTP 500 Internal Server Error. The order was not accepted.
     *
     * @param ex      The caught {@link QueueUnavailableException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(QueueUnavailableException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ProblemDetail handleQueueUnavailableException(QueueUnavailableException ex, WebRequest request) {
        log.error("Handling QueueUnavailableException: {}", ex.getMessage(), ex);

        return problemDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Queue Unavailable",
                "The order could not be queued for processing.", request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleNoResourceFoundException(NoResourceFoundException ex, WebRequest request) {
        log.debug("Handling NoResourceFoundException: {}", ex.getMessage());

        return problemDetail(HttpStatus.NOT_FOUND, "Not Found", "Route not found", request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    public ProblemDetail handleHttpRequestMethodNotSupportedException(HttpRequestMethodNotSupportedException ex,
            WebRequest request) {
        log.debug("Handling HttpRequestMethodNotSupportedException: {}", ex.getMessage());

        return problemDetail(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", ex.getMessage(), request);
    }

    /**
     * Catches any other unhandled exceptions that may occur during request
     * processing.
     * Returns HTTP 500 Internal Server Error with a generic message to avoid
     * exposing internal details.
     *
     * @param ex      The caught {@link Exception}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Handling unexpected exception: {}", ex.getMessage(), ex);

        return problemDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected internal error occurred.", request);
    }

    private static ProblemDetail problemDetail(HttpStatus status, String title, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setProperty("timestamp", Instant.now());
        problemDetail.setInstance(URI.create(request.getDescription(false)));

        return problemDetail;
    }
}
