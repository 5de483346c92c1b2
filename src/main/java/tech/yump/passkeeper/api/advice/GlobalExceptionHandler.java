package tech.yump.passkeeper.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.passkeeper.auth.InvalidCredentialsException;
import tech.yump.passkeeper.core.BackendException;
import tech.yump.passkeeper.core.NotFoundException;
import tech.yump.passkeeper.core.ValidationException;
import tech.yump.passkeeper.crypto.CipherException;
import tech.yump.passkeeper.storage.BlobStoreException;
import tech.yump.passkeeper.user.UserAlreadyExistsException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final String INTERNAL_MESSAGE = "An unexpected internal error occurred.";

    // --- Client errors ---

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        log.warn("Invalid argument: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return problem(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage());
    }

    // Missing and foreign records share one response
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        log.info("Not found: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return problem(HttpStatus.BAD_REQUEST, "Not Found", ex.getMessage());
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ProblemDetail> handleInvalidCredentials(InvalidCredentialsException ex, HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage());
    }

    @ExceptionHandler(UserAlreadyExistsException.class)
    public ResponseEntity<ProblemDetail> handleUserAlreadyExists(UserAlreadyExistsException ex, HttpServletRequest request) {
        log.info("Registration conflict: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return problem(HttpStatus.CONFLICT, "Already Exists", ex.getMessage());
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}", request.getDescription(false), ex.getMessage());
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    // --- Server errors, details stay in the log ---

    @ExceptionHandler(CipherException.class)
    public ResponseEntity<ProblemDetail> handleCipher(CipherException ex, HttpServletRequest request) {
        log.error("Cipher failure: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", INTERNAL_MESSAGE);
    }

    @ExceptionHandler({BackendException.class, BlobStoreException.class})
    public ResponseEntity<ProblemDetail> handleStorage(RuntimeException ex, HttpServletRequest request) {
        log.error("Storage failure: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", INTERNAL_MESSAGE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", INTERNAL_MESSAGE);
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        return ResponseEntity.status(status).body(problemDetail);
    }
}
