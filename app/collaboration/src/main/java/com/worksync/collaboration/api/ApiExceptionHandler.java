package com.worksync.collaboration.api;

import com.worksync.collaboration.service.AuthenticationFailedException;
import com.worksync.collaboration.service.NotificationNotFoundException;
import com.worksync.collaboration.service.NotificationPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps domain failures onto the shared {@link ApiErrorResponse} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(NotificationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(NotificationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("NOTIFICATION_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(AuthenticationFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthentication(AuthenticationFailedException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse("UNAUTHORIZED", ex.getMessage()));
  }

  @ExceptionHandler(NotificationPersistenceException.class)
  public ResponseEntity<ApiErrorResponse> handlePersistence(NotificationPersistenceException ex) {
    logger.error("notification persistence failure", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("PERSISTENCE_FAILURE", "notification store unavailable"));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentTypeMismatchException.class,
    MethodArgumentNotValidException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }
}
