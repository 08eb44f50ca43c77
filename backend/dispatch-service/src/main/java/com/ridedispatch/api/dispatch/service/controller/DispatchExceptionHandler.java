package com.ridedispatch.api.dispatch.service.controller;

import com.ridedispatch.api.dispatch.service.dto.ErrorResponse;
import com.ridedispatch.api.dispatch.service.exception.ActiveRideExistsException;
import com.ridedispatch.api.dispatch.service.exception.DispatchException;
import com.ridedispatch.api.dispatch.service.exception.InvalidTransitionException;
import com.ridedispatch.api.dispatch.service.exception.NotRideParticipantException;
import com.ridedispatch.api.dispatch.service.exception.OfferNotFoundException;
import com.ridedispatch.api.dispatch.service.exception.RideNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class DispatchExceptionHandler {

    private final Clock clock;

    @ExceptionHandler({RideNotFoundException.class, OfferNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(DispatchException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({InvalidTransitionException.class, ActiveRideExistsException.class})
    public ResponseEntity<ErrorResponse> handleConflict(DispatchException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(NotRideParticipantException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(NotRideParticipantException e) {
        log.warn(e.getMessage());
        return error(HttpStatus.FORBIDDEN, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ErrorResponse> handleDispatch(DispatchException e) {
        log.error("Dispatch failure", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(ZonedDateTime.now(clock))
                .build());
    }
}
