/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.web;

import ch.admin.bj.swiyu.credsync.api.exception.ApiErrorDto;
import ch.admin.bj.swiyu.credsync.common.exception.*;
import jakarta.validation.ConstraintViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.springframework.http.HttpStatus.*;

@RestControllerAdvice
@Slf4j
public class DefaultExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler({BadRequestException.class, CredentialIntegrityException.class})
    public ResponseEntity<ApiErrorDto> handleBadRequestException(final Exception exception) {
        log.debug("Bad Request intercepted", exception);
        return toResponse(BAD_REQUEST, exception.getMessage());
    }

    @ExceptionHandler(SyncUnauthorizedException.class)
    public ResponseEntity<ApiErrorDto> handleSyncUnauthorizedException(final SyncUnauthorizedException exception) {
        log.warn("Rejected internal request: {}", exception.getMessage());
        return toResponse(UNAUTHORIZED, exception.getMessage());
    }

    @ExceptionHandler(CredentialAlreadyIssuedException.class)
    public ResponseEntity<ApiErrorDto> handleCredentialAlreadyIssuedException(final CredentialAlreadyIssuedException exception) {
        log.debug("Credential {} already issued", exception.getCredentialId());
        return toResponse(CONFLICT, exception.getMessage());
    }

    @ExceptionHandler(SyncProtocolException.class)
    public ResponseEntity<ApiErrorDto> handleSyncProtocolException(final SyncProtocolException exception) {
        var exceptionMessage = exception.getMessage();
        if (exception.getCause() != null) {
            exceptionMessage += " - caused by - " + exception.getCause().getMessage();
        }
        log.error("Sync Protocol Exception intercepted", exception);
        return toResponse(BAD_GATEWAY, exceptionMessage);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Object> handleConstraintViolationException(final ConstraintViolationException exception) {
        var errors = exception.getConstraintViolations().stream()
                .map(violation -> String.format("%s: %s", violation.getPropertyPath(), violation.getMessage()))
                .sorted()
                .collect(Collectors.joining(", "));

        return handleUnprocessableEntity(errors);
    }

    @ExceptionHandler
    public ResponseEntity<ApiErrorDto> handle(final Exception exception) {
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(INTERNAL_SERVER_ERROR.getReasonPhrase())
                .status(INTERNAL_SERVER_ERROR)
                .build();

        log.error("Unknown Exception occurred", exception);
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(@NonNull MethodArgumentNotValidException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {

        String errors = Stream.concat(
                        ex.getBindingResult().getFieldErrors()
                                .stream().map(error -> String.format("%s: %s", error.getField(), error.getDefaultMessage())),
                        ex.getBindingResult().getGlobalErrors().stream().map(error -> String.format("%s: %s", error.getObjectName(), error.getDefaultMessage()))
                ).sorted()
                .collect(Collectors.joining(", "));

        return handleUnprocessableEntity(errors);
    }

    private ResponseEntity<Object> handleUnprocessableEntity(String errors) {
        log.info("Received bad request. Details: {}", errors);

        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(UNPROCESSABLE_ENTITY.getReasonPhrase())
                .errorDetails(errors)
                .status(UNPROCESSABLE_ENTITY)
                .build();

        return new ResponseEntity<>(apiError, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    private static ResponseEntity<ApiErrorDto> toResponse(HttpStatus status, String details) {
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(status.getReasonPhrase())
                .errorDetails(details)
                .status(status)
                .build();
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }
}
