package ch.admin.bj.swiyu.credsync.infrastructure.web;

import ch.admin.bj.swiyu.credsync.api.credential.IssueCredentialRequestDto;
import ch.admin.bj.swiyu.credsync.api.exception.ApiErrorDto;
import ch.admin.bj.swiyu.credsync.common.exception.*;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpStatus.*;

class DefaultExceptionHandlerTest {

    private final DefaultExceptionHandler handler = new DefaultExceptionHandler();

    @Test
    void badRequest_isMappedTo400() {
        var response = handler.handleBadRequestException(new BadRequestException("Invalid since parameter. Expect ISO-8601 string."));

        assertThat(response.getStatusCode()).isEqualTo(BAD_REQUEST);
        assertThat(response.getBody().getErrorDescription()).isEqualTo("Bad Request");
        assertThat(response.getBody().getErrorDetails()).isEqualTo("Invalid since parameter. Expect ISO-8601 string.");
    }

    @Test
    void integrityFailure_isMappedTo400() {
        var response = handler.handleBadRequestException(new CredentialIntegrityException("abc"));

        assertThat(response.getStatusCode()).isEqualTo(BAD_REQUEST);
        assertThat(response.getBody().getErrorDetails()).isEqualTo("Hash mismatch for credential abc");
    }

    @Test
    void unauthorized_isMappedTo401() {
        var response = handler.handleSyncUnauthorizedException(new SyncUnauthorizedException("Unauthorized sync request"));

        assertThat(response.getStatusCode()).isEqualTo(UNAUTHORIZED);
        assertThat(response.getBody().getErrorDetails()).isEqualTo("Unauthorized sync request");
    }

    @Test
    void alreadyIssued_isMappedTo409() {
        var response = handler.handleCredentialAlreadyIssuedException(new CredentialAlreadyIssuedException("abc"));

        assertThat(response.getStatusCode()).isEqualTo(CONFLICT);
        assertThat(response.getBody().getErrorDetails()).isEqualTo("Credential already issued");
    }

    @Test
    void protocolFailure_isMappedTo502WithCause() {
        var response = handler.handleSyncProtocolException(
                new SyncProtocolException("Issuance service not reachable", new IOException("Connection refused")));

        assertThat(response.getStatusCode()).isEqualTo(BAD_GATEWAY);
        assertThat(response.getBody().getErrorDetails()).isEqualTo("Issuance service not reachable - caused by - Connection refused");
    }

    @Test
    void constraintViolations_areMappedTo422() {
        try (var factory = Validation.buildDefaultValidatorFactory()) {
            var violations = factory.getValidator().validate(new IssueCredentialRequestDto(" ", null, Map.of()));

            var response = handler.handleConstraintViolationException(new ConstraintViolationException(violations));

            assertThat(response.getStatusCode()).isEqualTo(UNPROCESSABLE_ENTITY);
            assertThat(response.getBody()).isInstanceOfSatisfying(ApiErrorDto.class,
                    body -> assertThat(body.getErrorDetails()).isEqualTo(
                            "credentialType: Credential type is required, details: Details must contain at least one entry, name: Name is required"));
        }
    }

    @Test
    void unexpectedFailure_isMappedTo500WithoutDetails() {
        var response = handler.handle(new IllegalStateException("connection pool exhausted"));

        assertThat(response.getStatusCode()).isEqualTo(INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getErrorDescription()).isEqualTo("Internal Server Error");
        assertThat(response.getBody().getErrorDetails()).isNull();
    }
}
