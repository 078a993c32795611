package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.common.exception.SyncUnauthorizedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncSecretVerifierTest {

    private static final URI PEER = URI.create("http://localhost:3002");

    @Test
    void verify_matchingSecret_passes() {
        var verifier = new SyncSecretVerifier(SyncTestData.syncProperties(PEER, SyncTestData.SECRET));

        assertThatCode(() -> verifier.verify(headers(SyncTestData.SECRET), "Unauthorized sync request"))
                .doesNotThrowAnyException();
    }

    @Test
    void verify_wrongSecret_isUnauthorized() {
        var verifier = new SyncSecretVerifier(SyncTestData.syncProperties(PEER, SyncTestData.SECRET));

        assertThatThrownBy(() -> verifier.verify(headers("guess"), "Unauthorized sync request"))
                .isInstanceOf(SyncUnauthorizedException.class)
                .hasMessage("Unauthorized sync request");
    }

    @Test
    void verify_missingSecret_isUnauthorized() {
        var verifier = new SyncSecretVerifier(SyncTestData.syncProperties(PEER, SyncTestData.SECRET));

        assertThatThrownBy(() -> verifier.verify(new HttpHeaders(), "Unauthorized access"))
                .isInstanceOf(SyncUnauthorizedException.class)
                .hasMessage("Unauthorized access");
    }

    @Test
    void verify_noConfiguredSecret_acceptsEveryone() {
        var verifier = new SyncSecretVerifier(SyncTestData.syncProperties(PEER, " "));

        assertThatCode(() -> verifier.verify(new HttpHeaders(), "Unauthorized access")).doesNotThrowAnyException();
    }

    private static HttpHeaders headers(String secret) {
        var headers = new HttpHeaders();
        headers.add("x-internal-sync-key", secret);
        return headers;
    }
}
