package ch.admin.bj.swiyu.credsync.domain.credential;

import ch.admin.bj.swiyu.credsync.common.hash.CanonicalHasher;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialTest {

    private static final Instant ISSUED_AT = Instant.parse("2025-03-01T10:15:30.123456Z");

    @Test
    void deriveId_isHashOfCanonicalContent() {
        var id = Credential.deriveId("Alice", "diploma", Map.of("degree", "MSc"));

        assertThat(id).isEqualTo(CanonicalHasher.sha256Hex(
                "{\"credentialType\":\"diploma\",\"details\":{\"degree\":\"MSc\"},\"name\":\"Alice\"}"));
        assertThat(id).hasSize(64);
    }

    @Test
    void deriveId_isIdempotentForEqualContent() {
        var details = new LinkedHashMap<String, Object>();
        details.put("degree", "MSc");
        details.put("year", 2024);
        var reordered = new LinkedHashMap<String, Object>();
        reordered.put("year", 2024);
        reordered.put("degree", "MSc");

        assertThat(Credential.deriveId("Alice", "diploma", details))
                .isEqualTo(Credential.deriveId("Alice", "diploma", reordered));
        assertThat(Credential.deriveId("Alice", "diploma", details))
                .isNotEqualTo(Credential.deriveId("Bob", "diploma", details));
    }

    @Test
    void issue_sealsCredentialWithMatchingHash() {
        var credential = Credential.issue("Alice", "diploma", Map.of("degree", "MSc"), "worker-1", ISSUED_AT);

        assertThat(credential.getId()).isEqualTo(Credential.deriveId("Alice", "diploma", Map.of("degree", "MSc")));
        assertThat(credential.getIssuedAt()).isEqualTo(Instant.parse("2025-03-01T10:15:30.123Z"));
        assertThat(credential.getIssuedAtIso()).isEqualTo("2025-03-01T10:15:30.123Z");
        assertThat(credential.getHash()).isEqualTo(credential.computeHash());
        assertThat(credential.hasValidHash()).isTrue();
        assertThat(credential.isNew()).isTrue();
    }

    @Test
    void hasValidHash_survivesNumberNotationOfJsonColumn() {
        var issued = Credential.issue("Springfield", "census", Map.of("population", 10000000.0), "worker-1", ISSUED_AT);

        var reloaded = issued.toBuilder()
                .details(Map.of("population", 10000000))
                .build();

        assertThat(reloaded.hasValidHash()).isTrue();
        assertThat(reloaded.computeHash()).isEqualTo(issued.getHash());
        assertThat(Credential.deriveId("Springfield", "census", reloaded.getDetails())).isEqualTo(issued.getId());
    }

    @Test
    void hash_coversAllSixFields() {
        var credential = Credential.issue("Alice", "diploma", Map.of("degree", "MSc"), "worker-1", ISSUED_AT);
        var expected = CanonicalHasher.sha256Hex(
                "{\"credentialType\":\"diploma\",\"details\":{\"degree\":\"MSc\"},\"id\":\"" + credential.getId()
                        + "\",\"issuedAt\":\"2025-03-01T10:15:30.123Z\",\"issuedBy\":\"worker-1\",\"name\":\"Alice\"}");

        assertThat(credential.getHash()).isEqualTo(expected);
    }

    @Test
    void tamperedFields_invalidateHash() {
        var credential = Credential.issue("Alice", "diploma", Map.of("degree", "MSc"), "worker-1", ISSUED_AT);

        assertThat(credential.toBuilder().name("Mallory").build().hasValidHash()).isFalse();
        assertThat(credential.toBuilder().details(Map.of("degree", "PhD")).build().hasValidHash()).isFalse();
        assertThat(credential.toBuilder().issuedBy("worker-9").build().hasValidHash()).isFalse();
        assertThat(credential.toBuilder().issuedAt(ISSUED_AT.plusMillis(1)).build().hasValidHash()).isFalse();
        assertThat(credential.toBuilder().hash("0".repeat(64)).build().hasValidHash()).isFalse();
    }
}
