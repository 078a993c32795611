package ch.admin.bj.swiyu.credsync.service.credential;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.api.credential.IssueCredentialRequestDto;
import ch.admin.bj.swiyu.credsync.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.credsync.common.exception.CredentialAlreadyIssuedException;
import ch.admin.bj.swiyu.credsync.domain.credential.Credential;
import ch.admin.bj.swiyu.credsync.service.persistence.CredentialPersistenceService;
import ch.admin.bj.swiyu.credsync.service.sync.CredentialSyncEventProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CredentialIssuanceServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30.123789Z");

    @Mock
    private CredentialPersistenceService persistenceService;
    @Mock
    private CredentialSyncEventProducer syncEventProducer;
    @Mock
    private ApplicationProperties applicationProperties;

    private CredentialIssuanceService issuanceService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(applicationProperties.getWorkerLabel()).thenReturn("worker-2");
        when(persistenceService.insert(any())).thenAnswer(invocation -> invocation.getArgument(0));
        issuanceService = new CredentialIssuanceService(persistenceService, syncEventProducer, applicationProperties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void issueCredential_storesSealedCredentialAndPublishesIt() {
        var request = new IssueCredentialRequestDto("  Alice ", "diploma ", Map.of("degree", "MSc"));
        when(persistenceService.findById(any())).thenReturn(Optional.empty());

        var response = issuanceService.issueCredential(request);

        var captor = ArgumentCaptor.forClass(Credential.class);
        verify(persistenceService).insert(captor.capture());
        var stored = captor.getValue();
        assertThat(stored.getName()).isEqualTo("Alice");
        assertThat(stored.getCredentialType()).isEqualTo("diploma");
        assertThat(stored.getIssuedBy()).isEqualTo("worker-2");
        assertThat(stored.getIssuedAt()).isEqualTo(Instant.parse("2025-03-01T10:15:30.123Z"));
        assertThat(stored.getId()).isEqualTo(Credential.deriveId("Alice", "diploma", Map.of("degree", "MSc")));
        assertThat(stored.hasValidHash()).isTrue();

        assertThat(response.success()).isTrue();
        assertThat(response.message()).isEqualTo("credential issued by worker-2");
        assertThat(response.credential().getId()).isEqualTo(stored.getId());
        assertThat(response.credential().getIssuedAt()).isEqualTo("2025-03-01T10:15:30.123Z");
        assertThat(response.credential().getHash()).isEqualTo(stored.getHash());

        verify(syncEventProducer).produceCredentialIssuedEvent(response.credential());
    }

    @Test
    void issueCredential_sameContentTwice_isRejectedWithoutPublishing() {
        var request = new IssueCredentialRequestDto("Alice", "diploma", Map.of("degree", "MSc"));
        var existing = Credential.issue("Alice", "diploma", Map.of("degree", "MSc"), "worker-1", NOW);
        when(persistenceService.findById(existing.getId())).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> issuanceService.issueCredential(request))
                .isInstanceOf(CredentialAlreadyIssuedException.class)
                .hasMessage("Credential already issued");

        verify(persistenceService, never()).insert(any());
        verifyNoInteractions(syncEventProducer);
    }

    @Test
    void issueCredential_lostInsertRace_isNotPublished() {
        var request = new IssueCredentialRequestDto("Alice", "diploma", Map.of("degree", "MSc"));
        when(persistenceService.findById(any())).thenReturn(Optional.empty());
        when(persistenceService.insert(any())).thenThrow(new CredentialAlreadyIssuedException("id"));

        assertThatThrownBy(() -> issuanceService.issueCredential(request))
                .isInstanceOf(CredentialAlreadyIssuedException.class);

        verifyNoInteractions(syncEventProducer);
    }

    @Test
    void getCredentialsIssuedAfter_mapsStoredCredentials() {
        var credential = Credential.issue("Alice", "diploma", Map.of("degree", "MSc"), "worker-1", NOW);
        when(persistenceService.listIssuedAfter(NOW.minusSeconds(1))).thenReturn(List.of(credential));

        List<CredentialDto> result = issuanceService.getCredentialsIssuedAfter(NOW.minusSeconds(1));

        assertThat(result).singleElement().satisfies(dto -> {
            assertThat(dto.getId()).isEqualTo(credential.getId());
            assertThat(dto.getIssuedBy()).isEqualTo("worker-1");
            assertThat(dto.getHash()).isEqualTo(credential.getHash());
        });
    }
}
