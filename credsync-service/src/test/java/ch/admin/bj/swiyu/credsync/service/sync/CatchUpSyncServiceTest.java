package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.common.exception.CredentialIntegrityException;
import ch.admin.bj.swiyu.credsync.common.exception.SyncProtocolException;
import ch.admin.bj.swiyu.credsync.domain.credential.Credential;
import ch.admin.bj.swiyu.credsync.service.credential.CredentialIntegrityService;
import ch.admin.bj.swiyu.credsync.service.persistence.CredentialPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(OutputCaptureExtension.class)
class CatchUpSyncServiceTest {

    private static final Instant CURSOR = Instant.parse("2025-03-01T10:15:30.123Z");

    @Mock
    private IssuanceCatchUpClient catchUpClient;
    @Mock
    private CredentialPersistenceService persistenceService;

    private CatchUpSyncService catchUpSyncService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(persistenceService.upsertMany(anyList())).thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
        catchUpSyncService = new CatchUpSyncService(catchUpClient, persistenceService, new CredentialIntegrityService());
    }

    @Test
    void performCatchUpSync_emptyStore_fetchesEverything() {
        when(persistenceService.latestIssuedAt()).thenReturn(Optional.empty());
        when(catchUpClient.fetchIssuedAfter(null)).thenReturn(List.of(
                SyncTestData.credentialDto("Alice", CURSOR),
                SyncTestData.credentialDto("Bob", CURSOR.plusMillis(1))));

        assertThat(catchUpSyncService.performCatchUpSync()).isEqualTo(2);

        var captor = listCaptor();
        verify(persistenceService).upsertMany(captor.capture());
        assertThat(captor.getValue()).extracting(Credential::getName).containsExactly("Alice", "Bob");
    }

    @Test
    void performCatchUpSync_usesLatestStoredInstantAsCursor() {
        when(persistenceService.latestIssuedAt()).thenReturn(Optional.of(CURSOR));
        when(catchUpClient.fetchIssuedAfter(CURSOR)).thenReturn(List.of(SyncTestData.credentialDto("Bob", CURSOR.plusSeconds(5))));

        assertThat(catchUpSyncService.performCatchUpSync()).isEqualTo(1);

        verify(catchUpClient).fetchIssuedAfter(CURSOR);
    }

    @Test
    void performCatchUpSync_ignoresRecordsNotNewerThanCursor(CapturedOutput output) {
        when(persistenceService.latestIssuedAt()).thenReturn(Optional.of(CURSOR));
        when(catchUpClient.fetchIssuedAfter(CURSOR)).thenReturn(List.of(
                SyncTestData.credentialDto("Alice", CURSOR),
                SyncTestData.credentialDto("Bob", CURSOR.plusMillis(1))));

        assertThat(catchUpSyncService.performCatchUpSync()).isEqualTo(1);

        var captor = listCaptor();
        verify(persistenceService).upsertMany(captor.capture());
        assertThat(captor.getValue()).extracting(Credential::getName).containsExactly("Bob");
        assertThat(output.getAll()).contains("not newer than cursor");
    }

    @Test
    void performCatchUpSync_nothingMissing_storesNothing(CapturedOutput output) {
        when(persistenceService.latestIssuedAt()).thenReturn(Optional.of(CURSOR));
        when(catchUpClient.fetchIssuedAfter(CURSOR)).thenReturn(List.of());

        assertThat(catchUpSyncService.performCatchUpSync()).isZero();

        verify(persistenceService, never()).upsertMany(any());
        assertThat(output.getAll()).contains("Catch-up sync found no missing credentials");
    }

    @Test
    void performCatchUpSync_singleTamperedRecord_discardsWholeBatch() {
        var tampered = SyncTestData.credentialDto("Mallory", CURSOR.plusMillis(2));
        tampered.setIssuedBy("worker-9");
        when(persistenceService.latestIssuedAt()).thenReturn(Optional.of(CURSOR));
        when(catchUpClient.fetchIssuedAfter(CURSOR)).thenReturn(List.of(
                SyncTestData.credentialDto("Bob", CURSOR.plusMillis(1)),
                tampered));

        assertThatThrownBy(() -> catchUpSyncService.performCatchUpSync())
                .isInstanceOf(CredentialIntegrityException.class)
                .hasMessage("Hash mismatch for credential " + tampered.getId());

        verify(persistenceService, never()).upsertMany(any());
    }

    @Test
    void performCatchUpSync_peerFailure_propagates() {
        when(persistenceService.latestIssuedAt()).thenReturn(Optional.empty());
        when(catchUpClient.fetchIssuedAfter(null)).thenThrow(new SyncProtocolException("Issuance service not reachable"));

        assertThatThrownBy(() -> catchUpSyncService.performCatchUpSync())
                .isInstanceOf(SyncProtocolException.class);

        verify(persistenceService, never()).upsertMany(any());
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<List<Credential>> listCaptor() {
        return ArgumentCaptor.forClass(List.class);
    }
}
