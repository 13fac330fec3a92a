package com.openrangelabs.ingestor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.ingestor.entity.Credential;
import com.openrangelabs.ingestor.exception.CredentialNotFoundException;
import com.openrangelabs.ingestor.model.RotationRecord;
import com.openrangelabs.ingestor.repository.CredentialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialStoreServiceTest {

    private static final String KEY = "crm-db.password";

    @Mock
    private CredentialRepository repository;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final AesCredentialEncryptor encryptor = new AesCredentialEncryptor("unit-test-master-key");
    private CredentialStoreService service;

    @BeforeEach
    void setUp() {
        service = new CredentialStoreService(repository, encryptor, objectMapper);
    }

    @Test
    void store_NewKey_EncryptsValueAndMetadata() {
        // Arrange
        when(repository.findByKey(KEY)).thenReturn(Mono.empty());
        when(repository.save(any(Credential.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        // Act & Assert
        StepVerifier.create(service.store(KEY, "s3cret", "crm", "databases", Map.of("owner", "ops"), null))
            .assertNext(info -> {
                assertThat(info.getKey()).isEqualTo(KEY);
                assertThat(info.getGroup()).isEqualTo("databases");
                assertThat(info.getMetadata()).containsEntry("owner", "ops");
                assertThat(info.isEnabled()).isTrue();
                assertThat(info.getRotationHistory()).isEmpty();
            })
            .verifyComplete();

        ArgumentCaptor<Credential> saved = ArgumentCaptor.forClass(Credential.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getEncryptedValue()).isNotEqualTo("s3cret");
        assertThat(encryptor.decrypt(saved.getValue().getEncryptedValue(), saved.getValue().getIv())).isEqualTo("s3cret");
    }

    @Test
    void store_ExistingKey_ReplacesValueAndReenables() {
        // Arrange
        Credential existing = credential("old");
        existing.setEnabled(false);
        when(repository.findByKey(KEY)).thenReturn(Mono.just(existing));
        when(repository.save(any(Credential.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        // Act & Assert
        StepVerifier.create(service.store(KEY, "new"))
            .assertNext(info -> assertThat(info.isEnabled()).isTrue())
            .verifyComplete();
        assertThat(encryptor.decrypt(existing.getEncryptedValue(), existing.getIv())).isEqualTo("new");
    }

    @Test
    void get_ReturnsDecryptedValueAndRecordsAccess() {
        // Arrange
        when(repository.findByKey(KEY)).thenReturn(Mono.just(credential("s3cret")));
        when(repository.recordAccess(eq(KEY), any(LocalDateTime.class))).thenReturn(Mono.just(1));

        // Act & Assert
        StepVerifier.create(service.get(KEY))
            .expectNext("s3cret")
            .verifyComplete();
        verify(repository).recordAccess(eq(KEY), any(LocalDateTime.class));
    }

    @Test
    void get_ExpiredOrDisabled_IsEmpty() {
        // Arrange
        Credential expired = credential("s3cret");
        expired.setExpiresAt(LocalDateTime.now().minusMinutes(1));
        Credential disabled = credential("s3cret");
        disabled.setEnabled(false);
        when(repository.findByKey("expired")).thenReturn(Mono.just(expired));
        when(repository.findByKey("disabled")).thenReturn(Mono.just(disabled));

        // Act & Assert
        StepVerifier.create(service.get("expired")).verifyComplete();
        StepVerifier.create(service.get("disabled")).verifyComplete();
        verify(repository, never()).recordAccess(any(), any());
    }

    @Test
    void rotate_KeepsOnlyTheLatestTenRecords() throws Exception {
        // Arrange
        Credential credential = credential("v1");
        List<RotationRecord> history = new ArrayList<>();
        for (int i = 0; i < CredentialStoreService.MAX_ROTATION_HISTORY; i++) {
            history.add(new RotationRecord(LocalDateTime.now().minusDays(30 - i), "rotation " + i));
        }
        credential.setRotationHistoryJson(objectMapper.writeValueAsString(history));
        when(repository.findByKey(KEY)).thenReturn(Mono.just(credential));
        when(repository.save(any(Credential.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        // Act & Assert
        StepVerifier.create(service.rotate(KEY, "v2", null))
            .assertNext(info -> {
                assertThat(info.getRotationHistory()).hasSize(CredentialStoreService.MAX_ROTATION_HISTORY);
                assertThat(info.getRotationHistory().get(0).reason()).isEqualTo("rotation 1");
                assertThat(info.getRotationHistory().get(9).reason()).isEqualTo("Manual rotation");
                assertThat(info.getLastRotatedAt()).isNotNull();
            })
            .verifyComplete();
        assertThat(encryptor.decrypt(credential.getEncryptedValue(), credential.getIv())).isEqualTo("v2");
    }

    @Test
    void rotate_UnknownKey_IsNotFound() {
        when(repository.findByKey(KEY)).thenReturn(Mono.empty());

        StepVerifier.create(service.rotate(KEY, "v2", "leak"))
            .expectError(CredentialNotFoundException.class)
            .verify();
    }

    @Test
    void deleteAndDisable_ReportWhetherAnythingChanged() {
        when(repository.deleteByKey(KEY)).thenReturn(Mono.just(0));
        when(repository.disable(eq(KEY), any(LocalDateTime.class))).thenReturn(Mono.just(1));

        StepVerifier.create(service.delete(KEY)).expectNext(false).verifyComplete();
        StepVerifier.create(service.disable(KEY)).expectNext(true).verifyComplete();
    }

    @Test
    void validate_CollectsEveryIssue() {
        // Arrange
        Credential broken = credential("s3cret");
        broken.setEnabled(false);
        broken.setExpiresAt(LocalDateTime.now().minusDays(1));
        broken.setEncryptedValue("bm90LWNpcGhlcnRleHQ=");
        when(repository.findByKey(KEY)).thenReturn(Mono.just(broken));
        when(repository.findByKey("missing")).thenReturn(Mono.empty());

        // Act & Assert
        StepVerifier.create(service.validate(KEY))
            .assertNext(result -> {
                assertThat(result.valid()).isFalse();
                assertThat(result.issues()).hasSize(3)
                    .contains("Credential is disabled", "Credential decryption failed");
            })
            .verifyComplete();
        StepVerifier.create(service.validate("missing"))
            .assertNext(result -> assertThat(result.issues()).containsExactly("Credential not found: missing"))
            .verifyComplete();
    }

    @Test
    void getCredentialKeys_FiltersBySourceAndGroup() {
        Credential first = credential("a");
        first.setKey("a");
        first.setSource("crm");
        Credential second = credential("b");
        second.setKey("b");
        second.setSource("erp");
        when(repository.findAllOrderByKey()).thenReturn(Flux.just(first, second));

        StepVerifier.create(service.getCredentialKeys("erp", null))
            .expectNext("b")
            .verifyComplete();
    }

    private Credential credential(String value) {
        AesCredentialEncryptor.EncryptedSecret secret = encryptor.encrypt(value);
        Credential credential = new Credential(KEY, secret.cipherText(), secret.iv());
        credential.setId(UUID.randomUUID());
        return credential;
    }
}
