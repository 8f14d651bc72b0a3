package com.techStack.geoAccess.repository;

import com.google.api.core.ApiFutures;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Transaction;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.exception.state.ConflictException;
import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.audit.ChangeType;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import io.grpc.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PolicyRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-09-01T12:00:00Z");

    @Mock
    private Firestore firestore;

    @Mock
    private CollectionReference policyCollection;

    @Mock
    private CollectionReference ledgerCollection;

    @Mock
    private DocumentReference policyRef;

    @Mock
    private DocumentReference entryRef;

    @Mock
    private Transaction transaction;

    @Mock
    private DocumentSnapshot snapshot;

    private PolicyRepository repository;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        repository = new PolicyRepository(firestore);

        when(firestore.collection(GeoSecurityConstants.COLLECTION_SECURITY_POLICY)).thenReturn(policyCollection);
        when(firestore.collection(GeoSecurityConstants.COLLECTION_AUDIT_LEDGER)).thenReturn(ledgerCollection);
        when(policyCollection.document(GeoSecurityConstants.ACTIVE_POLICY_DOC_ID)).thenReturn(policyRef);
        when(ledgerCollection.document(any())).thenReturn(entryRef);
        when(transaction.get(policyRef)).thenReturn(ApiFutures.immediateFuture(snapshot));
    }

    private void runTransactionsInline() {
        when(firestore.runTransaction(any())).thenAnswer(invocation -> {
            Transaction.Function<?> function = invocation.getArgument(0);
            try {
                return ApiFutures.immediateFuture(function.updateCallback(transaction));
            } catch (Exception e) {
                return ApiFutures.immediateFailedFuture(e);
            }
        });
    }

    private static SecurityPolicy policy(long version) {
        return SecurityPolicy.builder()
                .id(GeoSecurityConstants.ACTIVE_POLICY_DOC_ID)
                .version(version)
                .primaryCountry("US")
                .enforcementEnabled(true)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static AuditEntry entry(String id, ChangeType changeType) {
        return AuditEntry.builder()
                .id(id)
                .timestamp(NOW)
                .actor("admin")
                .changeType(changeType)
                .newValue("US")
                .checksum("ab".repeat(32))
                .build();
    }

    @Test
    void createInitial_shouldWritePolicyAndInitEntryTogether() {
        // Arrange
        runTransactionsInline();
        SecurityPolicy initial = policy(1);

        // Act & Assert
        StepVerifier.create(repository.createInitial(initial, entry("e-init", ChangeType.POLICY_INITIALIZED)))
                .expectNext(initial)
                .verifyComplete();

        verify(transaction).create(eq(policyRef), anyMap());
        verify(transaction).create(eq(entryRef), ArgumentMatchers.<Map<String, Object>>argThat(
                data -> "POLICY_INITIALIZED".equals(data.get("changeType"))));
    }

    @Test
    void createInitial_shouldReportConflict_whenPolicyAlreadyExists() {
        // Arrange: the commit of create() fails because the document is there
        when(firestore.runTransaction(any())).thenReturn(ApiFutures.immediateFailedFuture(
                Status.ALREADY_EXISTS.withDescription("Document already exists").asRuntimeException()));

        // Act & Assert
        StepVerifier.create(repository.createInitial(policy(1), entry("e-init", ChangeType.POLICY_INITIALIZED)))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ConflictException.class)
                        .hasMessageContaining("already exists"))
                .verify();
    }

    @Test
    void createInitial_shouldPassOtherFailuresThrough() {
        when(firestore.runTransaction(any())).thenReturn(ApiFutures.immediateFailedFuture(
                Status.UNAVAILABLE.withDescription("backend down").asRuntimeException()));

        StepVerifier.create(repository.createInitial(policy(1), entry("e-init", ChangeType.POLICY_INITIALIZED)))
                .expectErrorSatisfies(error -> assertThat(error).isNotInstanceOf(ConflictException.class))
                .verify();
    }

    @Test
    void commitUpdate_shouldRejectVersionMismatch() {
        // Arrange: stored version moved on to 5 while the caller edited version 4
        runTransactionsInline();
        when(snapshot.exists()).thenReturn(true);
        when(snapshot.getLong("version")).thenReturn(5L);

        // Act & Assert
        StepVerifier.create(repository.commitUpdate(4, policy(5),
                        List.of(entry("e-1", ChangeType.PRIMARY_COUNTRY))))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ConflictException.class)
                        .hasMessageContaining("expected version 4, found 5"))
                .verify();

        verify(transaction, never()).set(any(DocumentReference.class), anyMap());
        verify(transaction, never()).create(any(DocumentReference.class), anyMap());
    }

    @Test
    void commitUpdate_shouldRejectWhenPolicyIsMissing() {
        runTransactionsInline();
        when(snapshot.exists()).thenReturn(false);

        StepVerifier.create(repository.commitUpdate(1, policy(2), List.of()))
                .expectError(ConflictException.class)
                .verify();
    }

    @Test
    void commitUpdate_shouldWritePolicyAndEveryEntry_whenVersionMatches() {
        // Arrange
        runTransactionsInline();
        when(snapshot.exists()).thenReturn(true);
        when(snapshot.getLong("version")).thenReturn(4L);
        SecurityPolicy next = policy(5);

        // Act & Assert
        StepVerifier.create(repository.commitUpdate(4, next, List.of(
                        entry("e-1", ChangeType.PRIMARY_COUNTRY),
                        entry("e-2", ChangeType.ENFORCEMENT_TOGGLE))))
                .expectNext(next)
                .verifyComplete();

        verify(transaction).set(eq(policyRef), ArgumentMatchers.<Map<String, Object>>argThat(
                data -> Long.valueOf(5L).equals(data.get("version"))));
        verify(transaction, times(2)).create(eq(entryRef), anyMap());
    }
}
