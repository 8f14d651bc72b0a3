package com.techStack.geoAccess.repository;

import com.google.api.core.ApiFutures;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.Transaction;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.exception.data.ResourceNotFoundException;
import com.techStack.geoAccess.exception.state.ConflictException;
import com.techStack.geoAccess.models.access.AccessException;
import com.techStack.geoAccess.models.access.ExceptionStatus;
import com.techStack.geoAccess.util.firebase.AccessDocumentMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AccessExceptionRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-09-01T12:00:00Z");

    @Mock
    private Firestore firestore;

    @Mock
    private CollectionReference collection;

    @Mock
    private Query query;

    @Mock
    private DocumentReference documentRef;

    @Mock
    private Transaction transaction;

    @Mock
    private DocumentSnapshot snapshot;

    @Mock
    private QuerySnapshot querySnapshot;

    @Captor
    private ArgumentCaptor<Map<String, Object>> dataCaptor;

    private AccessExceptionRepository repository;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        repository = new AccessExceptionRepository(firestore);

        when(firestore.collection(GeoSecurityConstants.COLLECTION_ACCESS_EXCEPTIONS)).thenReturn(collection);
        when(collection.document(anyString())).thenReturn(documentRef);
        when(collection.whereEqualTo(anyString(), any())).thenReturn(query);
        when(query.whereEqualTo(anyString(), any())).thenReturn(query);
        when(transaction.get(documentRef)).thenReturn(ApiFutures.immediateFuture(snapshot));
        when(transaction.get(query)).thenReturn(ApiFutures.immediateFuture(querySnapshot));

        when(firestore.runTransaction(any())).thenAnswer(invocation -> {
            Transaction.Function<?> function = invocation.getArgument(0);
            try {
                return ApiFutures.immediateFuture(function.updateCallback(transaction));
            } catch (Exception e) {
                return ApiFutures.immediateFailedFuture(e);
            }
        });
    }

    private static AccessException exception(String id, ExceptionStatus status, Instant endsAt) {
        return AccessException.builder()
                .id(id)
                .userId("u1")
                .destinationCountry("FR")
                .reason("Conference")
                .startsAt(NOW.minus(Duration.ofDays(3)))
                .endsAt(endsAt)
                .status(status)
                .requestedBy("u1")
                .requestedAt(NOW.minus(Duration.ofDays(4)))
                .build();
    }

    private void storedForDestination(AccessException... existing) {
        List<QueryDocumentSnapshot> documents = new ArrayList<>();
        for (AccessException other : existing) {
            QueryDocumentSnapshot document = mock(QueryDocumentSnapshot.class);
            when(document.getData()).thenReturn(AccessDocumentMapper.toMap(other));
            documents.add(document);
        }
        when(querySnapshot.getDocuments()).thenReturn(documents);
    }

    private void stored(AccessException exception) {
        when(snapshot.exists()).thenReturn(true);
        when(snapshot.getData()).thenReturn(AccessDocumentMapper.toMap(exception));
    }

    /* ===== createIfNoneOpen ===== */

    @Test
    void createIfNoneOpen_shouldRejectWhenPendingRequestIsOpen() {
        // Arrange
        storedForDestination(exception("exc-1", ExceptionStatus.PENDING, NOW.plus(Duration.ofDays(2))));
        AccessException request = exception("exc-2", ExceptionStatus.PENDING, NOW.plus(Duration.ofDays(5)));

        // Act & Assert
        StepVerifier.create(repository.createIfNoneOpen(request, NOW))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ConflictException.class)
                        .hasMessageContaining("exc-1"))
                .verify();

        verify(transaction, never()).create(any(DocumentReference.class), anyMap());
    }

    @Test
    void createIfNoneOpen_shouldRejectWhenLiveApprovalExists() {
        storedForDestination(exception("exc-1", ExceptionStatus.APPROVED, NOW.plus(Duration.ofDays(2))));

        StepVerifier.create(repository.createIfNoneOpen(
                        exception("exc-2", ExceptionStatus.PENDING, NOW.plus(Duration.ofDays(5))), NOW))
                .expectError(ConflictException.class)
                .verify();
    }

    @Test
    void createIfNoneOpen_shouldCreateWhenOnlyClosedExceptionsExist() {
        // Arrange
        storedForDestination(
                exception("exc-1", ExceptionStatus.DENIED, NOW.plus(Duration.ofDays(2))),
                exception("exc-2", ExceptionStatus.APPROVED, NOW.minus(Duration.ofHours(1))),
                exception("exc-3", ExceptionStatus.PENDING, NOW.minus(Duration.ofHours(1))));
        AccessException request = exception("exc-4", ExceptionStatus.PENDING, NOW.plus(Duration.ofDays(5)));

        // Act & Assert
        StepVerifier.create(repository.createIfNoneOpen(request, NOW))
                .expectNext(request)
                .verifyComplete();

        verify(transaction).create(eq(documentRef), dataCaptor.capture());
        assertThat(dataCaptor.getValue())
                .containsEntry("id", "exc-4")
                .containsEntry("status", "PENDING");
    }

    /* ===== transition ===== */

    @Test
    void transition_shouldWriteChange_whenGuardAcceptsStoredState() {
        // Arrange
        stored(exception("exc-1", ExceptionStatus.PENDING, NOW.plus(Duration.ofDays(2))));

        // Act & Assert
        StepVerifier.create(repository.transition("exc-1", NOW,
                        current -> current.getStatus() == ExceptionStatus.PENDING,
                        current -> current.toBuilder().status(ExceptionStatus.APPROVED).decidedBy("admin").build()))
                .assertNext(outcome -> {
                    assertThat(outcome.isApplied()).isTrue();
                    assertThat(outcome.getException().getStatus()).isEqualTo(ExceptionStatus.APPROVED);
                })
                .verifyComplete();

        verify(transaction).set(eq(documentRef), dataCaptor.capture());
        assertThat(dataCaptor.getValue())
                .containsEntry("status", "APPROVED")
                .containsEntry("decidedBy", "admin");
    }

    @Test
    void transition_shouldLeaveDocumentUntouched_whenGuardRejects() {
        // Arrange
        stored(exception("exc-1", ExceptionStatus.DENIED, NOW.plus(Duration.ofDays(2))));

        // Act & Assert
        StepVerifier.create(repository.transition("exc-1", NOW,
                        current -> current.getStatus() == ExceptionStatus.PENDING,
                        current -> current.toBuilder().status(ExceptionStatus.APPROVED).build()))
                .assertNext(outcome -> {
                    assertThat(outcome.isApplied()).isFalse();
                    assertThat(outcome.getException().getStatus()).isEqualTo(ExceptionStatus.DENIED);
                })
                .verifyComplete();

        verify(transaction, never()).set(any(DocumentReference.class), anyMap());
        verify(transaction, never()).update(any(DocumentReference.class), anyString(), any());
    }

    @Test
    void transition_shouldPersistExpired_whenStaleApprovalFailsGuard() {
        // Arrange: approved, but the window ended an hour ago
        stored(exception("exc-1", ExceptionStatus.APPROVED, NOW.minus(Duration.ofHours(1))));

        // Act & Assert
        StepVerifier.create(repository.transition("exc-1", NOW,
                        current -> current.getStatus() == ExceptionStatus.APPROVED,
                        current -> current.toBuilder().status(ExceptionStatus.REVOKED).build()))
                .assertNext(outcome -> {
                    assertThat(outcome.isApplied()).isFalse();
                    assertThat(outcome.getException().getStatus()).isEqualTo(ExceptionStatus.EXPIRED);
                })
                .verifyComplete();

        verify(transaction).update(documentRef, "status", "EXPIRED");
        verify(transaction, never()).set(any(DocumentReference.class), anyMap());
    }

    @Test
    void transition_shouldFailWithNotFound_whenExceptionIsMissing() {
        when(snapshot.exists()).thenReturn(false);

        StepVerifier.create(repository.transition("missing", NOW, current -> true, current -> current))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }
}
