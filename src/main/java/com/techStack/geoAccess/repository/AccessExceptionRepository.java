package com.techStack.geoAccess.repository;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.TransitionOutcome;
import com.techStack.geoAccess.exception.data.ResourceNotFoundException;
import com.techStack.geoAccess.exception.state.ConflictException;
import com.techStack.geoAccess.models.access.AccessException;
import com.techStack.geoAccess.models.access.ExceptionStatus;
import com.techStack.geoAccess.util.firebase.AccessDocumentMapper;
import com.techStack.geoAccess.util.firebase.FirestoreUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Firestore storage of international access exceptions.
 *
 * <p>All state changes go through {@link #transition}, a transactional compare-and-swap: the guard
 * sees the stored state and the write only happens if the state still satisfies it.
 */
@Repository
public class AccessExceptionRepository {

    private static final Logger logger = LoggerFactory.getLogger(AccessExceptionRepository.class);

    private final Firestore firestore;

    public AccessExceptionRepository(Firestore firestore) {
        this.firestore = firestore;
    }

    /**
     * Creates a new exception unless the same user already holds a pending or live approved
     * exception for the same destination.
     */
    public Mono<AccessException> createIfNoneOpen(AccessException exception, Instant now) {
        Query sameDestination = collection()
                .whereEqualTo("userId", exception.getUserId())
                .whereEqualTo("destinationCountry", exception.getDestinationCountry());
        DocumentReference ref = collection().document(exception.getId());

        return FirestoreUtils.apiFutureToMono(firestore.runTransaction(tx -> {
                    QuerySnapshot existing = tx.get(sameDestination).get();
                    for (QueryDocumentSnapshot doc : existing.getDocuments()) {
                        AccessException other = AccessDocumentMapper.exceptionFromMap(doc.getData());
                        if (other != null && other.blocksNewRequestAt(now)) {
                            throw new ConflictException("An open exception " + other.getId()
                                    + " already exists for " + exception.getDestinationCountry());
                        }
                    }
                    tx.create(ref, AccessDocumentMapper.toMap(exception));
                    return exception;
                }))
                .onErrorMap(FirestoreUtils::unwrap);
    }

    /**
     * Applies {@code change} if {@code guard} accepts the stored exception. A stale APPROVED
     * exception is presented to the guard as EXPIRED, and that status is written even when the
     * guard rejects it.
     */
    public Mono<TransitionOutcome> transition(String exceptionId,
                                              Instant now,
                                              Predicate<AccessException> guard,
                                              UnaryOperator<AccessException> change) {
        DocumentReference ref = collection().document(exceptionId);

        return FirestoreUtils.apiFutureToMono(firestore.runTransaction(tx -> {
                    DocumentSnapshot snapshot = tx.get(ref).get();
                    if (!snapshot.exists()) {
                        throw new ResourceNotFoundException("Access exception", exceptionId);
                    }

                    AccessException current = AccessDocumentMapper.exceptionFromMap(snapshot.getData());
                    boolean expiredOnRead = current.isStaleApproval(now);
                    if (expiredOnRead) {
                        current = current.toBuilder().status(ExceptionStatus.EXPIRED).build();
                    }

                    if (guard.test(current)) {
                        AccessException updated = change.apply(current);
                        tx.set(ref, AccessDocumentMapper.toMap(updated));
                        return new TransitionOutcome(updated, true);
                    }

                    if (expiredOnRead) {
                        tx.update(ref, "status", ExceptionStatus.EXPIRED.name());
                    }
                    return new TransitionOutcome(current, false);
                }))
                .onErrorMap(FirestoreUtils::unwrap)
                .doOnError(e -> logger.warn("Transition of exception {} failed: {}", exceptionId, e.getMessage()));
    }

    public Mono<AccessException> findById(String exceptionId) {
        return FirestoreUtils.apiFutureToMono(collection().document(exceptionId).get())
                .filter(DocumentSnapshot::exists)
                .map(snapshot -> AccessDocumentMapper.exceptionFromMap(snapshot.getData()));
    }

    public Flux<AccessException> findByUserAndCountry(String userId, String countryCode) {
        return query(collection()
                .whereEqualTo("userId", userId)
                .whereEqualTo("destinationCountry", countryCode));
    }

    public Flux<AccessException> findByUser(String userId) {
        return query(collection().whereEqualTo("userId", userId));
    }

    public Flux<AccessException> findRecent(ExceptionStatus status, int limit) {
        Query query = collection();
        if (status != null) {
            query = query.whereEqualTo("status", status.name());
        }
        return query(query.orderBy("requestedAt", Query.Direction.DESCENDING).limit(limit));
    }

    public Flux<AccessException> findByStatus(ExceptionStatus status) {
        return query(collection().whereEqualTo("status", status.name()));
    }

    public Mono<Long> countByStatus(ExceptionStatus status) {
        return FirestoreUtils.apiFutureToMono(collection()
                        .whereEqualTo("status", status.name())
                        .count()
                        .get())
                .map(snapshot -> snapshot.getCount());
    }

    private Flux<AccessException> query(Query query) {
        return FirestoreUtils.apiFutureToMono(query.get())
                .flatMapIterable(QuerySnapshot::getDocuments)
                .map(QueryDocumentSnapshot::getData)
                .map(AccessDocumentMapper::exceptionFromMap);
    }

    private CollectionReference collection() {
        return firestore.collection(GeoSecurityConstants.COLLECTION_ACCESS_EXCEPTIONS);
    }
}
