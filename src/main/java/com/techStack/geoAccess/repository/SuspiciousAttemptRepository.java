package com.techStack.geoAccess.repository;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.WriteBatch;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.exception.data.ResourceNotFoundException;
import com.techStack.geoAccess.exception.state.ConflictException;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.util.firebase.AccessDocumentMapper;
import com.techStack.geoAccess.util.firebase.FirestoreFields;
import com.techStack.geoAccess.util.firebase.FirestoreUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Firestore storage of suspicious access attempts. Attempts are never deleted; only the
 * escalation and resolution fields are written after creation.
 */
@Repository
public class SuspiciousAttemptRepository {

    private static final Logger logger = LoggerFactory.getLogger(SuspiciousAttemptRepository.class);

    private final Firestore firestore;

    public SuspiciousAttemptRepository(Firestore firestore) {
        this.firestore = firestore;
    }

    public Mono<SuspiciousAccessAttempt> save(SuspiciousAccessAttempt attempt) {
        DocumentReference ref = collection().document(attempt.getId());
        Map<String, Object> data = AccessDocumentMapper.toMap(attempt);

        // deferred so every retry issues a fresh create()
        return Mono.defer(() -> FirestoreUtils.apiFutureToMono(ref.create(data)))
                .thenReturn(attempt)
                .retryWhen(Retry.backoff(2, Duration.ofMillis(100))
                        .filter(e -> !FirestoreUtils.isAlreadyExists(e)))
                .doOnError(e -> logger.error("❌ Failed to record attempt {} for user {}: {}",
                        attempt.getId(), attempt.getUserId(), e.getMessage()));
    }

    public Mono<SuspiciousAccessAttempt> findById(String attemptId) {
        return FirestoreUtils.apiFutureToMono(collection().document(attemptId).get())
                .filter(DocumentSnapshot::exists)
                .map(snapshot -> AccessDocumentMapper.attemptFromMap(snapshot.getData()));
    }

    public Flux<SuspiciousAccessAttempt> findByUserSince(String userId, Instant since) {
        return query(collection()
                .whereEqualTo("userId", userId)
                .whereGreaterThanOrEqualTo("timestamp", FirestoreFields.toTimestamp(since))
                .orderBy("timestamp", Query.Direction.ASCENDING));
    }

    public Flux<SuspiciousAccessAttempt> findRecent(boolean unresolvedOnly, int limit) {
        Query query = collection();
        if (unresolvedOnly) {
            query = query.whereEqualTo("resolved", false);
        }
        return query(query.orderBy("timestamp", Query.Direction.DESCENDING).limit(limit));
    }

    /**
     * Claims attempts for one escalation. Only attempts that are not yet notified and not held by
     * another live claim are taken; a claim older than {@code staleBefore} is taken over. Emits the
     * ids this call actually claimed.
     */
    public Mono<Set<String>> claimForEscalation(Collection<String> attemptIds, Instant claimedAt, Instant staleBefore) {
        if (attemptIds.isEmpty()) {
            return Mono.just(Set.of());
        }
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(attemptIds));

        return FirestoreUtils.apiFutureToMono(firestore.runTransaction(tx -> {
                    Map<String, DocumentReference> claimable = new LinkedHashMap<>();
                    for (String attemptId : ids) {
                        DocumentReference ref = collection().document(attemptId);
                        DocumentSnapshot snapshot = tx.get(ref).get();
                        if (snapshot.exists() && isClaimable(snapshot.getData(), staleBefore)) {
                            claimable.put(attemptId, ref);
                        }
                    }

                    // all reads happen before the first write
                    claimable.values().forEach(ref ->
                            tx.update(ref, "escalationClaimedAt", FirestoreFields.toTimestamp(claimedAt)));
                    Set<String> claimed = new LinkedHashSet<>(claimable.keySet());
                    return claimed;
                }))
                .onErrorMap(FirestoreUtils::unwrap)
                .doOnNext(claimed -> {
                    if (claimed.size() < ids.size()) {
                        logger.info("Claimed {} of {} attempt(s) for escalation; the rest are already covered",
                                claimed.size(), ids.size());
                    }
                });
    }

    /**
     * Returns claimed attempts to the pool after an undelivered escalation.
     */
    public Mono<Void> releaseClaim(Collection<String> attemptIds) {
        if (attemptIds.isEmpty()) {
            return Mono.empty();
        }
        WriteBatch batch = firestore.batch();
        for (String attemptId : attemptIds) {
            batch.update(collection().document(attemptId), "escalationClaimedAt", FieldValue.delete());
        }
        return FirestoreUtils.apiFutureToMono(batch.commit()).then();
    }

    /**
     * Flags the given attempts as escalated to IT/security and drops their claim.
     */
    public Mono<Void> markNotified(Collection<String> attemptIds, Instant notifiedAt, Collection<String> reasons) {
        if (attemptIds.isEmpty()) {
            return Mono.empty();
        }
        WriteBatch batch = firestore.batch();
        for (String attemptId : attemptIds) {
            Map<String, Object> fields = new HashMap<>();
            fields.put("itNotified", true);
            fields.put("itNotifiedAt", FirestoreFields.toTimestamp(notifiedAt));
            fields.put("escalationReasons", FieldValue.arrayUnion(reasons.toArray()));
            fields.put("escalationClaimedAt", FieldValue.delete());
            batch.update(collection().document(attemptId), fields);
        }
        return FirestoreUtils.apiFutureToMono(batch.commit())
                .doOnSuccess(result -> logger.info("Marked {} attempt(s) as IT-notified", attemptIds.size()))
                .then();
    }

    /**
     * Records a reviewer's resolution. An attempt is resolved once; a second resolution fails
     * with {@link ConflictException}.
     */
    public Mono<SuspiciousAccessAttempt> resolve(String attemptId, String resolvedBy, String notes, Instant resolvedAt) {
        DocumentReference ref = collection().document(attemptId);

        return FirestoreUtils.apiFutureToMono(firestore.runTransaction(tx -> {
                    DocumentSnapshot snapshot = tx.get(ref).get();
                    if (!snapshot.exists()) {
                        throw new ResourceNotFoundException("Suspicious attempt", attemptId);
                    }
                    SuspiciousAccessAttempt attempt = AccessDocumentMapper.attemptFromMap(snapshot.getData());
                    if (attempt.isResolved()) {
                        throw new ConflictException("Attempt " + attemptId + " was already resolved by "
                                + attempt.getResolvedBy());
                    }

                    SuspiciousAccessAttempt resolved = attempt.toBuilder()
                            .resolved(true)
                            .resolvedBy(resolvedBy)
                            .resolvedAt(resolvedAt)
                            .resolutionNotes(notes)
                            .build();

                    Map<String, Object> fields = new HashMap<>();
                    fields.put("resolved", true);
                    fields.put("resolvedBy", resolvedBy);
                    fields.put("resolvedAt", FirestoreFields.toTimestamp(resolvedAt));
                    fields.put("resolutionNotes", notes);
                    tx.update(ref, fields);
                    return resolved;
                }))
                .onErrorMap(FirestoreUtils::unwrap);
    }

    public Mono<Long> countBlockedSince(Instant since) {
        return FirestoreUtils.apiFutureToMono(collection()
                        .whereEqualTo("wasBlocked", true)
                        .whereGreaterThanOrEqualTo("timestamp", FirestoreFields.toTimestamp(since))
                        .count()
                        .get())
                .map(snapshot -> snapshot.getCount());
    }

    public Mono<Long> countUnresolved() {
        return FirestoreUtils.apiFutureToMono(collection()
                        .whereEqualTo("resolved", false)
                        .count()
                        .get())
                .map(snapshot -> snapshot.getCount());
    }

    private Flux<SuspiciousAccessAttempt> query(Query query) {
        return FirestoreUtils.apiFutureToMono(query.get())
                .flatMapIterable(QuerySnapshot::getDocuments)
                .map(QueryDocumentSnapshot::getData)
                .map(AccessDocumentMapper::attemptFromMap);
    }

    private static boolean isClaimable(Map<String, Object> data, Instant staleBefore) {
        if (data == null || FirestoreFields.getBoolean(data, "itNotified")) {
            return false;
        }
        Instant claimedAt = FirestoreFields.getInstant(data, "escalationClaimedAt");
        return claimedAt == null || claimedAt.isBefore(staleBefore);
    }

    private CollectionReference collection() {
        return firestore.collection(GeoSecurityConstants.COLLECTION_SUSPICIOUS_ATTEMPTS);
    }
}
