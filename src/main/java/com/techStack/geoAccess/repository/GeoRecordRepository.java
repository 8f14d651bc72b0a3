package com.techStack.geoAccess.repository;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.GeoLookupResult;
import com.techStack.geoAccess.models.geo.GeoRecord;
import com.techStack.geoAccess.util.firebase.FirestoreUtils;
import com.techStack.geoAccess.util.firebase.GeoDocumentMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Objects;

/**
 * Firestore store of resolved IP addresses, one document per address.
 */
@Repository
public class GeoRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(GeoRecordRepository.class);

    private final Firestore firestore;

    public GeoRecordRepository(Firestore firestore) {
        this.firestore = firestore;
    }

    /**
     * Creates the record on first sighting, otherwise refreshes the geo fields, bumps
     * {@code accessCount} and {@code lastSeen}. Runs in a transaction so concurrent resolutions
     * of the same address do not lose increments.
     */
    public Mono<GeoRecord> upsert(String ipAddress, GeoLookupResult result, Instant seenAt) {
        DocumentReference ref = collection().document(ipAddress);

        return FirestoreUtils.apiFutureToMono(firestore.runTransaction(tx -> {
                    DocumentSnapshot snapshot = tx.get(ref).get();
                    GeoRecord fresh = GeoRecord.fromLookup(ipAddress, result, seenAt);

                    if (snapshot.exists()) {
                        GeoRecord existing = GeoDocumentMapper.fromMap(snapshot.getData());
                        GeoRecord updated = fresh.toBuilder()
                                .firstSeen(existing != null && existing.getFirstSeen() != null
                                        ? existing.getFirstSeen() : seenAt)
                                .accessCount((existing != null ? existing.getAccessCount() : 0) + 1)
                                .build();
                        tx.set(ref, GeoDocumentMapper.toMap(updated));
                        return updated;
                    }

                    GeoRecord created = fresh.toBuilder().accessCount(1).build();
                    tx.create(ref, GeoDocumentMapper.toMap(created));
                    return created;
                }))
                .doOnError(e -> logger.error("❌ Geo record upsert failed for {}: {}", ipAddress, e.getMessage()));
    }

    public Flux<GeoRecord> findRecent(int limit) {
        return FirestoreUtils.apiFutureToMono(collection()
                        .orderBy("lastSeen", Query.Direction.DESCENDING)
                        .limit(limit)
                        .get())
                .flatMapIterable(snapshot -> snapshot.getDocuments())
                .map(QueryDocumentSnapshot::getData)
                .map(GeoDocumentMapper::fromMap);
    }

    /**
     * Operator purge. Emits whether a record existed.
     */
    public Mono<Boolean> delete(String ipAddress) {
        DocumentReference ref = collection().document(ipAddress);
        return FirestoreUtils.apiFutureToMono(ref.get())
                .flatMap(snapshot -> {
                    if (!snapshot.exists()) {
                        return Mono.just(false);
                    }
                    return FirestoreUtils.apiFutureToMono(ref.delete()).thenReturn(true);
                })
                .doOnNext(deleted -> {
                    if (deleted) {
                        logger.info("🗑️ Geo record purged for {}", ipAddress);
                    }
                });
    }

    public Mono<Long> count() {
        return FirestoreUtils.apiFutureToMono(collection().count().get())
                .map(snapshot -> snapshot.getCount());
    }

    public Mono<Long> countDistinctCountries() {
        return FirestoreUtils.apiFutureToMono(collection().select("countryCode").get())
                .map(snapshot -> snapshot.getDocuments().stream()
                        .map(doc -> doc.getString("countryCode"))
                        .filter(Objects::nonNull)
                        .distinct()
                        .count());
    }

    private CollectionReference collection() {
        return firestore.collection(GeoSecurityConstants.COLLECTION_GEO_RECORDS);
    }
}
