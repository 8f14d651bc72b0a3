package com.techStack.geoAccess.repository;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.exception.state.ConflictException;
import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.audit.ChangeType;
import com.techStack.geoAccess.models.audit.NotificationReceipt;
import com.techStack.geoAccess.models.audit.TamperNote;
import com.techStack.geoAccess.util.firebase.AuditDocumentMapper;
import com.techStack.geoAccess.util.firebase.FirestoreUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Write-once storage of the audit ledger, its notification receipts and tamper notes.
 *
 * <p>Every write uses {@code create()}, which fails if the document exists. This class has no
 * update or delete operation for any of its collections.
 */
@Repository
public class AuditLedgerRepository {

    private static final Logger logger = LoggerFactory.getLogger(AuditLedgerRepository.class);
    private static final int PAGE_SIZE = 500;

    private final Firestore firestore;

    public AuditLedgerRepository(Firestore firestore) {
        this.firestore = firestore;
    }

    /* ===== Ledger ===== */

    public Mono<AuditEntry> create(AuditEntry entry) {
        return FirestoreUtils.apiFutureToMono(ledger().document(entry.getId())
                        .create(AuditDocumentMapper.toMap(entry)))
                .thenReturn(entry)
                .onErrorMap(FirestoreUtils::isAlreadyExists,
                        e -> new ConflictException("Audit entry already exists: " + entry.getId(), e));
    }

    public Mono<AuditEntry> findById(String entryId) {
        return FirestoreUtils.apiFutureToMono(ledger().document(entryId).get())
                .filter(DocumentSnapshot::exists)
                .map(snapshot -> AuditDocumentMapper.fromMap(snapshot.getData()));
    }

    /**
     * Newest first, optionally restricted to one change type.
     */
    public Flux<AuditEntry> findRecent(ChangeType changeType, int limit) {
        Query query = ledger();
        if (changeType != null) {
            query = query.whereEqualTo("changeType", changeType.name());
        }
        return FirestoreUtils.apiFutureToMono(query
                        .orderBy("timestamp", Query.Direction.DESCENDING)
                        .limit(limit)
                        .get())
                .flatMapIterable(QuerySnapshot::getDocuments)
                .map(QueryDocumentSnapshot::getData)
                .map(AuditDocumentMapper::fromMap);
    }

    /**
     * Whole ledger, oldest first, read page by page.
     */
    public Flux<AuditEntry> streamAll() {
        return fetchPage(null)
                .expand(page -> page.size() < PAGE_SIZE
                        ? Mono.empty()
                        : fetchPage(page.getDocuments().get(page.size() - 1)))
                .flatMapIterable(QuerySnapshot::getDocuments)
                .map(QueryDocumentSnapshot::getData)
                .map(AuditDocumentMapper::fromMap);
    }

    private Mono<QuerySnapshot> fetchPage(DocumentSnapshot after) {
        Query query = ledger()
                .orderBy("timestamp", Query.Direction.ASCENDING)
                .orderBy("id", Query.Direction.ASCENDING)
                .limit(PAGE_SIZE);
        if (after != null) {
            query = query.startAfter(after);
        }
        return FirestoreUtils.apiFutureToMono(query.get());
    }

    /* ===== Notification receipts ===== */

    public Mono<NotificationReceipt> createReceipt(NotificationReceipt receipt) {
        return FirestoreUtils.apiFutureToMono(receipts().document(receipt.getEntryId())
                        .create(AuditDocumentMapper.toMap(receipt)))
                .thenReturn(receipt)
                .onErrorMap(FirestoreUtils::isAlreadyExists,
                        e -> new ConflictException("Receipt already recorded for entry " + receipt.getEntryId(), e));
    }

    /**
     * Receipts keyed by entry id; entries without a receipt are absent from the map.
     */
    public Mono<Map<String, NotificationReceipt>> findReceipts(Collection<String> entryIds) {
        if (entryIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        DocumentReference[] refs = entryIds.stream()
                .map(id -> receipts().document(id))
                .toArray(DocumentReference[]::new);

        return FirestoreUtils.apiFutureToMono(firestore.getAll(refs))
                .map(snapshots -> {
                    Map<String, NotificationReceipt> byEntry = new HashMap<>();
                    for (DocumentSnapshot snapshot : snapshots) {
                        if (snapshot.exists()) {
                            byEntry.put(snapshot.getId(), AuditDocumentMapper.receiptFromMap(snapshot.getData()));
                        }
                    }
                    return byEntry;
                });
    }

    /* ===== Tamper notes ===== */

    public Mono<TamperNote> saveTamperNote(TamperNote note) {
        return FirestoreUtils.apiFutureToMono(tamperNotes().document(note.getId())
                        .create(AuditDocumentMapper.toMap(note)))
                .thenReturn(note)
                .doOnError(e -> logger.error("❌ Failed to store tamper note for entry {}: {}",
                        note.getEntryId(), e.getMessage()));
    }

    private CollectionReference ledger() {
        return firestore.collection(GeoSecurityConstants.COLLECTION_AUDIT_LEDGER);
    }

    private CollectionReference receipts() {
        return firestore.collection(GeoSecurityConstants.COLLECTION_AUDIT_RECEIPTS);
    }

    private CollectionReference tamperNotes() {
        return firestore.collection(GeoSecurityConstants.COLLECTION_TAMPER_NOTES);
    }
}
