package com.techStack.geoAccess.repository;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.exception.state.ConflictException;
import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.util.firebase.AuditDocumentMapper;
import com.techStack.geoAccess.util.firebase.FirestoreUtils;
import com.techStack.geoAccess.util.firebase.PolicyDocumentMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Storage of the singleton security policy.
 *
 * <p>The policy lives in one fixed document. It is first written with {@code create()}, which the
 * database rejects if the document exists, so a second instance can never be created. Every later
 * write happens in a transaction that also creates the audit entries describing it.
 */
@Repository
public class PolicyRepository {

    private static final Logger logger = LoggerFactory.getLogger(PolicyRepository.class);

    private final Firestore firestore;

    public PolicyRepository(Firestore firestore) {
        this.firestore = firestore;
    }

    public Mono<SecurityPolicy> find() {
        return FirestoreUtils.apiFutureToMono(policyRef().get())
                .filter(DocumentSnapshot::exists)
                .map(snapshot -> PolicyDocumentMapper.fromMap(snapshot.getData()));
    }

    /**
     * Writes the first policy together with its initialisation entry.
     * Fails with {@link ConflictException} when a policy already exists.
     */
    public Mono<SecurityPolicy> createInitial(SecurityPolicy policy, AuditEntry initEntry) {
        DocumentReference policyRef = policyRef();
        DocumentReference entryRef = ledgerRef(initEntry.getId());

        return FirestoreUtils.apiFutureToMono(firestore.runTransaction(tx -> {
                    tx.create(policyRef, PolicyDocumentMapper.toMap(policy));
                    tx.create(entryRef, AuditDocumentMapper.toMap(initEntry));
                    return policy;
                }))
                .onErrorMap(FirestoreUtils::isAlreadyExists,
                        e -> new ConflictException("Security policy already exists", e))
                .doOnSuccess(created -> logger.info("✅ Security policy created (version {})", created.getVersion()));
    }

    /**
     * Replaces the policy and creates its audit entries atomically. Fails with
     * {@link ConflictException} when the stored version is not {@code expectedVersion}.
     */
    public Mono<SecurityPolicy> commitUpdate(long expectedVersion, SecurityPolicy policy, List<AuditEntry> entries) {
        DocumentReference policyRef = policyRef();

        return FirestoreUtils.apiFutureToMono(firestore.runTransaction(tx -> {
                    DocumentSnapshot current = tx.get(policyRef).get();
                    if (!current.exists()) {
                        throw new ConflictException("Security policy has not been initialized");
                    }
                    Long storedVersion = current.getLong("version");
                    if (storedVersion == null || storedVersion != expectedVersion) {
                        throw new ConflictException("Security policy was modified concurrently (expected version "
                                + expectedVersion + ", found " + storedVersion + ")");
                    }

                    tx.set(policyRef, PolicyDocumentMapper.toMap(policy));
                    for (AuditEntry entry : entries) {
                        tx.create(ledgerRef(entry.getId()), AuditDocumentMapper.toMap(entry));
                    }
                    return policy;
                }))
                .onErrorMap(FirestoreUtils::unwrap)
                .doOnError(e -> logger.error("❌ Policy update to version {} failed: {}",
                        policy.getVersion(), e.getMessage()));
    }

    private DocumentReference policyRef() {
        return firestore.collection(GeoSecurityConstants.COLLECTION_SECURITY_POLICY)
                .document(GeoSecurityConstants.ACTIVE_POLICY_DOC_ID);
    }

    private DocumentReference ledgerRef(String entryId) {
        return firestore.collection(GeoSecurityConstants.COLLECTION_AUDIT_LEDGER).document(entryId);
    }
}
