package com.techStack.geoAccess.service.policy;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.AuditEntryDraft;
import com.techStack.geoAccess.dto.internal.NotificationOutcome;
import com.techStack.geoAccess.dto.internal.RequestContext;
import com.techStack.geoAccess.dto.request.PolicyUpdateRequest;
import com.techStack.geoAccess.exception.service.PolicyUnavailableException;
import com.techStack.geoAccess.exception.state.ConflictException;
import com.techStack.geoAccess.exception.validation.ValidationException;
import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.audit.ChangeType;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.repository.PolicyRepository;
import com.techStack.geoAccess.service.audit.TamperEvidentAuditLog;
import com.techStack.geoAccess.service.notification.SecurityNotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

class PolicyStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-10T08:00:00Z");

    @Mock
    private PolicyRepository repository;

    @Mock
    private TamperEvidentAuditLog auditLog;

    @Mock
    private SecurityNotificationService notificationService;

    @Captor
    private ArgumentCaptor<SecurityPolicy> policyCaptor;

    @Captor
    private ArgumentCaptor<List<AuditEntry>> entriesCaptor;

    private PolicyStore policyStore;

    private final RequestContext context = RequestContext.builder()
            .ipAddress("192.0.2.10")
            .userAgent("JUnit")
            .path("/api/admin/security/policy")
            .build();

    private final SecurityPolicy stored = SecurityPolicy.builder()
            .id("active")
            .version(4)
            .primaryCountry("US")
            .enforcementEnabled(true)
            .adminEmail("admin@example.com")
            .itEmail("it@example.com")
            .securityEmail("security@example.com")
            .setupCompleted(true)
            .build();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        policyStore = new PolicyStore(repository, auditLog, new PolicyValidator(), notificationService,
                new GeoSecurityProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

        when(auditLog.seal(any())).thenAnswer(invocation -> {
            AuditEntryDraft draft = invocation.getArgument(0);
            return AuditEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .timestamp(NOW)
                    .changeType(draft.getChangeType())
                    .oldValue(draft.getOldValue())
                    .newValue(draft.getNewValue())
                    .justification(draft.getJustification())
                    .actor(draft.getActor())
                    .requestIp(draft.getRequestIp())
                    .userAgent(draft.getUserAgent())
                    .checksum("sealed")
                    .build();
        });
        when(auditLog.recordNotification(anyList(), any())).thenReturn(Mono.empty());
        when(repository.find()).thenReturn(Mono.just(stored));
        when(repository.commitUpdate(anyLong(), any(), anyList()))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(1)));
        when(notificationService.notifyPolicyChange(any(), anyList()))
                .thenReturn(Mono.just(NotificationOutcome.delivered(2)));
    }

    /* ===== Loading ===== */

    @Test
    void initialize_shouldCreateAuditedDefault_whenNoPolicyStored() {
        // Arrange
        when(repository.find()).thenReturn(Mono.empty());
        when(repository.createInitial(any(), any())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        // Act & Assert
        StepVerifier.create(policyStore.initialize())
                .assertNext(policy -> {
                    assertThat(policy.getPrimaryCountry()).isEqualTo("US");
                    assertThat(policy.isEnforcementEnabled()).isFalse();
                    assertThat(policy.getVersion()).isEqualTo(1);
                })
                .verifyComplete();

        ArgumentCaptor<AuditEntry> entry = ArgumentCaptor.forClass(AuditEntry.class);
        verify(repository).createInitial(any(), entry.capture());
        assertThat(entry.getValue().getChangeType()).isEqualTo(ChangeType.POLICY_INITIALIZED);
    }

    @Test
    void initialize_shouldLoadWinner_whenCreatedConcurrently() {
        // Arrange
        when(repository.find()).thenReturn(Mono.empty(), Mono.just(stored));
        when(repository.createInitial(any(), any())).thenReturn(Mono.error(new ConflictException("exists")));

        // Act & Assert
        StepVerifier.create(policyStore.initialize())
                .assertNext(policy -> assertThat(policy.getVersion()).isEqualTo(4))
                .verifyComplete();
    }

    @Test
    void get_shouldServeSnapshot_afterFirstLoad() {
        StepVerifier.create(policyStore.get()).expectNext(stored).verifyComplete();
        StepVerifier.create(policyStore.get()).expectNext(stored).verifyComplete();

        verify(repository, times(1)).find();
    }

    @Test
    void get_shouldFailWithPolicyUnavailable_whenStorageDown() {
        when(repository.find()).thenReturn(Mono.error(new IllegalStateException("firestore down")));

        StepVerifier.create(policyStore.get())
                .expectError(PolicyUnavailableException.class)
                .verify();
    }

    @Test
    void refresh_shouldNotMoveSnapshotBackwards() {
        SecurityPolicy older = stored.toBuilder().version(2).primaryCountry("GB").build();
        StepVerifier.create(policyStore.get()).expectNext(stored).verifyComplete();
        when(repository.find()).thenReturn(Mono.just(older));

        StepVerifier.create(policyStore.refresh()).expectNext(older).verifyComplete();

        StepVerifier.create(policyStore.get())
                .assertNext(policy -> assertThat(policy.getVersion()).isEqualTo(4))
                .verifyComplete();
    }

    /* ===== Updating ===== */

    @Test
    void update_shouldRejectSecondaryEqualToPrimary_andWriteNothing() {
        // Arrange
        PolicyUpdateRequest request = PolicyUpdateRequest.builder()
                .secondaryCountry("us")
                .justification("Satellite office")
                .build();

        // Act & Assert
        StepVerifier.create(policyStore.update(request, "admin", context))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ValidationException.class);
                    assertThat(((ValidationException) error).getFieldErrors()).containsKey("secondaryCountry");
                })
                .verify();

        verify(repository, never()).commitUpdate(anyLong(), any(), anyList());
        verify(auditLog, never()).seal(any());
        StepVerifier.create(policyStore.get())
                .assertNext(policy -> assertThat(policy.getSecondaryCountry()).isNull())
                .verifyComplete();
    }

    @Test
    void update_shouldRequireJustification_forCountryChange() {
        PolicyUpdateRequest request = PolicyUpdateRequest.builder().primaryCountry("CA").build();

        StepVerifier.create(policyStore.update(request, "admin", context))
                .expectErrorSatisfies(error -> assertThat(((ValidationException) error).getFieldErrors())
                        .containsKey("justification"))
                .verify();

        verify(repository, never()).commitUpdate(anyLong(), any(), anyList());
    }

    @Test
    void update_shouldRequireContacts_whenEnablingEnforcement() {
        when(repository.find()).thenReturn(Mono.just(stored.toBuilder()
                .enforcementEnabled(false).itEmail(null).build()));

        PolicyUpdateRequest request = PolicyUpdateRequest.builder().enforcementEnabled(true).build();

        StepVerifier.create(policyStore.update(request, "admin", context))
                .expectErrorSatisfies(error -> assertThat(((ValidationException) error).getFieldErrors())
                        .containsKey("itEmail"))
                .verify();
    }

    @Test
    void update_shouldCommitOneEntryPerChange_andNotifyLeadership() {
        // Arrange
        PolicyUpdateRequest request = PolicyUpdateRequest.builder()
                .primaryCountry("ca")
                .secondaryCountry("MX")
                .departmentName("Finance")
                .justification("Office relocation")
                .build();

        // Act & Assert
        StepVerifier.create(policyStore.update(request, "alice", context))
                .assertNext(result -> {
                    assertThat(result.isChanged()).isTrue();
                    assertThat(result.getWarnings()).isEmpty();
                    assertThat(result.getPolicy().getVersion()).isEqualTo(5);
                    assertThat(result.getPolicy().getAllowedCountries()).containsExactly("CA", "MX");
                    assertThat(result.getPolicy().getPreviousPrimaryCountry()).isEqualTo("US");
                    assertThat(result.getPolicy().getPrimaryCountryChangedBy()).isEqualTo("alice");
                    assertThat(result.getEntries())
                            .extracting(AuditEntry::getChangeType)
                            .containsExactly(ChangeType.PRIMARY_COUNTRY, ChangeType.SECONDARY_COUNTRY,
                                    ChangeType.DEPARTMENT_NAME);
                })
                .verifyComplete();

        verify(repository).commitUpdate(eq(4L), policyCaptor.capture(), entriesCaptor.capture());
        assertThat(entriesCaptor.getValue()).allSatisfy(entry -> {
            assertThat(entry.getActor()).isEqualTo("alice");
            assertThat(entry.getRequestIp()).isEqualTo("192.0.2.10");
            assertThat(entry.getJustification()).isEqualTo("Office relocation");
        });

        // department name is not a leadership-notice change
        verify(notificationService).notifyPolicyChange(any(), entriesCaptor.capture());
        assertThat(entriesCaptor.getValue())
                .extracting(AuditEntry::getChangeType)
                .containsExactly(ChangeType.PRIMARY_COUNTRY, ChangeType.SECONDARY_COUNTRY);
        verify(auditLog).recordNotification(anyList(), eq(NotificationOutcome.delivered(2)));

        StepVerifier.create(policyStore.get())
                .assertNext(policy -> assertThat(policy.getPrimaryCountry()).isEqualTo("CA"))
                .verifyComplete();
    }

    @Test
    void update_shouldMaskContactAddresses_inAuditEntries() {
        PolicyUpdateRequest request = PolicyUpdateRequest.builder().adminEmail("director@example.com").build();

        StepVerifier.create(policyStore.update(request, "alice", context))
                .assertNext(result -> {
                    AuditEntry entry = result.getEntries().get(0);
                    assertThat(entry.getChangeType()).isEqualTo(ChangeType.ADMIN_CONTACT);
                    assertThat(entry.getNewValue()).isNotEqualTo("director@example.com").contains("@example.com");
                })
                .verifyComplete();

        verify(notificationService, never()).notifyPolicyChange(any(), anyList());
    }

    @Test
    void update_shouldReturnUnchanged_whenNothingDiffers() {
        PolicyUpdateRequest request = PolicyUpdateRequest.builder().primaryCountry("US").build();

        StepVerifier.create(policyStore.update(request, "alice", context))
                .assertNext(result -> {
                    assertThat(result.isChanged()).isFalse();
                    assertThat(result.getEntries()).isEmpty();
                    assertThat(result.getPolicy()).isEqualTo(stored);
                })
                .verifyComplete();

        verify(repository, never()).commitUpdate(anyLong(), any(), anyList());
    }

    @Test
    void update_shouldKeepChange_andWarn_whenLeadershipNotificationFails() {
        // Arrange
        when(notificationService.notifyPolicyChange(any(), anyList()))
                .thenReturn(Mono.just(NotificationOutcome.failed(2, "SMTP timeout")));
        PolicyUpdateRequest request = PolicyUpdateRequest.builder().enforcementEnabled(false).build();

        // Act & Assert
        StepVerifier.create(policyStore.update(request, "alice", context))
                .assertNext(result -> {
                    assertThat(result.isChanged()).isTrue();
                    assertThat(result.getPolicy().isEnforcementEnabled()).isFalse();
                    assertThat(result.getWarnings()).containsExactly("Leadership notification failed: SMTP timeout");
                })
                .verifyComplete();

        verify(auditLog).recordNotification(anyList(), eq(NotificationOutcome.failed(2, "SMTP timeout")));
    }

    @Test
    void update_shouldPropagateConflict_whenVersionMovedConcurrently() {
        doReturn(Mono.error(new ConflictException("Security policy was modified concurrently")))
                .when(repository).commitUpdate(anyLong(), any(), anyList());
        PolicyUpdateRequest request = PolicyUpdateRequest.builder().departmentName("Ops").build();

        StepVerifier.create(policyStore.update(request, "alice", context))
                .expectError(ConflictException.class)
                .verify();

        verify(notificationService, never()).notifyPolicyChange(any(), anyList());
    }
}
