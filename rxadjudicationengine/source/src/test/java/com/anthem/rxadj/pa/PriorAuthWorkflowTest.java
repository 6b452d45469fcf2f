package com.anthem.rxadj.pa;

import com.anthem.rxadj.TestFixtures;
import com.anthem.rxadj.config.RxAdjudicationProperties;
import com.anthem.rxadj.criteria.ClinicalCriteriaEvaluator;
import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.exception.IllegalDeterminationException;
import com.anthem.rxadj.exception.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.anthem.rxadj.TestFixtures.LISINOPRIL;
import static com.anthem.rxadj.TestFixtures.SEMAGLUTIDE;
import static com.anthem.rxadj.TestFixtures.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriorAuthWorkflowTest {

    private RxAdjudicationProperties properties;
    private PriorAuthWorkflow workflow;

    @BeforeEach
    void setUp() {
        properties = new RxAdjudicationProperties();
        workflow = new PriorAuthWorkflow(
                new ClinicalCriteriaEvaluator(TestFixtures.defaultRepository(), TestFixtures.CLOCK),
                properties,
                TestFixtures.CLOCK);
    }

    @Test
    void testCreateRequest_pendingWithGeneratedId() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());

        assertThat(request.getPaRequestId()).matches("PA-20260315-\\d{6}");
        assertThat(request.getUrgency()).isEqualTo(Urgency.ROUTINE);
        assertThat(request.getRequestType()).isEqualTo(PriorAuthRequestType.INITIAL);

        var record = workflow.getRecord(request.getPaRequestId()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(PriorAuthStatus.PENDING);
        assertThat(record.getResponse()).isNull();
        assertThat(record.getStatusHistory()).singleElement()
                .satisfies(change -> assertThat(change.getNote()).isEqualTo("Request created"));
    }

    @Test
    void testCreateRequest_negativeQuantityRejected() {
        assertThatThrownBy(() -> workflow.createRequest(submission(SEMAGLUTIDE).quantityRequested(new BigDecimal("-1")).build()))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void testCheckAutoApproval_emergency() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).urgency(Urgency.EMERGENCY).build());

        var response = workflow.checkAutoApproval(request).orElseThrow();

        assertThat(response.getStatus()).isEqualTo(PriorAuthStatus.APPROVED);
        assertThat(response.isAutoApproved()).isTrue();
        assertThat(response.getReviewedBy()).isEqualTo("AUTO");
        assertThat(response.getExpirationDate()).isEqualTo(TODAY.plusDays(30));
        assertThat(response.getCriteriaResult()).isNull();
        assertThat(response.getAuthorizationNumber()).matches("AUTH\\d{9}");
    }

    @Test
    void testCheckAutoApproval_renewal() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).requestType(PriorAuthRequestType.RENEWAL).build());

        var response = workflow.checkAutoApproval(request).orElseThrow();

        assertThat(response.isAutoApproved()).isTrue();
        assertThat(response.getExpirationDate()).isEqualTo(TODAY.plusDays(365));
        assertThat(response.getRefillsApproved()).isEqualTo(12);
    }

    @Test
    void testCheckAutoApproval_routineNeedsReview() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).urgency(Urgency.URGENT).build());

        assertThat(workflow.checkAutoApproval(request)).isEmpty();
        assertThat(workflow.getRecord(request.getPaRequestId()).orElseThrow().getStatus())
                .isEqualTo(PriorAuthStatus.PENDING);
    }

    @Test
    void testApprove_defaultsFromRequestAndConfig() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());

        var response = workflow.approve(request);

        assertThat(response.getStatus()).isEqualTo(PriorAuthStatus.APPROVED);
        assertThat(response.getEffectiveDate()).isEqualTo(TODAY);
        assertThat(response.getQuantityApproved()).isEqualByComparingTo("4");
        assertThat(response.getDaysSupplyApproved()).isEqualTo(28);
        assertThat(response.isAutoApproved()).isFalse();
        assertThat(response.getSuggestedAlternatives()).isEmpty();
    }

    @Test
    void testPartialApprove() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());

        var response = workflow.partialApprove(request, new BigDecimal("2"), 14, null, "Starter dose", "RPH-7");

        assertThat(response.getStatus()).isEqualTo(PriorAuthStatus.PARTIAL);
        assertThat(response.getQuantityApproved()).isEqualByComparingTo("2");
        assertThat(response.getRefillsApproved()).isEqualTo(3);
        assertThat(response.getExpirationDate()).isEqualTo(TODAY.plusDays(90));
        assertThat(response.getDenialMessage()).isEqualTo("Starter dose");
    }

    @Test
    void testPartialApprove_aboveRequestedRejected() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());

        assertThatThrownBy(() -> workflow.partialApprove(request, new BigDecimal("8"), 28, null, null, "RPH-7"))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(workflow.getRecord(request.getPaRequestId()).orElseThrow().getStatus())
                .isEqualTo(PriorAuthStatus.PENDING);
    }

    @Test
    void testDeny_setsAppealDeadline() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());

        var response = workflow.deny(request, PriorAuthDenialReason.ALTERNATIVE_AVAILABLE, null, List.of("Trulicity"));

        assertThat(response.getStatus()).isEqualTo(PriorAuthStatus.DENIED);
        assertThat(response.getDenialMessage()).isEqualTo("Denied: Formulary alternative available");
        assertThat(response.getSuggestedAlternatives()).containsExactly("Trulicity");
        assertThat(response.getAppealDeadline()).isEqualTo(TODAY.plusDays(60));
        assertThat(response.getAppealInstructions()).isNotBlank();
    }

    @Test
    void testDeny_appealWindowConfigurable() {
        properties.getPriorAuth().setAppealWindowDays(180);
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());

        var response = workflow.deny(request, PriorAuthDenialReason.NOT_MEDICALLY_NECESSARY, "No indication", null);

        assertThat(response.getAppealDeadline()).isEqualTo(TODAY.plusDays(180));
        assertThat(response.getSuggestedAlternatives()).isEmpty();
    }

    @Test
    void testDetermination_isFinal() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());
        workflow.deny(request, PriorAuthDenialReason.CRITERIA_NOT_MET, null, null);

        assertThatThrownBy(() -> workflow.approve(request))
                .isInstanceOf(IllegalDeterminationException.class)
                .hasMessageContaining("already DENIED");

        var record = workflow.getRecord(request.getPaRequestId()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(PriorAuthStatus.DENIED);
        assertThat(record.getStatusHistory()).extracting(StatusChange::getStatus)
                .containsExactly(PriorAuthStatus.PENDING, PriorAuthStatus.DENIED);
    }

    @Test
    void testDetermination_unknownRequest() {
        var stranger = PriorAuthRequest.builder()
                .paRequestId("PA-20260101-000000")
                .drug(SEMAGLUTIDE)
                .quantityRequested(BigDecimal.ONE)
                .build();

        assertThatThrownBy(() -> workflow.approve(stranger)).isInstanceOf(IllegalDeterminationException.class);
    }

    @Test
    void testDetermination_racingReviewersOnlyOneSucceeds() throws Exception {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Callable<PriorAuthResponse> approve = () -> workflow.approve(request);
            Callable<PriorAuthResponse> deny = () -> workflow.deny(request, PriorAuthDenialReason.CRITERIA_NOT_MET, null, null);
            List<Future<PriorAuthResponse>> futures = executor.invokeAll(List.of(approve, deny));

            int succeeded = 0;
            for (Future<PriorAuthResponse> future : futures) {
                try {
                    future.get();
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(IllegalDeterminationException.class);
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testCheckExistingAuth() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());
        var approval = workflow.approve(request);

        assertThat(workflow.checkExistingAuth("MEM010", SEMAGLUTIDE)).contains(approval);
        assertThat(workflow.checkExistingAuth("MEM010", SEMAGLUTIDE, TODAY.plusDays(365))).contains(approval);
        assertThat(workflow.checkExistingAuth("MEM010", SEMAGLUTIDE, TODAY.plusDays(366))).isEmpty();
        assertThat(workflow.checkExistingAuth("MEM010", SEMAGLUTIDE, TODAY.minusDays(1))).isEmpty();
        assertThat(workflow.checkExistingAuth("MEM999", SEMAGLUTIDE)).isEmpty();
        assertThat(workflow.checkExistingAuth("MEM010", LISINOPRIL)).isEmpty();
    }

    @Test
    void testCheckExistingAuth_deniedRequestDoesNotCount() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());
        workflow.deny(request, PriorAuthDenialReason.CRITERIA_NOT_MET, null, null);

        assertThat(workflow.checkExistingAuth("MEM010", SEMAGLUTIDE)).isEmpty();
    }

    @Test
    void testFindAuthorization_matchesNumberMemberAndDrug() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());
        var approval = workflow.approve(request);
        String number = approval.getAuthorizationNumber();

        assertThat(workflow.findAuthorization(number, "MEM010", SEMAGLUTIDE, TODAY)).contains(approval);
        assertThat(workflow.findAuthorization(" " + number + " ", "MEM010", SEMAGLUTIDE, TODAY)).contains(approval);
        assertThat(workflow.findAuthorization("AUTH000000000", "MEM010", SEMAGLUTIDE, TODAY)).isEmpty();
        assertThat(workflow.findAuthorization(number, "MEM999", SEMAGLUTIDE, TODAY)).isEmpty();
        assertThat(workflow.findAuthorization(number, "MEM010", LISINOPRIL, TODAY)).isEmpty();
        assertThat(workflow.findAuthorization(number, "MEM010", SEMAGLUTIDE, TODAY.plusDays(366))).isEmpty();
        assertThat(workflow.findAuthorization("", "MEM010", SEMAGLUTIDE, TODAY)).isEmpty();
    }

    @Test
    void testFindAuthorization_partialApprovalNumberNotAccepted() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());
        var partial = workflow.partialApprove(request, new BigDecimal("2"), 28, null, null, "RPH-2");

        assertThat(workflow.findAuthorization(partial.getAuthorizationNumber(), "MEM010", SEMAGLUTIDE, TODAY))
                .isEmpty();
    }

    @Test
    void testReviewAgainstCriteria_metApproves() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE)
                .diagnosisCode("E11.9")
                .previousTherapy("metformin")
                .labResult("HbA1c", new BigDecimal("8.5"))
                .build());

        var response = workflow.reviewAgainstCriteria(request);

        assertThat(response.getStatus()).isEqualTo(PriorAuthStatus.APPROVED);
        assertThat(response.getReviewedBy()).isEqualTo("CRITERIA");
        assertThat(response.getCriteriaResult().isMet()).isTrue();
    }

    @Test
    void testReviewAgainstCriteria_unmetDenies() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE)
                .diagnosisCode("E11.9")
                .labResult("HbA1c", new BigDecimal("8.5"))
                .build());

        var response = workflow.reviewAgainstCriteria(request);

        assertThat(response.getStatus()).isEqualTo(PriorAuthStatus.DENIED);
        assertThat(response.getDenialReason()).isEqualTo(PriorAuthDenialReason.CRITERIA_NOT_MET);
        assertThat(response.getDenialMessage()).isEqualTo("Criteria not met: Previous trial of metformin");
        assertThat(response.getAppealDeadline()).isEqualTo(TODAY.plusDays(60));
    }

    @Test
    void testReviewAgainstCriteria_noCriteriaSetStaysPending() {
        var request = workflow.createRequest(submission(LISINOPRIL).build());

        var response = workflow.reviewAgainstCriteria(request);

        assertThat(response.getStatus()).isEqualTo(PriorAuthStatus.PENDING);
        assertThat(workflow.getRecord(request.getPaRequestId()).orElseThrow().getStatus())
                .isEqualTo(PriorAuthStatus.PENDING);
        // still open for a manual determination
        assertThat(workflow.approve(request).getStatus()).isEqualTo(PriorAuthStatus.APPROVED);
    }

    @Test
    void testPurgeExpired_evictsOnlyLapsedDeterminations() {
        var approved = workflow.createRequest(submission(SEMAGLUTIDE).build());
        workflow.approve(approved, ApprovalTerms.builder().durationDays(30).build());
        var denied = workflow.createRequest(submission(SEMAGLUTIDE).build());
        workflow.deny(denied, PriorAuthDenialReason.CRITERIA_NOT_MET, null, null);
        var pending = workflow.createRequest(submission(LISINOPRIL).build());

        assertThat(workflow.purgeExpired(TODAY.plusDays(30))).isZero();

        assertThat(workflow.purgeExpired(TODAY.plusDays(31))).isEqualTo(1);
        assertThat(workflow.getRecord(approved.getPaRequestId())).isEmpty();
        assertThat(workflow.getRecord(denied.getPaRequestId())).isPresent();

        assertThat(workflow.purgeExpired(TODAY.plusDays(61))).isEqualTo(1);
        assertThat(workflow.getRecord(denied.getPaRequestId())).isEmpty();

        assertThat(workflow.purgeExpired(TODAY.plusYears(5))).isZero();
        assertThat(workflow.getRecord(pending.getPaRequestId())).isPresent();
    }

    @Test
    void testPurgeExpired_activeAuthorizationStillFound() {
        var request = workflow.createRequest(submission(SEMAGLUTIDE).build());
        var response = workflow.approve(request);

        workflow.purgeExpired(TODAY.plusDays(100));

        assertThat(workflow.checkExistingAuth("MEM010", SEMAGLUTIDE, TODAY.plusDays(100))).contains(response);
    }

    @Test
    void testGetRecord_unknown() {
        assertThat(workflow.getRecord("PA-NOPE")).isEmpty();
    }

    private static PriorAuthSubmission.PriorAuthSubmissionBuilder submission(DrugIdentifier drug) {
        return PriorAuthSubmission.builder()
                .memberId("MEM010")
                .cardholderId("CH010")
                .drug(drug)
                .quantityRequested(new BigDecimal("4"))
                .daysSupplyRequested(28)
                .prescriberNpi("1234567893")
                .prescriberName("Dr. Rivera");
    }
}
