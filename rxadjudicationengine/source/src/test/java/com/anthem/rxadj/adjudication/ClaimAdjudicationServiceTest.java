package com.anthem.rxadj.adjudication;

import com.anthem.rxadj.TestFixtures;
import com.anthem.rxadj.config.RxAdjudicationProperties;
import com.anthem.rxadj.criteria.ClinicalCriteriaEvaluator;
import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.dur.DurAlertFormatter;
import com.anthem.rxadj.dur.DurAlertType;
import com.anthem.rxadj.dur.DurOverride;
import com.anthem.rxadj.dur.DurOverrideManager;
import com.anthem.rxadj.dur.DurRulesEngine;
import com.anthem.rxadj.dur.DurValidator;
import com.anthem.rxadj.dur.checks.AgeRestrictionCheck;
import com.anthem.rxadj.dur.checks.DrugInteractionCheck;
import com.anthem.rxadj.dur.checks.EarlyRefillCheck;
import com.anthem.rxadj.dur.checks.GenderRestrictionCheck;
import com.anthem.rxadj.dur.checks.TherapeuticDuplicationCheck;
import com.anthem.rxadj.history.ClaimHistoryAccumulator;
import com.anthem.rxadj.history.ClaimHistoryEntry;
import com.anthem.rxadj.limits.QuantityLimitEngine;
import com.anthem.rxadj.model.Gender;
import com.anthem.rxadj.model.MemberClinicalContext;
import com.anthem.rxadj.model.PharmacyClaim;
import com.anthem.rxadj.pa.PriorAuthResponse;
import com.anthem.rxadj.pa.PriorAuthStatus;
import com.anthem.rxadj.pa.PriorAuthWorkflow;
import com.anthem.rxadj.rules.RuleTablesRepository;
import com.anthem.rxadj.steptherapy.StepTherapyEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static com.anthem.rxadj.TestFixtures.ESOMEPRAZOLE;
import static com.anthem.rxadj.TestFixtures.IBUPROFEN;
import static com.anthem.rxadj.TestFixtures.LISINOPRIL;
import static com.anthem.rxadj.TestFixtures.OMEPRAZOLE;
import static com.anthem.rxadj.TestFixtures.SEMAGLUTIDE;
import static com.anthem.rxadj.TestFixtures.TODAY;
import static com.anthem.rxadj.TestFixtures.WARFARIN;
import static com.anthem.rxadj.TestFixtures.currentMedication;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Adjudication over the default rule tables with the prior authorization registry mocked.
 */
@ExtendWith(MockitoExtension.class)
class ClaimAdjudicationServiceTest {

    @Mock(lenient = true)
    private PriorAuthWorkflow priorAuthWorkflow;

    private ClaimAdjudicationService service;

    private final MemberClinicalContext onWarfarin = MemberClinicalContext.builder()
            .memberId("MEM001")
            .age(67)
            .gender(Gender.F)
            .currentMedication(currentMedication(WARFARIN, TODAY.minusDays(10), 30))
            .build();

    @BeforeEach
    void setUp() {
        RuleTablesRepository repository = TestFixtures.defaultRepository();
        DurRulesEngine engine = new DurRulesEngine(List.of(
                new DrugInteractionCheck(),
                new TherapeuticDuplicationCheck(),
                new EarlyRefillCheck(new RxAdjudicationProperties()),
                new AgeRestrictionCheck(),
                new GenderRestrictionCheck()), repository);

        service = new ClaimAdjudicationService(
                repository,
                new QuantityLimitEngine(repository, new ClaimHistoryAccumulator()),
                new DurValidator(engine),
                new DurOverrideManager(repository, TestFixtures.CLOCK),
                new DurAlertFormatter(),
                new ClinicalCriteriaEvaluator(repository, TestFixtures.CLOCK),
                new StepTherapyEvaluator(repository),
                priorAuthWorkflow);

        when(priorAuthWorkflow.checkExistingAuth(anyString(), any(DrugIdentifier.class), any())).thenReturn(Optional.empty());
    }

    @Test
    void shouldProceedWhenNothingFires() {
        var result = service.adjudicate(claim(LISINOPRIL, 30, 30, null), onWarfarin, List.of(), List.of());

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.PROCEED);
        assertThat(result.getMessages()).isEmpty();
        verify(priorAuthWorkflow, never()).checkExistingAuth(anyString(), any(DrugIdentifier.class), any());
    }

    @Test
    void shouldRequireOverrideForMajorInteraction() {
        var result = service.adjudicate(claim(IBUPROFEN, 90, 30, null), onWarfarin, List.of(), List.of());

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.OVERRIDE_REQUIRED);
        assertThat(result.getDurResult().isRequiresOverride()).isTrue();
        assertThat(result.getMessages()).containsExactly(
                "1 major DUR alert(s) require pharmacist override",
                "DD MAJOR (DD-001): Increased bleeding risk");
    }

    @Test
    void shouldProceedOnceInteractionIsOverridden() {
        DurOverride override = DurOverride.builder()
                .alertType(DurAlertType.DRUG_DRUG)
                .reasonForService("MA")
                .professionalService("M0")
                .resultOfService("1G")
                .actorId("RPH-1")
                .overrideDate(TODAY)
                .build();

        var result = service.adjudicate(claim(IBUPROFEN, 90, 30, null), onWarfarin, List.of(), List.of(override));

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.PROCEED);
        assertThat(result.getDurSummary().isCanProceed()).isTrue();
        assertThat(result.getDurResult().getAlerts()).hasSize(1);
    }

    @Test
    void shouldRequirePriorAuthBeforeOtherOutcomes() {
        var result = service.adjudicate(claim(SEMAGLUTIDE, 3, 84, null), onWarfarin, List.of(), List.of());

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.PRIOR_AUTH_REQUIRED);
        assertThat(result.isPriorAuthRequired()).isTrue();
        assertThat(result.getCriteriaSetId()).isEqualTo("GLP1-PA-001");
        // every check still ran
        assertThat(result.getQuantityResult().isPassed()).isFalse();
    }

    @Test
    void shouldApplyQuantityLimitWhenAuthorizationExists() {
        PriorAuthResponse approval = PriorAuthResponse.builder()
                .paRequestId("PA-20260301-000001")
                .status(PriorAuthStatus.APPROVED)
                .authorizationNumber("AUTH000000001")
                .effectiveDate(TODAY.minusDays(14))
                .expirationDate(TODAY.plusDays(351))
                .build();
        when(priorAuthWorkflow.checkExistingAuth("MEM001", SEMAGLUTIDE, TODAY)).thenReturn(Optional.of(approval));

        var result = service.adjudicate(claim(SEMAGLUTIDE, 3, 84, null), onWarfarin, List.of(), List.of());

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.REJECTED_QUANTITY_LIMIT);
        assertThat(result.isPriorAuthRequired()).isFalse();
        assertThat(result.getExistingAuthorization()).isSameAs(approval);
        assertThat(result.getQuantityResult().getAllowedDaysSupply()).isEqualTo(28);
    }

    @Test
    void shouldAcceptPriorAuthNumberMatchingActiveApproval() {
        PriorAuthResponse approval = PriorAuthResponse.builder()
                .paRequestId("PA-20260301-000002")
                .status(PriorAuthStatus.APPROVED)
                .authorizationNumber("AUTH123456789")
                .effectiveDate(TODAY.minusDays(14))
                .expirationDate(TODAY.plusDays(351))
                .build();
        when(priorAuthWorkflow.findAuthorization("AUTH123456789", "MEM001", SEMAGLUTIDE, TODAY))
                .thenReturn(Optional.of(approval));

        var result = service.adjudicate(claim(SEMAGLUTIDE, 1, 28, "AUTH123456789"), onWarfarin, List.of(), null);

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.PROCEED);
        assertThat(result.getExistingAuthorization()).isSameAs(approval);
    }

    @Test
    void shouldRequirePriorAuthWhenClaimNumberIsUnknown() {
        when(priorAuthWorkflow.findAuthorization(anyString(), anyString(), any(DrugIdentifier.class), any()))
                .thenReturn(Optional.empty());

        var result = service.adjudicate(claim(SEMAGLUTIDE, 1, 28, "NOT-A-REAL-AUTH"), onWarfarin, List.of(), null);

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.PRIOR_AUTH_REQUIRED);
        assertThat(result.isPriorAuthRequired()).isTrue();
        assertThat(result.getMessages())
                .contains("Prior authorization number NOT-A-REAL-AUTH is not an active authorization for this member and drug");
    }

    @Test
    void shouldTreatBlankPriorAuthNumberAsAbsent() {
        var result = service.adjudicate(claim(SEMAGLUTIDE, 1, 28, "  "), onWarfarin, List.of(), null);

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.PRIOR_AUTH_REQUIRED);
        verify(priorAuthWorkflow, never()).findAuthorization(any(), any(), any(), any());
    }

    @Test
    void shouldRequireStepTherapyWithoutGenericTrial() {
        var result = service.adjudicate(claim(ESOMEPRAZOLE, 30, 30, null), onWarfarin, List.of(), List.of());

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.STEP_THERAPY_REQUIRED);
        assertThat(result.isStepTherapyRequired()).isTrue();
        assertThat(result.isPriorAuthRequired()).isFalse();
        assertThat(result.getStepTherapyResult().getProtocolId()).isEqualTo("PPI-ST");
        assertThat(result.getMessages().get(0)).startsWith("Step therapy not satisfied: Generic PPI required");
    }

    @Test
    void shouldProceedOnceStepTherapyIsSatisfied() {
        List<ClaimHistoryEntry> history = List.of(ClaimHistoryEntry.builder()
                .ndc(OMEPRAZOLE.getNdc())
                .gpi(OMEPRAZOLE.getGpi())
                .serviceDate(TODAY.minusDays(75))
                .quantityDispensed(new BigDecimal("30"))
                .daysSupply(30)
                .build());

        var result = service.adjudicate(claim(ESOMEPRAZOLE, 30, 30, null), onWarfarin, history, List.of());

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.PROCEED);
        assertThat(result.getStepTherapyResult().isSatisfied()).isTrue();
        verify(priorAuthWorkflow, never()).checkExistingAuth(anyString(), any(DrugIdentifier.class), any());
    }

    @Test
    void shouldWaiveStepTherapyForActiveAuthorization() {
        PriorAuthResponse approval = PriorAuthResponse.builder()
                .paRequestId("PA-20260301-000003")
                .status(PriorAuthStatus.APPROVED)
                .authorizationNumber("AUTH000000003")
                .effectiveDate(TODAY.minusDays(1))
                .expirationDate(TODAY.plusDays(364))
                .build();
        when(priorAuthWorkflow.checkExistingAuth("MEM001", ESOMEPRAZOLE, TODAY)).thenReturn(Optional.of(approval));

        var result = service.adjudicate(claim(ESOMEPRAZOLE, 30, 30, null), onWarfarin, List.of(), List.of());

        assertThat(result.getDecision()).isEqualTo(AdjudicationDecision.PROCEED);
        assertThat(result.isStepTherapyRequired()).isFalse();
        assertThat(result.getStepTherapyResult().isSatisfied()).isFalse();
    }

    private static PharmacyClaim claim(DrugIdentifier drug, int quantity, int daysSupply, String priorAuthNumber) {
        return PharmacyClaim.builder()
                .claimId("CLM-" + drug.getNdc())
                .memberId("MEM001")
                .drug(drug)
                .quantity(BigDecimal.valueOf(quantity))
                .daysSupply(daysSupply)
                .serviceDate(TODAY)
                .prescriberNpi("1234567893")
                .priorAuthNumber(priorAuthNumber)
                .build();
    }
}
