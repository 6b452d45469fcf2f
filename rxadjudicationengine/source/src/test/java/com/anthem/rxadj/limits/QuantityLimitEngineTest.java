package com.anthem.rxadj.limits;

import com.anthem.rxadj.TestFixtures;
import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.history.ClaimHistoryAccumulator;
import com.anthem.rxadj.history.ClaimHistoryEntry;
import com.anthem.rxadj.rules.RuleTables;
import com.anthem.rxadj.rules.RuleTablesDefinition;
import com.anthem.rxadj.rules.RuleTablesValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.anthem.rxadj.TestFixtures.LISINOPRIL;
import static com.anthem.rxadj.TestFixtures.OMEPRAZOLE;
import static com.anthem.rxadj.TestFixtures.SEMAGLUTIDE;
import static com.anthem.rxadj.TestFixtures.SUMATRIPTAN;
import static com.anthem.rxadj.TestFixtures.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuantityLimitEngineTest {

    private QuantityLimitEngine engine;

    @BeforeEach
    void setUp() {
        engine = new QuantityLimitEngine(TestFixtures.defaultRepository(), new ClaimHistoryAccumulator());
    }

    @Test
    void testCheck_noLimitsApply() {
        var result = engine.check(LISINOPRIL, new BigDecimal("90"), 90, List.of(), TODAY);

        assertThat(result.isPassed()).isTrue();
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("90");
        assertThat(result.getAllowedDaysSupply()).isEqualTo(90);
        assertThat(result.getMessage()).isEqualTo("No quantity limits apply");
    }

    @Test
    void testCheck_perFillExceeded() {
        var result = engine.check(OMEPRAZOLE, new BigDecimal("90"), 90, List.of(), TODAY);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getLimitId()).isEqualTo("PPI-QL");
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("30");
        assertThat(result.getAllowedDaysSupply()).isEqualTo(30);
        assertThat(result.getMaxQuantity()).isEqualByComparingTo("30");
    }

    @Test
    void testCheck_perFillWithinLimit() {
        var result = engine.check(OMEPRAZOLE, new BigDecimal("30"), 30, List.of(), TODAY);

        assertThat(result.isPassed()).isTrue();
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("30");
    }

    @Test
    void testCheck_monthlyLimitCountsHistory() {
        List<ClaimHistoryEntry> history = List.of(ClaimHistoryEntry.builder()
                .ndc(SUMATRIPTAN.getNdc())
                .gpi(SUMATRIPTAN.getGpi())
                .serviceDate(TODAY.minusDays(10))
                .quantityDispensed(new BigDecimal("7"))
                .daysSupply(30)
                .build());

        var result = engine.check(SUMATRIPTAN, new BigDecimal("5"), 30, history, TODAY);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getQuantityUsedInPeriod()).isEqualByComparingTo("7");
        assertThat(result.getQuantityRemainingInPeriod()).isEqualByComparingTo("2");
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("2");
        assertThat(result.getMessage()).isEqualTo("Exceeds 30-day limit. Used: 7, Max: 9, Remaining: 2");
    }

    @Test
    void testCheck_monthlyLimitExhausted() {
        List<ClaimHistoryEntry> history = List.of(ClaimHistoryEntry.builder()
                .ndc(SUMATRIPTAN.getNdc())
                .serviceDate(TODAY.minusDays(3))
                .quantityDispensed(new BigDecimal("12"))
                .daysSupply(30)
                .build());

        var result = engine.check(SUMATRIPTAN, new BigDecimal("1"), 30, history, TODAY);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getQuantityRemainingInPeriod()).isEqualByComparingTo("0");
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("0");
    }

    @Test
    void testCheck_daysSupplyLimitLeavesQuantityAlone() {
        var result = engine.check(SEMAGLUTIDE, new BigDecimal("3"), 84, List.of(), TODAY);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getAllowedDaysSupply()).isEqualTo(28);
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("3");
        assertThat(result.getMaxQuantity()).isNull();
    }

    @Test
    void testCheck_zeroQuantityPasses() {
        var result = engine.check(OMEPRAZOLE, BigDecimal.ZERO, 90, List.of(), TODAY);

        assertThat(result.isPassed()).isTrue();
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("0");
    }

    @Test
    void testCheck_monthlyLimitWithoutNdcRejected() {
        DrugIdentifier gpiOnly = DrugIdentifier.of(null, SUMATRIPTAN.getGpi(), "Sumatriptan 50mg");
        List<ClaimHistoryEntry> history = List.of(ClaimHistoryEntry.builder()
                .ndc(SUMATRIPTAN.getNdc())
                .gpi(SUMATRIPTAN.getGpi())
                .serviceDate(TODAY.minusDays(10))
                .quantityDispensed(new BigDecimal("9"))
                .daysSupply(30)
                .build());

        assertThatThrownBy(() -> engine.check(gpiOnly, new BigDecimal("9"), 30, history, TODAY))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("TRIPTAN-QL");
    }

    @Test
    void testCheck_perFillLimitWithoutNdcStillApplies() {
        DrugIdentifier gpiOnly = DrugIdentifier.of(null, OMEPRAZOLE.getGpi(), null);

        var result = engine.check(gpiOnly, new BigDecimal("90"), 90, List.of(), TODAY);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getLimitId()).isEqualTo("PPI-QL");
    }

    @Test
    void testCheck_negativeQuantityRejected() {
        assertThatThrownBy(() -> engine.check(OMEPRAZOLE, new BigDecimal("-1"), 30, List.of(), TODAY))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void testCheck_negativeDaysSupplyRejected() {
        assertThatThrownBy(() -> engine.check(OMEPRAZOLE, BigDecimal.ONE, -5, List.of(), TODAY))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void testCheck_firstFailureInConfigurationOrderWins() {
        RuleTables tables = TestFixtures.tables(RuleTablesDefinition.builder()
                .version("test")
                .quantityLimit(perFill("CLASS-QL", "4940", "60", 90))
                .quantityLimit(perFill("NDC-QL", OMEPRAZOLE.getNdc(), "20", 30))
                .quantityLimit(perFill("DRUG-QL", "49400020", "10", 30))
                .build());

        var result = engine.check(tables, OMEPRAZOLE, new BigDecimal("45"), 45, List.of(), TODAY);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getLimitId()).isEqualTo("NDC-QL");
    }

    @Test
    void testCheck_mostRestrictivePassingLimitWins() {
        RuleTables tables = TestFixtures.tables(RuleTablesDefinition.builder()
                .version("test")
                .quantityLimit(perFill("WIDE-QL", "4940", "90", 90))
                .quantityLimit(QuantityLimit.builder()
                        .limitId("MONTHLY-QL")
                        .drugIdentifier("49400020")
                        .limitType(QuantityLimitType.PER_MONTH)
                        .maxQuantity(new BigDecimal("60"))
                        .build())
                .build());
        List<ClaimHistoryEntry> history = List.of(ClaimHistoryEntry.builder()
                .ndc(OMEPRAZOLE.getNdc())
                .serviceDate(TODAY.minusDays(5))
                .quantityDispensed(new BigDecimal("20"))
                .daysSupply(20)
                .build());

        var result = engine.check(tables, OMEPRAZOLE, new BigDecimal("30"), 30, history, TODAY);

        assertThat(result.isPassed()).isTrue();
        assertThat(result.getLimitId()).isEqualTo("WIDE-QL");
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("30");
    }

    @Test
    void testEvaluateAll_returnsEveryMatchingLimit() {
        var results = engine.evaluateAll(OMEPRAZOLE, new BigDecimal("45"), 45, List.of(), TODAY);

        assertThat(results).extracting(QuantityLimitResult::getLimitId).containsExactly("PPI-QL");
        assertThat(results.get(0).isPassed()).isFalse();
    }

    @Test
    void testCheck_perDayLimit() {
        RuleTables tables = TestFixtures.tables(RuleTablesDefinition.builder()
                .version("test")
                .quantityLimit(QuantityLimit.builder()
                        .limitId("DAILY-QL")
                        .drugIdentifier("4940")
                        .limitType(QuantityLimitType.PER_DAY)
                        .maxQuantity(new BigDecimal("2"))
                        .build())
                .build());

        var result = engine.check(tables, OMEPRAZOLE, new BigDecimal("90"), 30, List.of(), TODAY);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getMaxQuantity()).isEqualByComparingTo("60");
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("60");
        assertThat(result.getMessage()).contains("Daily quantity 3 exceeds limit of 2 per day");
    }

    @Test
    void testCheck_nonBindingLimitSkippedWithWarning() {
        RuleTables tables = new RuleTablesValidator(false).validateAndBuild(RuleTablesDefinition.builder()
                .version("lenient")
                .quantityLimit(QuantityLimit.builder()
                        .limitId("EMPTY-QL")
                        .drugIdentifier("4940")
                        .limitType(QuantityLimitType.PER_FILL)
                        .build())
                .build());

        var result = engine.check(tables, OMEPRAZOLE, new BigDecimal("90"), 90, List.of(), TODAY);

        assertThat(result.isPassed()).isTrue();
        assertThat(result.getAllowedQuantity()).isEqualByComparingTo("90");
        assertThat(result.getWarnings()).singleElement().asString().contains("EMPTY-QL");
    }

    @Test
    void testCheck_allowedNeverExceedsRequestedOrMax() {
        for (int quantity : new int[]{1, 29, 30, 31, 120}) {
            var result = engine.check(OMEPRAZOLE, BigDecimal.valueOf(quantity), 30, List.of(), TODAY);

            assertThat(result.getAllowedQuantity()).isLessThanOrEqualTo(result.getRequestedQuantity());
            assertThat(result.getAllowedQuantity()).isLessThanOrEqualTo(result.getMaxQuantity());
            assertThat(result.isPassed()).isEqualTo(quantity <= 30);
        }
    }

    private static QuantityLimit perFill(String id, String drug, String maxQuantity, int maxDays) {
        return QuantityLimit.builder()
                .limitId(id)
                .drugIdentifier(drug)
                .limitType(QuantityLimitType.PER_FILL)
                .maxQuantity(new BigDecimal(maxQuantity))
                .maxDaysSupply(maxDays)
                .build();
    }
}
