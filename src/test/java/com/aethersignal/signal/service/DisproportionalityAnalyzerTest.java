/* (C)2026 */
package com.aethersignal.signal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.aethersignal.signal.enumeration.ThresholdPreset;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.ContingencyTable;
import com.aethersignal.signal.model.DisproportionalityResult;
import com.aethersignal.signal.model.InformationComponent;
import com.aethersignal.signal.model.RatioEstimate;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Unit tests for {@link DisproportionalityAnalyzer}.
 *
 * <p>Reference values for the strong-signal table are computed by hand:
 * PRR = (45/1000) / (120/10000) = 3.75, ROR = 45*9880 / (955*120), E = 15.
 */
class DisproportionalityAnalyzerTest
{

    private static final ContingencyTable STRONG = new ContingencyTable(45, 955, 120, 9880);

    private final DisproportionalityAnalyzer analyzer =
            new DisproportionalityAnalyzer(ThresholdPreset.STANDARD.thresholds());

    @Test
    void strongAssociationIsFlaggedByAllMethods()
    {
        DisproportionalityResult result = analyzer.analyze("warfarin", "Haemorrhage", STRONG);

        assertThat(result.prr().value()).isCloseTo(3.75, within(1e-9));
        assertThat(result.prr().ciLower()).isCloseTo(2.679, within(0.01));
        assertThat(result.prr().signal()).isTrue();
        assertThat(result.ror().value()).isCloseTo(444_600.0 / 114_600.0, within(1e-9));
        assertThat(result.ror().signal()).isTrue();
        assertThat(result.expectedCount()).isCloseTo(15.0, within(1e-9));
        assertThat(result.ic().ic()).isCloseTo(Math.log(3.0) / Math.log(2.0), within(1e-9));
        assertThat(result.ic().ic025()).isCloseTo(result.ic().ic() - 1.96 * Math.sqrt(1.0 / 45), within(1e-9));
        assertThat(result.ic().signal()).isTrue();
        assertThat(result.isSignal()).isTrue();
        assertThat(result.flaggedMethods()).containsExactly("PRR", "ROR", "IC");
    }

    @Test
    void chiSquareUsesYatesCorrection()
    {
        DisproportionalityResult result = analyzer.analyze("warfarin", "Haemorrhage", STRONG);

        double corrected = 330_000.0 - 5_500.0;
        double expected = 11_000.0 * corrected * corrected / (1000.0 * 10_000.0 * 165.0 * 10_835.0);
        assertThat(result.chiSquare()).isCloseTo(expected, within(1e-6));
        assertThat(result.chiSquarePValue()).isLessThan(1e-10);
        assertThat(result.fisherPValue()).isNull();
    }

    @Test
    void zeroCoReportsLeaveEveryMethodUndefinedAndUnflagged()
    {
        DisproportionalityResult result = analyzer.analyze("drug", "event", new ContingencyTable(0, 100, 50, 5000));

        assertThat(result.prr()).isEqualTo(RatioEstimate.undefined());
        assertThat(result.ror()).isEqualTo(RatioEstimate.undefined());
        assertThat(result.ic()).isEqualTo(InformationComponent.undefined());
        assertThat(result.isSignal()).isFalse();
        assertThat(result.flaggedMethods()).isEmpty();
        assertThat(result.fisherPValue()).isNotNull().isBetween(0.0, 1.0);
    }

    @Test
    void prrBelowMinimumCasesIsNotASignal()
    {
        // PRR = (2/10) / (10/10000) = 200 but only two co-reports
        RatioEstimate prr = analyzer.calculatePrr(new ContingencyTable(2, 8, 10, 9990));

        assertThat(prr.value()).isGreaterThan(100);
        assertThat(prr.signal()).isFalse();
    }

    @Test
    void rorIsUndefinedWhenAnyCellIsZero()
    {
        RatioEstimate ror = analyzer.calculateRor(new ContingencyTable(5, 0, 10, 1000));

        assertThat(ror.defined()).isFalse();
        assertThat(ror.value()).isZero();
        assertThat(ror.signal()).isFalse();
    }

    @Test
    void emptyTableIsNotAnError()
    {
        DisproportionalityResult result = analyzer.analyze("drug", "event", new ContingencyTable(0, 0, 0, 0));

        assertThat(result.isSignal()).isFalse();
        assertThat(result.expectedCount()).isZero();
        assertThat(result.chiSquarePValue()).isEqualTo(1.0);
        assertThat(result.fisherPValue()).isNull();
    }

    @Test
    void strictPresetRaisesTheBar()
    {
        DisproportionalityAnalyzer strict = new DisproportionalityAnalyzer(ThresholdPreset.STRICT.thresholds());
        // PRR = (6/1000) / (25/10000) = 2.4, above STANDARD but below STRICT
        ContingencyTable table = new ContingencyTable(6, 994, 25, 9975);

        assertThat(analyzer.calculatePrr(table).value()).isCloseTo(2.4, within(1e-9));
        assertThat(strict.calculatePrr(table).signal()).isFalse();
    }

    @Test
    void missingTableIsRejected()
    {
        assertThatThrownBy(() -> analyzer.analyze("drug", "event", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("contingencyTable");
    }

    @Test
    void negativeCellsAreRejectedOnConstruction()
    {
        assertThatThrownBy(() -> new ContingencyTable(-1, 10, 10, 10))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("n11");
    }

    @ParameterizedTest
    @MethodSource("tables")
    void confidenceIntervalsBracketDefinedEstimates(ContingencyTable table)
    {
        DisproportionalityResult result = analyzer.analyze("drug", "event", table);

        for (RatioEstimate estimate : new RatioEstimate[] {result.prr(), result.ror()}) {
            if (estimate.defined()) {
                assertThat(estimate.ciLower()).isLessThanOrEqualTo(estimate.value());
                assertThat(estimate.value()).isLessThanOrEqualTo(estimate.ciUpper());
            }
        }
        if (result.ic().defined()) {
            assertThat(result.ic().ic025()).isLessThanOrEqualTo(result.ic().ic());
            assertThat(result.ic().ic()).isLessThanOrEqualTo(result.ic().ic975());
        }
    }

    @ParameterizedTest
    @MethodSource("tables")
    void analysisIsDeterministic(ContingencyTable table)
    {
        assertThat(analyzer.analyze("drug", "event", table)).isEqualTo(analyzer.analyze("drug", "event", table));
    }

    static Stream<Arguments> tables()
    {
        return Stream.of(
                Arguments.of(STRONG),
                Arguments.of(new ContingencyTable(1, 1, 1, 1)),
                Arguments.of(new ContingencyTable(3, 97, 300, 9600)),
                Arguments.of(new ContingencyTable(0, 100, 50, 5000)),
                Arguments.of(new ContingencyTable(500, 10, 20, 3)),
                Arguments.of(new ContingencyTable(7, 0, 0, 0)));
    }
}
