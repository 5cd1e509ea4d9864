package com.example.studydesign.calculator;

import com.example.studydesign.domain.DesignInput;
import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.DesignType;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.exception.DesignComputationFailedException;
import com.example.studydesign.exception.InvalidDesignInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DesignCalculatorTest {

    private final DesignCalculator calculator = new DesignCalculator(DesignPolicy.defaults());

    private static DesignInput.DesignInputBuilder reference() {
        return DesignInput.builder()
                .cvIntra(25.0)
                .alpha(0.05)
                .power(80.0)
                .delta(20.0)
                .dropoutRate(20.0)
                .screenFailRate(12.0)
                .halfLifeHours(12.0);
    }

    @Test
    void standardCrossoverForModerateVariability() {
        DesignResult result = calculator.calculate(reference().build());

        assertThat(result.designType()).isEqualTo(DesignType.STANDARD_2X2_CROSSOVER);
        assertThat(result.sampleSize()).isEqualTo(28);
        assertThat(result.subjectsPerSequence()).isEqualTo(14);
        // ceil(28 / 0.8) = 35, ceil(35 / 0.88) = 40
        assertThat(result.enrollmentWithDropout()).isEqualTo(35);
        assertThat(result.enrollmentWithScreenFail()).isEqualTo(40);
        assertThat(result.randomizationScheme()).isEqualTo("TR/RT");
        assertThat(result.policyVersion()).isEqualTo(DesignPolicy.DEFAULT_VERSION);
    }

    @Test
    void highVariabilityRequiresReplicateDesign() {
        DesignResult result = calculator.calculate(reference().cvIntra(45.0).build());

        assertThat(result.designType()).isEqualTo(DesignType.REPLICATE);
        assertThat(result.sampleSize()).isGreaterThanOrEqualTo(24);
        assertThat(result.sampleSize() % 2).isZero();
        assertThat(result.randomizationScheme()).isEqualTo("TRTR/RTRT");
    }

    @Test
    void thresholdItselfIsStillStandard() {
        assertThat(calculator.classify(30.0)).isEqualTo(DesignType.STANDARD_2X2_CROSSOVER);
        assertThat(calculator.classify(30.01)).isEqualTo(DesignType.REPLICATE);
    }

    @Test
    void lowVariabilityIsRaisedToTheMinimum() {
        DesignResult result = calculator.calculate(reference().cvIntra(5.0).build());

        assertThat(result.sampleSize()).isEqualTo(12);
    }

    @Test
    void replicateFloorAppliesJustAboveThreshold() {
        DesignResult result = calculator.calculate(reference().cvIntra(31.0).build());

        assertThat(result.designType()).isEqualTo(DesignType.REPLICATE);
        assertThat(result.sampleSize()).isGreaterThanOrEqualTo(24);
    }

    @Test
    void sampleSizeNeverDecreasesWithVariability() {
        int previous = 0;
        for (double cv = 1.0; cv <= 200.0; cv += 1.5) {
            int n = calculator.calculate(reference().cvIntra(cv).build()).sampleSize();
            assertThat(n).as("N at CV=%s", cv).isGreaterThanOrEqualTo(previous);
            previous = n;
        }
    }

    @Test
    void sampleSizeNeverDecreasesWithPower() {
        int previous = 0;
        for (double power = 50.0; power < 100.0; power += 2.5) {
            int n = calculator.calculate(reference().power(power).build()).sampleSize();
            assertThat(n).as("N at power=%s", power).isGreaterThanOrEqualTo(previous);
            previous = n;
        }
    }

    @Test
    void enrollmentNeverDecreasesWithAttrition() {
        int previousDropout = 0;
        for (double rate = 0.0; rate < 100.0; rate += 4.5) {
            DesignResult result = calculator.calculate(reference().dropoutRate(rate).screenFailRate(rate).build());
            assertThat(result.enrollmentWithDropout()).isGreaterThanOrEqualTo(previousDropout);
            assertThat(result.enrollmentWithScreenFail()).isGreaterThanOrEqualTo(result.enrollmentWithDropout());
            previousDropout = result.enrollmentWithDropout();
        }
    }

    @Test
    void zeroAttritionKeepsSampleSize() {
        DesignResult result = calculator.calculate(reference().dropoutRate(0.0).screenFailRate(0.0).build());

        assertThat(result.enrollmentWithDropout()).isEqualTo(result.sampleSize());
        assertThat(result.enrollmentWithScreenFail()).isEqualTo(result.sampleSize());
    }

    @Test
    void exactQuotientIsNotRoundedUp() {
        // 40 / (1 - 0.2) is exactly 50; binary floating point would give 50.000000000000001
        assertThat(calculator.inflate(40, 20.0, "dropoutRate")).isEqualTo(50);
        assertThat(calculator.inflate(28, 20.0, "dropoutRate")).isEqualTo(35);
        assertThat(calculator.inflate(35, 12.0, "screenFailRate")).isEqualTo(40);
    }

    @Test
    void missingOptionalsFallBackToPolicy() {
        DesignResult result = calculator.calculate(DesignInput.builder().cvIntra(25.0).build());

        assertThat(result.power()).isEqualTo(80.0);
        assertThat(result.alpha()).isEqualTo(0.05);
        assertThat(result.delta()).isEqualTo(20.0);
        assertThat(result.dropoutRate()).isZero();
        assertThat(result.screenFailRate()).isZero();
        assertThat(result.sampleSize()).isEqualTo(28);
        assertThat(result.enrollmentWithScreenFail()).isEqualTo(28);
    }

    @Test
    void washoutIsFiveHalfLivesRoundedUpToDays() {
        assertThat(calculator.calculate(reference().halfLifeHours(12.0).build()).washoutDays()).isEqualTo(3);
        assertThat(calculator.calculate(reference().halfLifeHours(9.6).build()).washoutDays()).isEqualTo(2);
        assertThat(calculator.calculate(reference().halfLifeHours(50.0).build()).washoutDays()).isEqualTo(11);
    }

    @Test
    void washoutNeverShorterThanOneDay() {
        DesignResult result = calculator.calculate(reference().halfLifeHours(1.0).build());

        assertThat(result.washoutDays()).isEqualTo(1);
        assertThat(result.washoutEstimated()).isFalse();
    }

    @Test
    void missingHalfLifeUsesFallbackAndIsFlagged() {
        DesignResult result = calculator.calculate(reference().halfLifeHours(null).build());

        assertThat(result.washoutEstimated()).isTrue();
        assertThat(result.halfLifeHoursUsed()).isNull();
        // 5 x 24 h = 120 h = 5 days
        assertThat(result.washoutDays()).isEqualTo(5);
    }

    @Test
    void missingCvIsAComputationFailure() {
        assertThatThrownBy(() -> calculator.calculate(reference().cvIntra(null).build()))
                .isInstanceOf(DesignComputationFailedException.class)
                .hasMessageContaining("CV_intra");
    }

    @ParameterizedTest
    @ValueSource(doubles = {100.0, 49.9, -1.0, Double.NaN})
    void powerOutsideRangeIsRejected(double power) {
        assertThatThrownBy(() -> calculator.calculate(reference().power(power).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("power"));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -5.0, 200.5, Double.POSITIVE_INFINITY})
    void cvOutsideRangeIsRejected(double cv) {
        assertThatThrownBy(() -> calculator.calculate(reference().cvIntra(cv).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("cvIntra"));
    }

    @Test
    void attritionOfHundredPercentIsRejected() {
        assertThatThrownBy(() -> calculator.calculate(reference().dropoutRate(100.0).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("dropoutRate"));
        assertThatThrownBy(() -> calculator.calculate(reference().screenFailRate(100.0).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("screenFailRate"));
    }

    @Test
    void alphaAndDeltaBoundsAreExclusive() {
        assertThatThrownBy(() -> calculator.calculate(reference().alpha(0.0).build()))
                .isInstanceOf(InvalidDesignInputException.class);
        assertThatThrownBy(() -> calculator.calculate(reference().alpha(0.5).build()))
                .isInstanceOf(InvalidDesignInputException.class);
        assertThatThrownBy(() -> calculator.calculate(reference().delta(0.0).build()))
                .isInstanceOf(InvalidDesignInputException.class);
        assertThatThrownBy(() -> calculator.calculate(reference().delta(100.0).build()))
                .isInstanceOf(InvalidDesignInputException.class);
    }

    @Test
    void marginSmallerThanExpectedRatioIsRejected() {
        // ln(1 / 0.96) < |ln 0.95|
        assertThatThrownBy(() -> calculator.calculate(reference().delta(4.0).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("delta"));
    }

    @Test
    void widerMarginNeedsFewerSubjects() {
        int narrow = calculator.calculate(reference().delta(20.0).build()).sampleSize();
        int wide = calculator.calculate(reference().delta(25.0).build()).sampleSize();

        assertThat(wide).isLessThan(narrow);
    }

    @Test
    void sampleSizeSearchIsBoundedByPolicy() {
        DesignCalculator bounded = new DesignCalculator(DesignPolicy.defaults().toBuilder().maxSampleSize(50).build());

        assertThatThrownBy(() -> bounded.calculate(reference().cvIntra(150.0).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("cvIntra"));
    }

    @Test
    void dropoutCloseToHundredPercentIsAnInputError() {
        // 28 / 1e-9 does not fit in an int
        assertThatThrownBy(() -> calculator.calculate(reference().dropoutRate(99.9999999).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("dropoutRate"));
        assertThatThrownBy(() -> calculator.calculate(reference().screenFailRate(99.9999999).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("screenFailRate"));
    }

    @Test
    void absurdHalfLifeIsAnInputError() {
        assertThatThrownBy(() -> calculator.calculate(reference().halfLifeHours(1e12).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("halfLifeHours"));
    }

    @Test
    void validAssumptionsPassValidation() {
        calculator.validateAssumptions(StudyAssumptions.defaults());
        calculator.validateAssumptions(null);
        calculator.validateAssumptions(new StudyAssumptions(90.0, 0.05, 20.0, 20.0, 12.0));
    }

    @Test
    void assumptionsAreRangeCheckedWithoutCalculating() {
        assertThatThrownBy(() -> calculator.validateAssumptions(StudyAssumptions.builder().dropoutRate(100.0).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("dropoutRate"));
        assertThatThrownBy(() -> calculator.validateAssumptions(StudyAssumptions.builder().power(30.0).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("power"));
        assertThatThrownBy(() -> calculator.validateAssumptions(StudyAssumptions.builder().delta(4.0).build()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("delta"));
    }

    @Test
    void explanationNamesThresholdSampleSizeWashoutAndPolicy() {
        DesignResult result = calculator.calculate(reference().build());

        assertThat(result.explanation()).isEqualTo("2x2 crossover: CV_intra 25% is at or below the 30% "
                + "high-variability threshold; N=28 from the power calculation, above the minimum of 12; "
                + "washout 3 day(s) from 5 x T1/2 of 12 h, at least 24 h (policy 2024.1).");
    }

    @Test
    void explanationReportsFloorAndFallbackHalfLife() {
        DesignResult result = calculator.calculate(reference().cvIntra(5.0).halfLifeHours(null).build());

        assertThat(result.explanation())
                .contains("N=12, the minimum of 12 subjects for this design")
                .contains("estimated from a fallback T1/2 of 24 h");
    }

    @Test
    void explanationForReplicateSaysThresholdWasExceeded() {
        DesignResult result = calculator.calculate(reference().cvIntra(45.0).build());

        assertThat(result.explanation())
                .startsWith("2x2x4 replicate: CV_intra 45% exceeds the 30% high-variability threshold");
    }

    @Test
    void calculationIsDeterministic() {
        DesignInput input = reference().cvIntra(37.5).build();

        assertThat(calculator.calculate(input)).isEqualTo(calculator.calculate(input));
    }
}
