package com.example.studydesign.calculator;

import com.example.studydesign.domain.DesignInput;
import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.DesignType;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.exception.DesignComputationFailedException;
import com.example.studydesign.exception.InvalidDesignInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Sample size, enrollment and washout for a bioequivalence crossover study.
 *
 * Pure function of its input and the {@link DesignPolicy}. Sample size uses the two one-sided
 * tests approximation for the log-transformed 2x2 crossover:
 * <pre>
 *   N >= 2 * sigmaW^2 * (t(1-alpha, N-2) + t(1-beta, N-2))^2 / (ln(upper) - |ln(theta0)|)^2
 *   sigmaW^2 = ln(1 + CV^2)
 * </pre>
 * with {@code t(1-beta/2)} when theta0 = 1. The smallest N satisfying the inequality is found by
 * ascending search, then rounded up to a whole number of subjects per sequence and raised to the
 * design's minimum. Replicate designs keep the 2x2 subject count (no reference scaling) and use
 * their own floor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DesignCalculator {

    private static final int MIN_TOTAL_SUBJECTS = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal HOURS_PER_DAY = BigDecimal.valueOf(24);
    private static final BigDecimal MAX_INT = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final DesignPolicy policy;

    public DesignPolicy policy() {
        return policy;
    }

    /**
     * Compute a design.
     *
     * @throws DesignComputationFailedException when CV_intra is missing
     * @throws InvalidDesignInputException      when any input is out of range, or an enrollment or
     *                                          washout figure does not fit in an int
     */
    public DesignResult calculate(DesignInput input) {
        if (input.cvIntra() == null) {
            throw new DesignComputationFailedException("CV_intra not available - cannot calculate a defensible sample size");
        }
        double cvIntra = requireRange("cvIntra", input.cvIntra(), 0.0, false, 200.0, true);
        Assumptions assumptions = resolve(input.power(), input.alpha(), input.delta(),
                input.dropoutRate(), input.screenFailRate());
        Double halfLifeHours = input.halfLifeHours();
        if (halfLifeHours != null) {
            requireRange("halfLifeHours", halfLifeHours, 0.0, false, Double.MAX_VALUE, true);
        }

        DesignType designType = classify(cvIntra);
        int sampleSize = sampleSize(cvIntra, assumptions.power(), assumptions.alpha(), assumptions.delta(), designType);
        int enrollmentWithDropout = inflate(sampleSize, assumptions.dropoutRate(), "dropoutRate");
        int enrollmentWithScreenFail = inflate(enrollmentWithDropout, assumptions.screenFailRate(), "screenFailRate");
        int washoutDays = washoutDays(halfLifeHours);

        DesignResult result = DesignResult.builder()
                .sampleSize(sampleSize)
                .subjectsPerSequence(sampleSize / designType.sequences().size())
                .enrollmentWithDropout(enrollmentWithDropout)
                .enrollmentWithScreenFail(enrollmentWithScreenFail)
                .washoutDays(washoutDays)
                .washoutEstimated(halfLifeHours == null)
                .cvIntraUsed(cvIntra)
                .halfLifeHoursUsed(halfLifeHours)
                .designType(designType)
                .power(assumptions.power())
                .alpha(assumptions.alpha())
                .delta(assumptions.delta())
                .dropoutRate(assumptions.dropoutRate())
                .screenFailRate(assumptions.screenFailRate())
                .policyVersion(policy.version())
                .explanation(explain(cvIntra, designType, sampleSize, halfLifeHours, washoutDays))
                .build();

        log.debug("Design computed: cv={}%, type={}, N={}, enrollment={}/{}, washout={}d, policy={}",
                cvIntra, designType, sampleSize, enrollmentWithDropout, enrollmentWithScreenFail,
                washoutDays, policy.version());
        return result;
    }

    /**
     * Apply the calculator's range checks to caller assumptions without computing anything, so a
     * project whose design stage could never succeed is refused up front.
     *
     * @throws InvalidDesignInputException when an assumption is out of range
     */
    public void validateAssumptions(StudyAssumptions assumptions) {
        if (assumptions == null) {
            return;
        }
        resolve(assumptions.power(), assumptions.alpha(), assumptions.delta(),
                assumptions.dropoutRate(), assumptions.screenFailRate());
    }

    public DesignType classify(double cvIntra) {
        return cvIntra > policy.highVariabilityThreshold() ? DesignType.REPLICATE : DesignType.STANDARD_2X2_CROSSOVER;
    }

    int sampleSize(double cvIntra, double power, double alpha, double delta, DesignType designType) {
        int sequences = designType.sequences().size();
        int required = requiredSubjects(cvIntra, power, alpha, delta);
        int balanced = ceilToMultiple(required, sequences);
        return Math.max(balanced, ceilToMultiple(minSubjects(designType), sequences));
    }

    /**
     * Smallest total N satisfying the TOST power requirement.
     */
    int requiredSubjects(double cvIntra, double power, double alpha, double delta) {
        double cv = cvIntra / 100.0;
        double sigmaW2 = Math.log1p(cv * cv);
        double ratioLog = Math.abs(Math.log(policy.expectedRatio()));
        double margin = acceptanceMargin(delta);
        double beta = 1.0 - power / 100.0;
        double betaTail = ratioLog == 0.0 ? beta / 2.0 : beta;
        double scale = 2.0 * sigmaW2 / (margin * margin);

        // t quantiles exceed normal ones, so the normal approximation is a lower bound for N.
        NormalDistribution normal = new NormalDistribution();
        double zSum = normal.inverseCumulativeProbability(1.0 - alpha) + normal.inverseCumulativeProbability(1.0 - betaTail);
        int start = Math.max(MIN_TOTAL_SUBJECTS, (int) Math.floor(scale * zSum * zSum));

        for (int n = start; n <= policy.maxSampleSize(); n++) {
            TDistribution t = new TDistribution(n - 2);
            double tSum = t.inverseCumulativeProbability(1.0 - alpha) + t.inverseCumulativeProbability(1.0 - betaTail);
            if (n >= scale * tSum * tSum) {
                return n;
            }
        }
        throw new InvalidDesignInputException("cvIntra",
                "Required sample size exceeds " + policy.maxSampleSize() + " subjects for CV_intra=" + cvIntra + "%");
    }

    /**
     * {@code ceil(n / (1 - rate/100))}, computed in decimal so that exact quotients stay exact.
     */
    int inflate(int subjects, double ratePercent, String field) {
        BigDecimal retained = BigDecimal.ONE.subtract(BigDecimal.valueOf(ratePercent).divide(HUNDRED, MathContext.DECIMAL64));
        if (retained.signum() <= 0) {
            throw new InvalidDesignInputException(field, field + " must be below 100 but was " + ratePercent);
        }
        BigDecimal enrollment = BigDecimal.valueOf(subjects)
                .divide(retained, MathContext.DECIMAL64)
                .setScale(0, RoundingMode.CEILING);
        if (enrollment.compareTo(MAX_INT) > 0) {
            throw new InvalidDesignInputException(field, String.format(
                    "%s=%s%% inflates %d subjects to %s, beyond the largest representable enrollment",
                    field, ratePercent, subjects, enrollment.toPlainString()));
        }
        return enrollment.intValue();
    }

    int washoutDays(Double halfLifeHours) {
        double halfLife = halfLifeHours != null ? halfLifeHours : policy.fallbackHalfLifeHours();
        BigDecimal hours = BigDecimal.valueOf(halfLife).multiply(BigDecimal.valueOf(policy.washoutHalfLives()));
        BigDecimal floor = BigDecimal.valueOf(policy.minWashoutHours());
        if (hours.compareTo(floor) < 0) {
            hours = floor;
        }
        BigDecimal days = hours.divide(HOURS_PER_DAY, 0, RoundingMode.CEILING);
        if (days.compareTo(MAX_INT) > 0) {
            throw new InvalidDesignInputException("halfLifeHours", String.format(
                    "halfLifeHours=%s gives a washout of %s days, beyond the largest representable period",
                    halfLife, days.toPlainString()));
        }
        return days.intValue();
    }

    /**
     * One-line rationale for the design: classification against the threshold, sample size against
     * its floor, washout basis and policy version.
     */
    String explain(double cvIntra, DesignType designType, int sampleSize, Double halfLifeHours, int washoutDays) {
        String threshold = format(policy.highVariabilityThreshold());
        String classification = designType == DesignType.REPLICATE
                ? "CV_intra " + format(cvIntra) + "% exceeds the " + threshold + "% high-variability threshold"
                : "CV_intra " + format(cvIntra) + "% is at or below the " + threshold + "% high-variability threshold";

        int floor = minSubjects(designType);
        String size = sampleSize <= ceilToMultiple(floor, designType.sequences().size())
                ? "N=" + sampleSize + ", the minimum of " + floor + " subjects for this design"
                : "N=" + sampleSize + " from the power calculation, above the minimum of " + floor;

        String washout = halfLifeHours != null
                ? "washout " + washoutDays + " day(s) from " + policy.washoutHalfLives() + " x T1/2 of "
                        + format(halfLifeHours) + " h, at least " + policy.minWashoutHours() + " h"
                : "washout " + washoutDays + " day(s) estimated from a fallback T1/2 of "
                        + format(policy.fallbackHalfLifeHours()) + " h, no half-life available";

        return designType.label() + ": " + classification + "; " + size + "; " + washout
                + " (policy " + policy.version() + ").";
    }

    private int minSubjects(DesignType designType) {
        return designType == DesignType.REPLICATE ? policy.replicateMinSubjects() : policy.standardMinSubjects();
    }

    private Assumptions resolve(Double power, Double alpha, Double delta, Double dropoutRate, Double screenFailRate) {
        Assumptions resolved = new Assumptions(
                requireRange("power", orDefault(power, policy.power()), 50.0, true, 100.0, false),
                requireRange("alpha", orDefault(alpha, policy.alpha()), 0.0, false, 0.5, false),
                requireRange("delta", orDefault(delta, policy.delta()), 0.0, false, 100.0, false),
                requireRange("dropoutRate", orDefault(dropoutRate, 0.0), 0.0, true, 100.0, false),
                requireRange("screenFailRate", orDefault(screenFailRate, 0.0), 0.0, true, 100.0, false));
        acceptanceMargin(resolved.delta());
        return resolved;
    }

    /**
     * Distance on the log scale between the upper acceptance limit and the expected ratio.
     */
    private double acceptanceMargin(double delta) {
        double upperLimitLog = -Math.log(1.0 - delta / 100.0);
        double margin = upperLimitLog - Math.abs(Math.log(policy.expectedRatio()));
        if (margin <= 0) {
            throw new InvalidDesignInputException("delta",
                    "Expected ratio " + policy.expectedRatio() + " lies outside the acceptance limits for delta=" + delta + "%");
        }
        return margin;
    }

    private static int ceilToMultiple(int value, int multiple) {
        return ((value + multiple - 1) / multiple) * multiple;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static double requireRange(String field, double value,
                                       double min, boolean minInclusive,
                                       double max, boolean maxInclusive) {
        boolean aboveMin = minInclusive ? value >= min : value > min;
        boolean belowMax = maxInclusive ? value <= max : value < max;
        if (!Double.isFinite(value) || !aboveMin || !belowMax) {
            throw new InvalidDesignInputException(field, String.format("%s must be in %s%s, %s%s but was %s",
                    field, minInclusive ? "[" : "(", format(min), format(max), maxInclusive ? "]" : ")", value));
        }
        return value;
    }

    private static String format(double bound) {
        return bound == Double.MAX_VALUE ? "inf" : BigDecimal.valueOf(bound).stripTrailingZeros().toPlainString();
    }

    private record Assumptions(double power, double alpha, double delta, double dropoutRate, double screenFailRate) {
    }
}
