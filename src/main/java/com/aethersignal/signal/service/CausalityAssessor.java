/* (C)2026 */
package com.aethersignal.signal.service;

import com.aethersignal.signal.enumeration.CausalityCategory;
import com.aethersignal.signal.enumeration.NaranjoCategory;
import com.aethersignal.signal.exception.ValidationException;
import com.aethersignal.signal.model.CausalityAssessment;
import com.aethersignal.signal.model.CausalityAssessment.Answer;
import com.aethersignal.signal.model.CausalityAssessment.LatencyConsistency;
import com.aethersignal.signal.model.CausalityAssessment.NaranjoAnswer;
import com.aethersignal.signal.model.ClinicalFeatures;
import com.aethersignal.signal.model.TemporalPatternResult.LatencyStats;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jboss.logging.Logger;

/**
 * Individual-case causality assessment with the WHO-UMC system and the Naranjo scale.
 *
 * <p>Both schemes are deterministic functions of {@link ClinicalFeatures}. Fields that were
 * not assessed score no points and never disqualify a category on their own.
 */
@ApplicationScoped
public class CausalityAssessor {

    private static final Logger LOG = Logger.getLogger(CausalityAssessor.class);

    /** Onset beyond this many days is treated as temporally implausible. */
    static final int MAX_PLAUSIBLE_ONSET_DAYS = 90;

    private static final double MAX_CONFIDENCE = 0.98;

    public CausalityAssessment assess(String drug, String event, ClinicalFeatures features) {
        return assess(drug, event, features, null);
    }

    /**
     * Assesses causality and, when population latency statistics are available, checks the
     * case onset against their interquartile range.
     *
     * @param latency population time-to-onset statistics, may be {@code null}
     */
    public CausalityAssessment assess(
            String drug, String event, ClinicalFeatures features, LatencyStats latency) {
        if (features == null) {
            throw ValidationException.missingInput("clinicalFeatures");
        }

        List<String> reasoning = new ArrayList<>();
        CausalityCategory category = classifyWhoUmc(features, reasoning);

        List<NaranjoAnswer> answers = naranjoAnswers(features);
        int naranjoScore = answers.stream().mapToInt(NaranjoAnswer::points).sum();
        NaranjoCategory naranjoCategory = NaranjoCategory.fromScore(naranjoScore);

        List<String> primary = new ArrayList<>();
        List<String> supporting = new ArrayList<>();
        List<String> conflicting = new ArrayList<>();
        identifyFactors(features, primary, supporting, conflicting);

        LatencyConsistency consistency = latencyConsistency(features, latency);
        if (consistency != null) {
            String range = String.format(Locale.ROOT, "%.0f-%.0f days", consistency.q1(), consistency.q3());
            if (consistency.consistent()) {
                supporting.add("Onset consistent with reported latency (IQR " + range + ")");
            } else {
                conflicting.add("Onset outside reported latency (IQR " + range + ")");
            }
        }

        double confidence = confidence(category, naranjoScore, features);

        LOG.debugf(
                "Causality %s/%s: WHO-UMC=%s, Naranjo=%d (%s), confidence=%.2f",
                drug, event, category, naranjoScore, naranjoCategory, confidence);

        return new CausalityAssessment(
                drug,
                event,
                category,
                String.join(", ", reasoning),
                naranjoScore,
                naranjoCategory,
                answers,
                confidence,
                primary,
                supporting,
                conflicting,
                recommendation(category),
                clinicalAction(category),
                consistency);
    }

    /**
     * WHO-UMC decision sequence. Exclusions are checked before the positive categories.
     */
    CausalityCategory classifyWhoUmc(ClinicalFeatures features, List<String> reasoning) {
        if (!features.hasAnyAssessment()) {
            reasoning.add("Insufficient information to assess causality");
            return CausalityCategory.UNASSESSABLE;
        }

        Integer onset = features.timeToOnsetDays();
        boolean onsetImplausible = onset != null && (onset < 0 || onset > MAX_PLAUSIBLE_ONSET_DAYS);
        boolean onsetPlausible = onset != null && !onsetImplausible;
        int alternatives = features.alternativeCauseCount();

        if (onsetImplausible
                || alternatives >= 2
                || Boolean.TRUE.equals(features.indicationCouldCause())
                || Boolean.FALSE.equals(features.routePlausible())) {
            if (onsetImplausible) {
                reasoning.add(onset < 0
                        ? "Event preceded drug exposure"
                        : "Onset after " + onset + " days is temporally implausible");
            }
            if (alternatives >= 2) {
                reasoning.add("Alternative causes exist: " + String.join(", ", features.alternativeCauses()));
            }
            if (Boolean.TRUE.equals(features.indicationCouldCause())) {
                reasoning.add("Underlying indication could explain the event");
            }
            if (Boolean.FALSE.equals(features.routePlausible())) {
                reasoning.add("Route of administration implausible");
            }
            return CausalityCategory.UNLIKELY;
        }

        boolean positiveChallenge = features.dechallengeImproved()
                || Boolean.TRUE.equals(features.rechallengeRecurred());
        if (features.dechallengeImproved() && Boolean.FALSE.equals(features.rechallengeRecurred())) {
            reasoning.add("Positive de-challenge contradicted by negative re-challenge");
            return CausalityCategory.CONDITIONAL;
        }
        if (positiveChallenge && alternatives == 1) {
            reasoning.add("Positive challenge confounded by alternative cause: " + features.alternativeCauses().get(0));
            return CausalityCategory.CONDITIONAL;
        }

        boolean noAlternatives = features.alternativesAssessed() && alternatives == 0;
        if (onsetPlausible && features.dechallengeImproved() && noAlternatives) {
            reasoning.add("Reasonable temporal sequence");
            reasoning.add("positive de-challenge");
            reasoning.add("no alternative causes");
            if (Boolean.TRUE.equals(features.rechallengeRecurred())) {
                reasoning.add("positive re-challenge");
                return CausalityCategory.CERTAIN;
            }
            if (Boolean.TRUE.equals(features.knownReaction())) {
                reasoning.add("known reaction for drug");
            }
            return CausalityCategory.PROBABLE;
        }

        reasoning.add(onsetPlausible ? "Temporal sequence present" : "Temporal sequence not assessed");
        if (!features.alternativesAssessed()) {
            reasoning.add("alternative causes not assessed");
        } else if (alternatives == 1) {
            reasoning.add("alternative cause exists: " + features.alternativeCauses().get(0));
        }
        if (Boolean.TRUE.equals(features.concomitantDrugsCouldCause())) {
            reasoning.add("concomitant drugs could contribute");
        }
        return CausalityCategory.POSSIBLE;
    }

    List<NaranjoAnswer> naranjoAnswers(ClinicalFeatures features) {
        List<NaranjoAnswer> answers = new ArrayList<>(10);

        answers.add(yesNo(1, "Are there previous conclusive reports on this reaction?",
                features.knownReaction(), 1, 0));

        Integer onset = features.timeToOnsetDays();
        answers.add(yesNo(2, "Did the adverse event appear after the suspected drug was given?",
                onset == null ? null : onset >= 0, 2, -1));

        answers.add(yesNo(3, "Did the adverse reaction improve when the drug was discontinued?",
                features.dechallengeImproved() ? Boolean.TRUE : null, 1, 0));

        answers.add(yesNo(4, "Did the adverse reaction reappear when the drug was readministered?",
                features.rechallengeRecurred(), 2, -1));

        Boolean alternativesPresent = features.alternativesAssessed() ? features.alternativeCauseCount() > 0 : null;
        answers.add(yesNo(5, "Are there alternative causes that could have caused the reaction?",
                alternativesPresent, -1, 2));

        answers.add(new NaranjoAnswer(6, "Did the reaction reappear when a placebo was given?", Answer.UNKNOWN, 0));

        answers.add(yesNo(7, "Was the drug detected in blood or other fluids in toxic concentrations?",
                features.toxicDrugLevel(), 1, 0));

        answers.add(yesNo(8, "Was the reaction more severe when the dose was increased?",
                features.doseResponse() ? Boolean.TRUE : null, 1, 0));

        answers.add(yesNo(9, "Did the patient have a similar reaction to the same or similar drugs before?",
                features.previousSimilarReaction(), 1, 0));

        answers.add(yesNo(10, "Was the adverse event confirmed by objective evidence?",
                features.labEvidence(), 1, 0));

        return answers;
    }

    private static NaranjoAnswer yesNo(int question, String text, Boolean value, int yesPoints, int noPoints) {
        if (value == null) {
            return new NaranjoAnswer(question, text, Answer.UNKNOWN, 0);
        }
        return value
                ? new NaranjoAnswer(question, text, Answer.YES, yesPoints)
                : new NaranjoAnswer(question, text, Answer.NO, noPoints);
    }

    double confidence(CausalityCategory category, int naranjoScore, ClinicalFeatures features) {
        double naranjoBoost = 0.0;
        if (naranjoScore >= NaranjoCategory.DEFINITE.getMinimumScore()) {
            naranjoBoost = 0.10;
        } else if (naranjoScore >= NaranjoCategory.PROBABLE.getMinimumScore()) {
            naranjoBoost = 0.05;
        }

        double evidenceBoost = 0.0;
        if (Boolean.TRUE.equals(features.rechallengeRecurred())) {
            evidenceBoost += 0.15;
        } else if (features.dechallengeImproved()) {
            evidenceBoost += 0.08;
        }
        if (features.alternativesAssessed() && features.alternativeCauseCount() == 0) {
            evidenceBoost += 0.05;
        }
        return Math.min(category.getBaseConfidence() + naranjoBoost + evidenceBoost, MAX_CONFIDENCE);
    }

    private static void identifyFactors(
            ClinicalFeatures features, List<String> primary, List<String> supporting, List<String> conflicting) {
        Integer onset = features.timeToOnsetDays();
        if (onset != null) {
            if (onset <= 7) {
                primary.add("Temporal relationship strong (onset in " + onset + " days)");
            } else if (onset <= 30) {
                supporting.add("Temporal relationship present (onset in " + onset + " days)");
            } else {
                conflicting.add("Delayed onset (" + onset + " days)");
            }
        }
        if (features.dechallengeImproved()) {
            primary.add("Positive de-challenge (event improved when drug stopped)");
        }
        if (Boolean.TRUE.equals(features.rechallengeRecurred())) {
            primary.add("Positive re-challenge (event recurred when drug restarted)");
        }
        if (features.doseResponse()) {
            primary.add("Dose-response relationship observed");
        }
        if (features.alternativesAssessed()) {
            if (features.alternativeCauseCount() > 0) {
                conflicting.add("Alternative causes present: " + String.join(", ", features.alternativeCauses()));
            } else {
                supporting.add("No alternative causes identified");
            }
        }
        if (Boolean.TRUE.equals(features.knownReaction())) {
            supporting.add("Known reaction for this drug");
        }
        if (Boolean.TRUE.equals(features.labEvidence())) {
            supporting.add("Confirmed by objective evidence");
        }
        if (Boolean.TRUE.equals(features.concomitantDrugsCouldCause())) {
            conflicting.add("Concomitant medications could contribute");
        }
    }

    static LatencyConsistency latencyConsistency(ClinicalFeatures features, LatencyStats latency) {
        Integer onset = features.timeToOnsetDays();
        if (onset == null || latency == null || latency.caseCount() == 0) {
            return null;
        }
        boolean consistent = onset >= latency.q1Days() && onset <= latency.q3Days();
        return new LatencyConsistency(onset, latency.q1Days(), latency.q3Days(), consistent);
    }

    private static String recommendation(CausalityCategory category) {
        switch (category) {
            case CERTAIN:
            case PROBABLE:
                return "Strong causal relationship established. Consider as validated signal.";
            case POSSIBLE:
                return "Possible causal relationship. Further evaluation recommended.";
            case UNLIKELY:
                return "Causal relationship unlikely. Consider alternative causes.";
            default:
                return "Insufficient data for causality assessment.";
        }
    }

    private static String clinicalAction(CausalityCategory category) {
        switch (category) {
            case CERTAIN:
            case PROBABLE:
                return "Recommend drug discontinuation or close monitoring. "
                        + "Report to regulatory authorities if serious.";
            case POSSIBLE:
                return "Continue monitoring. Consider dose adjustment or alternative therapy. "
                        + "Document in patient record.";
            case UNLIKELY:
                return "May continue therapy if clinical benefit outweighs risk. "
                        + "Investigate alternative etiologies.";
            default:
                return "Gather additional information: de-challenge/re-challenge data, "
                        + "concomitant medications, timing, alternative causes.";
        }
    }
}
