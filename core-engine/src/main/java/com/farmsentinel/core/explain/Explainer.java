package com.farmsentinel.core.explain;

import com.farmsentinel.core.model.AnomalyType;
import com.farmsentinel.core.model.ContributingFactor;
import com.farmsentinel.core.model.DetectionResult;
import com.farmsentinel.core.model.EnsembleScore;
import com.farmsentinel.core.model.EnsembleScore.Contribution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns an {@link EnsembleScore} into ranked, human-readable factors.
 *
 * <h3>Ranking</h3>
 * <p>
 * Factors are ordered by weighted contribution, largest first; ties keep
 * detector order.
 * </p>
 *
 * <h3>Anomaly type</h3>
 * <p>
 * When one detector supplies more than 90% of the combined score the anomaly
 * takes that detector's natural type. Otherwise, or when the combined score is
 * 0, the type is {@link AnomalyType#MULTIVARIATE}.
 * </p>
 *
 * @since 1.0.0
 */
public class Explainer {

    static final double DOMINANCE_SHARE = 0.9;

    /** Ratios this large come from a previously flat second difference. */
    private static final double STEADY_TREND_RATIO = 1e6;

    public Explanation explain(EnsembleScore score) {
        Objects.requireNonNull(score, "score must not be null");

        List<Contribution> ranked = new ArrayList<>(score.getContributions());
        ranked.sort(Comparator.comparingDouble(Contribution::getWeightedScore).reversed());

        List<ContributingFactor> factors = new ArrayList<>(ranked.size());
        for (Contribution c : ranked) {
            factors.add(new ContributingFactor(c.getKind(), c.getWeightedScore(), reasonFor(c.getResult())));
        }

        AnomalyType type = AnomalyType.MULTIVARIATE;
        double combined = score.getCombinedScore();
        if (combined > 0 && !ranked.isEmpty()
                && ranked.get(0).getWeightedScore() > DOMINANCE_SHARE * combined) {
            type = ranked.get(0).getKind().getNaturalType();
        }

        String summary = String.format(Locale.ROOT, "%s %s anomaly in %s (score %.2f)%s",
                capitalize(score.getSeverity().getLabel()), type.getLabel(), score.getMetricName(), combined,
                factors.isEmpty() ? "" : ": " + factors.get(0).getReason());
        return new Explanation(type, factors, summary);
    }

    /**
     * Reason text for one detector's result.
     */
    String reasonFor(DetectionResult r) {
        return switch (r.getKind()) {
            case STATISTICAL_THRESHOLD -> statisticalReason(r);
            case GLOBAL_OUTLIER -> String.format(Locale.ROOT,
                    "value %.2f isolated after %.1f random splits, against %.1f expected for a typical reading",
                    r.getValue(), r.diagnostic("pathLength", 0), r.diagnostic("expectedPathLength", 0));
            case LOCAL_DENSITY -> String.format(Locale.ROOT,
                    "value %.2f sits in a region %.1fx sparser than its %d nearest readings",
                    r.getValue(), r.diagnostic("lof", 1), (int) r.diagnostic("neighbors", 0));
            case TEMPORAL_PATTERN -> temporalReason(r);
        };
    }

    private static String statisticalReason(DetectionResult r) {
        String reason = String.format(Locale.ROOT,
                "value %.2f is %.1f standard deviations from the %d-day mean of %.2f",
                r.getValue(), Math.abs(r.diagnostic("zScore", 0)), (int) r.diagnostic("windowDays", 0),
                r.diagnostic("mean", 0));
        if (r.diagnostic("iqrRuleFired", 0) > 0) {
            reason += String.format(Locale.ROOT, ", outside the expected range [%.2f, %.2f]",
                    r.diagnostic("lowerFence", 0), r.diagnostic("upperFence", 0));
        }
        return reason;
    }

    private static String temporalReason(DetectionResult r) {
        double velocity = r.diagnostic("velocityScore", 0);
        double trend = r.diagnostic("trendBreakScore", 0);
        double seasonal = r.diagnostic("seasonalScore", 0);
        if (velocity == 0 && trend == 0 && seasonal == 0) {
            return "no unusual movement over time";
        }
        if (seasonal >= velocity && seasonal >= trend) {
            return String.format(Locale.ROOT, "value %.2f departs from the usual level at this point of the cycle (%.1f sigma)",
                    r.getValue(), r.diagnostic("seasonalZ", 0));
        }
        if (velocity >= trend) {
            return String.format(Locale.ROOT, "changed by %+.2f since the previous reading (%.1f sigma)",
                    r.diagnostic("firstDifference", 0), r.diagnostic("velocityZ", 0));
        }
        double z = r.diagnostic("trendBreakZ", 0);
        if (z >= STEADY_TREND_RATIO) {
            return "abrupt break in an otherwise steady trend";
        }
        return String.format(Locale.ROOT, "abrupt break in the trend (%.1fx its recent variability)", z);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
