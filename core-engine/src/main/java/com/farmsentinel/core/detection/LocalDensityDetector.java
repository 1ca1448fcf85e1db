package com.farmsentinel.core.detection;

import com.farmsentinel.core.config.DetectorSettings;
import com.farmsentinel.core.error.InsufficientDataException;
import com.farmsentinel.core.model.DetectionResult;
import com.farmsentinel.core.model.DetectorKind;
import com.farmsentinel.core.model.SignalPoint;
import com.farmsentinel.core.model.SignalWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Local outlier factor over the k nearest neighbours in the fitted window.
 *
 * <p>
 * The reachability distance of {@code p} from neighbour {@code o} is
 * {@code max(kDistance(o), d(p, o))}; the local reachability density is the
 * inverse of its mean over the neighbours (plus 1e-10 so duplicates stay
 * finite). LOF is the neighbours' mean density over the point's density.
 * </p>
 *
 * <h3>Normalization</h3>
 * <p>
 * {@code 1 - 1/LOF} for LOF above 1, else 0. A point as dense as its
 * neighbourhood, including every point of a constant window, scores 0.
 * </p>
 *
 * <h3>Window members</h3>
 * <p>
 * A point whose timestamp belongs to the fitted window is scored against the
 * other members only, so it is not its own nearest neighbour.
 * </p>
 *
 * @since 1.0.0
 */
public final class LocalDensityDetector implements Detector<LocalDensityModel> {

    private static final Logger LOG = LoggerFactory.getLogger(LocalDensityDetector.class);

    static final double DENSITY_EPSILON = 1e-10;

    private final int neighbors;

    public LocalDensityDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.neighbors = settings.getNeighbors();
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.LOCAL_DENSITY;
    }

    @Override
    public Class<LocalDensityModel> modelType() {
        return LocalDensityModel.class;
    }

    @Override
    public LocalDensityModel fit(SignalWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.size() <= neighbors) {
            throw new InsufficientDataException(kind(),
                    "needs more than " + neighbors + " points, window has " + window.size());
        }

        double[][] features = window.features();
        int n = features.length;
        Map<Instant, Integer> indexByTimestamp = new HashMap<>();
        for (int i = 0; i < n; i++) {
            indexByTimestamp.put(window.getPoints().get(i).getTimestamp(), i);
        }

        int[][] neighbourhoods = new int[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            Neighbour[] nearest = nearest(features, features[i], i);
            neighbourhoods[i] = new int[nearest.length];
            for (int j = 0; j < nearest.length; j++) {
                neighbourhoods[i][j] = nearest[j].index;
            }
            kDistance[i] = nearest[nearest.length - 1].distance;
        }

        double[] density = new double[n];
        for (int i = 0; i < n; i++) {
            double reach = 0.0;
            for (int o : neighbourhoods[i]) {
                reach += Math.max(kDistance[o], SeriesMath.euclidean(features[i], features[o]));
            }
            density[i] = 1.0 / (reach / neighbourhoods[i].length + DENSITY_EPSILON);
        }

        LOG.debug("Fitted local density for {}: n={}, k={}", window.getMetricName(), n, neighbors);
        return new LocalDensityModel(window.getMetricName(), neighbors, features, indexByTimestamp, kDistance, density);
    }

    @Override
    public List<DetectionResult> score(LocalDensityModel model, List<SignalPoint> points) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(points, "points must not be null");

        double[][] training = new double[model.getTrainingSize()][];
        for (int i = 0; i < training.length; i++) {
            training[i] = model.row(i);
        }

        List<DetectionResult> results = new ArrayList<>(points.size());
        for (SignalPoint p : points) {
            double[] row = { p.getValue() };
            Neighbour[] nearest = nearest(training, row, model.indexOf(p.getTimestamp()));

            double reach = 0.0;
            double neighbourDensity = 0.0;
            for (Neighbour o : nearest) {
                reach += Math.max(model.kDistance(o.index), o.distance);
                neighbourDensity += model.reachabilityDensity(o.index);
            }
            double density = 1.0 / (reach / nearest.length + DENSITY_EPSILON);
            double lof = (neighbourDensity / nearest.length) / density;
            double normalized = lof > 1.0 + SeriesMath.RELATIVE_EPSILON ? SeriesMath.clip01(1.0 - 1.0 / lof) : 0.0;

            Map<String, Double> diagnostics = new LinkedHashMap<>();
            diagnostics.put("lof", lof);
            diagnostics.put("neighbors", (double) nearest.length);
            diagnostics.put("density", density);
            results.add(new DetectionResult(model.getMetricName(), p.getTimestamp(), p.getValue(),
                    lof, normalized, kind(), diagnostics));
        }
        return results;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Neighbour[] nearest(double[][] training, double[] row, int excludeIndex) {
        List<Neighbour> candidates = new ArrayList<>(training.length);
        for (int j = 0; j < training.length; j++) {
            if (j != excludeIndex) {
                candidates.add(new Neighbour(j, SeriesMath.euclidean(row, training[j])));
            }
        }
        candidates.sort(Comparator.comparingDouble((Neighbour nb) -> nb.distance).thenComparingInt(nb -> nb.index));
        int k = Math.min(neighbors, candidates.size());
        return Arrays.copyOf(candidates.toArray(new Neighbour[0]), k);
    }

    private static final class Neighbour {
        private final int index;
        private final double distance;

        private Neighbour(int index, double distance) {
            this.index = index;
            this.distance = distance;
        }
    }
}
