/**
 * The four detection strategies combined by the ensemble.
 *
 * <p>
 * Every strategy implements the sealed
 * {@link com.farmsentinel.core.detection.Detector} interface, fits an
 * immutable {@link com.farmsentinel.core.detection.DetectorModel} and is
 * created through {@link com.farmsentinel.core.detection.DetectorFactory}:
 * </p>
 * <ul>
 * <li>{@link com.farmsentinel.core.detection.GlobalOutlierDetector}: isolation
 * forest</li>
 * <li>{@link com.farmsentinel.core.detection.LocalDensityDetector}: local
 * outlier factor</li>
 * <li>{@link com.farmsentinel.core.detection.StatisticalThresholdDetector}:
 * z-score and Tukey fences</li>
 * <li>{@link com.farmsentinel.core.detection.TemporalPatternDetector}:
 * velocity, trend break and seasonal deviation</li>
 * </ul>
 */
package com.farmsentinel.core.detection;
