/**
 * Unchecked exception hierarchy rooted at
 * {@link com.farmsentinel.core.error.DetectionException}.
 *
 * <p>
 * Per-detector failures ({@code InsufficientData}, {@code FitFailure}) are
 * recovered inside the ensemble; {@code NoData}, {@code NotFound} and
 * {@code AllDetectorsFailed} reach the caller.
 * </p>
 */
package com.farmsentinel.core.error;
