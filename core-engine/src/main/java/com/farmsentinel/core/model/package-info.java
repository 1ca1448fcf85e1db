/**
 * Immutable value types exchanged between the detectors, the ensemble and the
 * anomaly sink: signal windows, per-detector results, combined scores and
 * anomaly records.
 */
package com.farmsentinel.core.model;
