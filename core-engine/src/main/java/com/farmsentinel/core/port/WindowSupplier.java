package com.farmsentinel.core.port;

import com.farmsentinel.core.error.NoDataException;
import com.farmsentinel.core.model.SignalWindow;

/**
 * Source of historical readings.
 *
 * @since 1.0.0
 */
public interface WindowSupplier {

    /**
     * @param days length of the period, in days
     * @return the readings of {@code metricName} in {@code roomId} for the period
     * @throws NoDataException if there are no readings for the period
     */
    SignalWindow fetchWindow(String roomId, String metricName, int days);
}
