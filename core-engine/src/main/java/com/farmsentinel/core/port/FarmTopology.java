package com.farmsentinel.core.port;

import java.util.List;
import java.util.Optional;

/**
 * Farm, room and metric layout known to the data source.
 *
 * @since 1.0.0
 */
public interface FarmTopology {

    /**
     * @return rooms of the farm in a stable order; empty if the farm is unknown
     */
    List<String> roomsOf(String farmId);

    Optional<String> farmOf(String roomId);

    /**
     * @return metrics recorded for the room; empty if the room is unknown
     */
    List<String> metricsOf(String roomId);
}
