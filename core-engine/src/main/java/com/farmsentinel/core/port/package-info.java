/**
 * Boundary contracts to the reading source and the anomaly store, with
 * in-memory implementations.
 */
package com.farmsentinel.core.port;
