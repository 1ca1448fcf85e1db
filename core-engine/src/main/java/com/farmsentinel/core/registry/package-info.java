/**
 * Fitted-model cache keyed by (room, metric) with TTL expiry and per-key fit
 * coalescing.
 */
package com.farmsentinel.core.registry;
