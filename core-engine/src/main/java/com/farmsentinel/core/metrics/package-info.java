/**
 * Micrometer instrumentation for detection, fitting and the result cache.
 */
package com.farmsentinel.core.metrics;
