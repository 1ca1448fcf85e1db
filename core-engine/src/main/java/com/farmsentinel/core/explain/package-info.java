/**
 * Ranked explanations of combined anomaly scores.
 */
package com.farmsentinel.core.explain;
