/**
 * Weighted combination of detector scores and severity classification.
 */
package com.farmsentinel.core.ensemble;
