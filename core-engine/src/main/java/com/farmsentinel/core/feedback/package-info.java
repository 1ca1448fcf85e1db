/**
 * Operator feedback on anomaly records, kept as an audit trail.
 */
package com.farmsentinel.core.feedback;
