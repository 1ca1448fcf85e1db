/**
 * Detection API: room and farm detection, anomaly lookup and feedback, with
 * the detection result cache and anomaly statistics.
 */
package com.farmsentinel.core.service;
