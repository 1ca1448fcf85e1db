/**
 * Standalone HTTP service exposing room and farm anomaly detection, anomaly
 * lookup and operator feedback over JSON.
 */
package com.farmsentinel.service;
