/**
 * YAML-backed deployment configuration: detector hyperparameters, default
 * ensemble weights, severity tiers and cache lifetimes.
 */
package com.farmsentinel.core.config;
