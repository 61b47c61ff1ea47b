/**
 * SLO evaluation: rolling good/bad counters, multi-window burn rates, error
 * budget and the alert state machine with hysteresis.
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.slo;
