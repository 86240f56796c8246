/**
 * Core domain model for NETWATCH capture, telemetry and threat scoring.
 * <p><strong>Role:</strong> Domain layer describing packets, flows and aggregate telemetry without infrastructure
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted ({@code RingBuffer} relies on its owner's
 * lock).</p>
 * <p><strong>Metrics:</strong> Domain values feed the {@code capture.*}, {@code telemetry.*} and
 * {@code dashboard.*} counters.</p>
 */
package ca.gc.cra.netwatch.domain;
