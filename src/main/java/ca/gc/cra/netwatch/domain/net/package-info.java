/**
 * Network value objects shared by capture, decoding, telemetry and export.
 * <p><strong>Role:</strong> Domain layer; no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across the ingestion and render
 * threads.</p>
 * <p><strong>Security:</strong> Records carry addresses but never payload bytes.</p>
 */
package ca.gc.cra.netwatch.domain.net;
