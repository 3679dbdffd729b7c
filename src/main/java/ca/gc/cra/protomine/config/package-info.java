/**
 * Configuration records and composition root wiring for the protomine CLI.
 * <p><strong>Role:</strong> Bootstrap layer merging defaults, YAML and CLI overrides, then selecting
 * the page source and metrics adapter.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates paths and labels through {@code ca.gc.cra.protomine.validation}.</p>
 */
package ca.gc.cra.protomine.config;
