/**
 * Application pipeline coordinating page retrieval, section splitting and packet extraction.
 * <p>Pipelines accept validated configuration (see {@code ca.gc.cra.protomine.config}) and surface
 * counters via {@link ca.gc.cra.protomine.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.protomine.application.pipeline;
