/**
 * Page sources backed by saved markup files.
 */
package ca.gc.cra.protomine.infrastructure.source;
