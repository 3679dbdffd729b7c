/**
 * Packet extraction: assembling one packet section and walking the page's state/direction tree.
 * <p><strong>Errors:</strong> Symmetry errors skip a single packet; dialect and format errors abort
 * the walk.</p>
 */
package ca.gc.cra.protomine.application.extract;
