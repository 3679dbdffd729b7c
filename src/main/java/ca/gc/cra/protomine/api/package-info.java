/**
 * Command-line entry points: the {@code protomine} dispatcher and its {@code extract} and
 * {@code shape} commands.
 * <p>Arguments are {@code key=value} pairs plus {@code --flags}; results go to stdout through
 * {@link ca.gc.cra.protomine.api.CliPrinter} and diagnostics go to the log.</p>
 */
package ca.gc.cra.protomine.api;
