/**
 * Command-line entry points for rackd discovery.
 * <p><strong>Role:</strong> Adapter layer that parses {@code key=value} arguments, merges YAML configuration,
 * wires the scanner through {@code CompositionRoot} and maps outcomes onto {@link ca.gc.cra.rackd.api.ExitCode}.</p>
 * <p><strong>Output:</strong> Usage text, dry-run plans and scan summaries go through {@link ca.gc.cra.rackd.api.CliPrinter};
 * diagnostics go through SLF4J.</p>
 */
package ca.gc.cra.rackd.api;
