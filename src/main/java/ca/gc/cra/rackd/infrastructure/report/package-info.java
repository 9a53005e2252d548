/**
 * Scan report output.
 * <p>Reports are JSON documents written with Jackson's streaming generator; no data binding is involved.</p>
 */
package ca.gc.cra.rackd.infrastructure.report;
