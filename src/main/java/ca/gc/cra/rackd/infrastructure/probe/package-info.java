/**
 * Network probe adapters: ICMP reachability, neighbour-table MAC lookup, reverse DNS, TCP connect scan and
 * banner grabbing.
 * <p><strong>Concurrency:</strong> Adapters are immutable and shared by every host worker; the port prober fans
 * out on its own daemon pool.</p>
 * <p><strong>Security:</strong> Only connect-level probing is performed; banners are sanitized before logging.</p>
 */
package ca.gc.cra.rackd.infrastructure.probe;
