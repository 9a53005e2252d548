/**
 * Small stateless helpers shared by the domain layer.
 */
package ca.gc.cra.rackd.domain.util;
