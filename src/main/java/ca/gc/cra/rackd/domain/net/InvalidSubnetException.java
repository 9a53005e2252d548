package ca.gc.cra.rackd.domain.net;

/**
 * Signals a subnet that cannot be parsed or enumerated.
 *
 * @since 0.1.0
 */
public class InvalidSubnetException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a description of the rejected subnet.
   *
   * @param message failure description
   */
  public InvalidSubnetException(String message) {
    super(message);
  }
}
