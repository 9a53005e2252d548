package ca.gc.cra.rackd.application.port;

/**
 * Raised by {@link DiscoveryStorePort#getNetwork(String)} when no network has the requested id.
 *
 * @since 0.1.0
 */
public class NetworkNotFoundException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String networkId;

  /**
   * Creates the exception for a missing network.
   *
   * @param networkId id that was looked up
   */
  public NetworkNotFoundException(String networkId) {
    super("network not found: " + networkId);
    this.networkId = networkId;
  }

  /** @return id that was looked up */
  public String networkId() {
    return networkId;
  }
}
