package ca.gc.cra.rackd.domain.discovery;

/** Liveness verdict recorded on a discovered device. */
public enum DeviceStatus {
  /** No ICMP reply and no open port observed. */
  UNKNOWN("unknown"),
  /** ICMP reply received or at least one port accepted a connection. */
  ONLINE("online");

  private final String wireName;

  DeviceStatus(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lower-case name used in persisted records.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }
}
