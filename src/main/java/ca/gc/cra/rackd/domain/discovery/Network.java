package ca.gc.cra.rackd.domain.discovery;

import java.util.Objects;

/**
 * Inventory network whose subnet is scanned.
 *
 * @param id network identifier
 * @param name display name; may be empty
 * @param subnet CIDR block such as {@code 192.168.1.0/24}
 * @param datacenterId owning datacenter; may be empty
 * @param description free-form description; may be empty
 * @since 0.1.0
 */
public record Network(String id, String name, String subnet, String datacenterId, String description) {
  public Network {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(subnet, "subnet");
    name = Objects.requireNonNullElse(name, "");
    datacenterId = Objects.requireNonNullElse(datacenterId, "");
    description = Objects.requireNonNullElse(description, "");
  }

  /**
   * Creates a network with only an id, name and subnet.
   *
   * @param id network identifier
   * @param name display name
   * @param subnet CIDR block
   * @return network without datacenter or description
   */
  public static Network of(String id, String name, String subnet) {
    return new Network(id, name, subnet, "", "");
  }
}
