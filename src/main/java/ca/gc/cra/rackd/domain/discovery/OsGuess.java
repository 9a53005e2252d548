package ca.gc.cra.rackd.domain.discovery;

import java.util.Objects;

/**
 * Best-effort operating system guess and family.
 *
 * @param os operating system label such as {@code "Windows"} or {@code "Linux"}
 * @param family family label such as {@code "Windows"} or {@code "Unix"}
 * @since 0.1.0
 */
public record OsGuess(String os, String family) {
  /** Label used when no port or service pattern matched. */
  public static final String UNKNOWN_LABEL = "Unknown";
  /** Guess recorded when the heuristic found nothing. */
  public static final OsGuess UNKNOWN = new OsGuess(UNKNOWN_LABEL, UNKNOWN_LABEL);

  public OsGuess {
    Objects.requireNonNull(os, "os");
    Objects.requireNonNull(family, "family");
  }

  /**
   * Indicates whether the family is still undetermined.
   *
   * @return {@code true} when the family is {@value #UNKNOWN_LABEL}
   */
  public boolean isUnknownFamily() {
    return UNKNOWN_LABEL.equals(family);
  }
}
