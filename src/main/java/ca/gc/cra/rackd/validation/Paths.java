package ca.gc.cra.rackd.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for report output paths.
 * <p><strong>Why:</strong> A scan can take minutes; a bad {@code out=} path should fail before probing starts,
 * not after.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between validation and use.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked directory is not mistaken for a file.
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {}

  /**
   * Validates a file path that will be created or replaced.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path contains control characters, names a directory, or its nearest
   *     existing ancestor is not a writable directory
   */
  public static Path requireWritableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    Path ancestor = normalized.getParent();
    while (ancestor != null && !Files.exists(ancestor, LinkOption.NOFOLLOW_LINKS)) {
      ancestor = ancestor.getParent();
    }
    if (ancestor == null || !Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
      throw new IllegalArgumentException(name + " has no writable parent directory: " + normalized);
    }
    return normalized;
  }
}
