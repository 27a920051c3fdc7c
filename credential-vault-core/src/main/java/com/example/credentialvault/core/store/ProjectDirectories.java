package com.example.credentialvault.core.store;

import com.example.credentialvault.core.exceptions.InvalidNameException;
import java.nio.file.Path;
import java.util.regex.Pattern;

/** Maps a project identifier and resource type onto the location of a credential store. */
public final class ProjectDirectories {

  private static final Pattern INVALID_DIRECTORY_CHARS = Pattern.compile("[\\\\/:*?\"<>|]");

  static final String STORE_FILE_SUFFIX = "_credentials.ini";

  private ProjectDirectories() {}

  /**
   * Removes the characters that are invalid in a Windows file name ({@code \ / : * ? " < > |})
   * and surrounding whitespace. The Windows set is applied on every platform so a project maps to
   * the same directory everywhere.
   *
   * @param projectIdentifier raw project identifier
   * @return directory-safe name
   * @throws InvalidNameException if nothing is left after sanitizing
   */
  public static String sanitize(final String projectIdentifier) {
    final var sanitized =
        projectIdentifier == null
            ? ""
            : INVALID_DIRECTORY_CHARS.matcher(projectIdentifier).replaceAll("").strip();
    if (sanitized.isEmpty()) {
      throw new InvalidNameException(
          "Project identifier '" + projectIdentifier + "' is empty after sanitization");
    }
    return sanitized;
  }

  /**
   * Resolves {@code <home>/.<sanitized project>/<type>_credentials.ini}.
   *
   * @param home base directory, normally the user's home
   * @param projectIdentifier raw project identifier
   * @param resourceType store partition
   * @return path of the store file (not created)
   */
  public static Path storeFile(
      final Path home, final String projectIdentifier, final ResourceType resourceType) {
    return home.resolve("." + sanitize(projectIdentifier))
        .resolve(resourceType.tag() + STORE_FILE_SUFFIX);
  }
}
