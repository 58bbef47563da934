package io.b2mash.maxify.project;

import java.util.Locale;

/**
 * The {@code organization/name} identity of a project, or the bare name when the project belongs to
 * no organization. Splitting happens on the first separator, which is why neither part may contain
 * one.
 */
public record QualifiedName(String organization, String name) {

  public static final String SEPARATOR = "/";

  public static QualifiedName parse(String qualifiedName) {
    int index = qualifiedName.indexOf(SEPARATOR);
    if (index < 0) {
      return new QualifiedName(null, qualifiedName);
    }
    return new QualifiedName(
        qualifiedName.substring(0, index), qualifiedName.substring(index + 1));
  }

  /** The canonical (lowercase) form used for identity comparisons in the store. */
  public QualifiedName canonical() {
    return new QualifiedName(
        organization != null ? organization.toLowerCase(Locale.ROOT) : null,
        name.toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return organization == null || organization.isEmpty() ? name : organization + SEPARATOR + name;
  }
}
