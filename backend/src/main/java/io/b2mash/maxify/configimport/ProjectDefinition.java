package io.b2mash.maxify.configimport;

import java.util.List;

/** One project entry of a definition document. */
public record ProjectDefinition(
    String name, String organization, String desc, List<MetricDefinition> metrics) {

  public ProjectDefinition {
    if (metrics == null) {
      metrics = List.of();
    }
  }
}
