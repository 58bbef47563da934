package io.b2mash.maxify.config;

import io.b2mash.maxify.configimport.ImportStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.context.properties.bind.Name;

/**
 * Application settings under {@code maxify.*}.
 *
 * @param importSettings defaults for configuration imports ({@code maxify.import.*})
 */
@ConfigurationProperties(prefix = "maxify")
public record MaxifyProperties(@Name("import") @DefaultValue Import importSettings) {

  /**
   * @param defaultSource definition file used when an import names none
   * @param defaultStrategy strategy used when an import names none
   */
  public record Import(
      @DefaultValue("maxify.yaml") String defaultSource,
      @DefaultValue("ABORT") ImportStrategy defaultStrategy) {}
}
