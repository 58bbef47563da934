package io.b2mash.maxify.configimport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.maxify.exception.ConfigException;
import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.unit.ValueKind;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.json.JsonMapper;

class DocumentProjectDefinitionLoaderTest {

  private final DocumentProjectDefinitionLoader loader =
      new DocumentProjectDefinitionLoader(JsonMapper.builder().build());

  @TempDir Path dir;

  @Test
  void loadsYamlDefinitions() throws IOException {
    var file =
        write(
            "maxify.yaml",
            """
            projects:
              - name: Rocket
                organization: Acme
                desc: Launch vehicle
                metrics:
                  - name: Story Points
                    metric_type: Integer
                    value_range: [1, 2, 3, 5, 8]
                    default_value: 3
                  - name: Coding Time
                    metric_type: duration
                    desc: Time spent coding
                  - name: Rate
                    metric_type: Number
                    default_value: 1.5
              - name: Notes
                metrics:
                  - name: Summary
                    metric_type: String
            """);

    var projects = loader.load(file);

    assertThat(projects).hasSize(2);
    var rocket = projects.get(0);
    assertThat(rocket.getQualifiedName()).isEqualTo("Acme/Rocket");
    assertThat(rocket.getDescription()).isEqualTo("Launch vehicle");
    assertThat(rocket.getMetrics())
        .extracting(Metric::getName)
        .containsExactly("Story Points", "Coding Time", "Rate");

    var points = rocket.findMetric("Story Points").orElseThrow();
    assertThat(points.getValueKind()).isEqualTo(ValueKind.INTEGER);
    assertThat(points.getAllowedValues()).containsExactly(1L, 2L, 3L, 5L, 8L);
    assertThat(points.getDefaultValue()).isEqualTo(3L);

    assertThat(rocket.findMetric("Coding Time").orElseThrow().getDescription())
        .isEqualTo("Time spent coding");
    assertThat((BigDecimal) rocket.findMetric("Rate").orElseThrow().getDefaultValue())
        .isEqualByComparingTo("1.5");
    assertThat(projects.get(1).getOrganization()).isNull();
  }

  @Test
  void loadsJsonDefinitions() throws IOException {
    var file =
        write(
            "maxify.json",
            """
            {"projects": [{"name": "Rocket", "metrics": [
              {"name": "Coding Time", "metric_type": "Duration", "value_range": ["1h", "2h"]}
            ]}]}
            """);

    var projects = loader.load(file);

    var metric = projects.get(0).findMetric("Coding Time").orElseThrow();
    assertThat(metric.getAllowedValues())
        .hasSize(2)
        .allSatisfy(v -> assertThat(v).isInstanceOf(BigDecimal.class));
  }

  @Test
  void missingFileIsAConfigError() {
    assertThatThrownBy(() -> loader.load(dir.resolve("absent.yaml")))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void unsupportedExtensionIsAConfigError() throws IOException {
    var file = write("maxify.toml", "projects = []");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("Unsupported");
  }

  @Test
  void malformedDocumentIsAConfigError() throws IOException {
    var file = write("broken.yaml", "projects: [ {name: \"Rocket\"");

    assertThatThrownBy(() -> loader.load(file)).isInstanceOf(ConfigException.class);
  }

  @Test
  void missingProjectsSectionIsAConfigError() throws IOException {
    var file = write("empty.yaml", "other: 1\n");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("projects");
  }

  @Test
  void unknownMetricTypeIsAConfigError() throws IOException {
    var file =
        write(
            "maxify.yaml",
            """
            projects:
              - name: Rocket
                metrics:
                  - name: Done
                    metric_type: Boolean
            """);

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("Boolean");
  }

  @Test
  void missingMetricTypeIsAConfigError() throws IOException {
    var file =
        write(
            "maxify.yaml",
            """
            projects:
              - name: Rocket
                metrics:
                  - name: Done
            """);

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("metric_type");
  }

  @Test
  void missingProjectNameIsAConfigError() throws IOException {
    var file = write("maxify.yaml", "projects:\n  - desc: nameless\n");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("name");
  }

  @Test
  void duplicateMetricNameIsAConfigError() throws IOException {
    var file =
        write(
            "maxify.yaml",
            """
            projects:
              - name: Rocket
                metrics:
                  - name: Points
                    metric_type: Integer
                  - name: Points
                    metric_type: Integer
            """);

    assertThatThrownBy(() -> loader.load(file)).isInstanceOf(ConfigException.class);
  }

  @Test
  void duplicateProjectIsAConfigError() throws IOException {
    var file =
        write(
            "maxify.yaml",
            """
            projects:
              - name: Rocket
                organization: Acme
              - name: rocket
                organization: ACME
            """);

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("more than once");
  }

  @Test
  void unparseableDefaultIsAConfigError() throws IOException {
    var file =
        write(
            "maxify.yaml",
            """
            projects:
              - name: Rocket
                metrics:
                  - name: Points
                    metric_type: Integer
                    default_value: lots
            """);

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("Points");
  }

  @Test
  void defaultOutsideRangeIsAConfigError() throws IOException {
    var file =
        write(
            "maxify.yaml",
            """
            projects:
              - name: Rocket
                metrics:
                  - name: Points
                    metric_type: Integer
                    value_range: [1, 2, 3]
                    default_value: 5
            """);

    assertThatThrownBy(() -> loader.load(file)).isInstanceOf(ConfigException.class);
  }

  private Path write(String fileName, String content) throws IOException {
    return Files.writeString(dir.resolve(fileName), content);
  }
}
