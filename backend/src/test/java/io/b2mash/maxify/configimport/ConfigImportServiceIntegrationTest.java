package io.b2mash.maxify.configimport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

import io.b2mash.maxify.exception.ConfigException;
import io.b2mash.maxify.exception.ProjectConflictException;
import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.project.Project;
import io.b2mash.maxify.project.ProjectStore;
import io.b2mash.maxify.task.DataPointRepository;
import io.b2mash.maxify.task.TaskRepository;
import io.b2mash.maxify.unit.ValueKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

@SpringBootTest
@ActiveProfiles("test")
class ConfigImportServiceIntegrationTest {

  private static final String ROCKET_WITH_REVIEW_TIME =
      """
      projects:
        - name: Rocket
          organization: Acme
          desc: Refreshed
          metrics:
            - name: Story Points
              metric_type: Integer
              value_range: [1, 2, 3, 5, 8, 13]
            - name: Review Time
              metric_type: Duration
        - name: Satellite
          organization: Acme
          metrics:
            - name: Story Points
              metric_type: Integer
      """;

  @Autowired private ConfigImportService configImportService;
  @Autowired private ProjectStore projectStore;
  @Autowired private TaskRepository taskRepository;
  @Autowired private DataPointRepository dataPointRepository;
  @MockitoSpyBean private ProjectMerger projectMerger;

  @TempDir Path dir;

  @BeforeEach
  void seedExistingProject() {
    projectStore.delete(projectStore.listAll().toArray(new Project[0]));

    var rocket = new Project("Rocket", "Acme", "Original");
    var points = rocket.addMetric(new Metric("Story Points", ValueKind.INTEGER));
    points.updateDefinition("Estimate", List.of(1L, 2L, 3L, 5L, 8L), null);
    rocket.addMetric(new Metric("Coding Time", ValueKind.DURATION));
    rocket.task("Launch").record(points, 5L);
    projectStore.save(rocket);
  }

  @Test
  void abortRejectsConflictsAndPersistsNothing() throws IOException {
    var source = write("conf.yaml", ROCKET_WITH_REVIEW_TIME);

    assertThatThrownBy(() -> configImportService.importConfig(source, ImportStrategy.ABORT))
        .isInstanceOf(ProjectConflictException.class)
        .satisfies(
            e ->
                assertThat(((ProjectConflictException) e).getConflictingNames())
                    .containsExactly("acme/rocket"));

    assertThat(projectStore.listAll())
        .extracting(Project::getQualifiedName)
        .containsExactly("acme/rocket");
    assertThat(projectStore.requireByQualifiedName("acme/rocket").getDescription())
        .isEqualTo("Original");
  }

  @Test
  void abortSavesAllCandidatesWithoutConflicts() throws IOException {
    var source =
        write(
            "conf.yaml",
            """
            projects:
              - name: Probe
                metrics:
                  - name: Points
                    metric_type: int
            """);

    var result = configImportService.importConfig(source, ImportStrategy.ABORT);

    assertThat(result.projects()).extracting(Project::getQualifiedName).containsExactly("probe");
    assertThat(projectStore.listAll()).hasSize(2);
  }

  @Test
  void overwriteReplacesConflictingProjectEntirely() throws IOException {
    var source = write("conf.yaml", ROCKET_WITH_REVIEW_TIME);

    configImportService.importConfig(source, ImportStrategy.OVERWRITE);

    var rocket = projectStore.requireByQualifiedName("acme/rocket");
    assertThat(rocket.getDescription()).isEqualTo("Refreshed");
    assertThat(rocket.getMetrics())
        .extracting(Metric::getName)
        .containsExactly("Story Points", "Review Time");
    assertThat(rocket.getTasks()).isEmpty();
    assertThat(taskRepository.count()).isZero();
    assertThat(dataPointRepository.count()).isZero();
    assertThat(projectStore.getByQualifiedName("acme/satellite")).isPresent();
  }

  @Test
  void mergeAddsNewMetricsAndKeepsTaskData() throws IOException {
    var source = write("conf.yaml", ROCKET_WITH_REVIEW_TIME);

    var result = configImportService.importConfig(source, ImportStrategy.MERGE);

    assertThat(result.warnings()).isEmpty();
    assertThat(result.projects())
        .extracting(Project::getQualifiedName)
        .containsExactly("acme/rocket", "acme/satellite");

    var rocket = projectStore.requireByQualifiedName("acme/rocket");
    assertThat(rocket.getDescription()).isEqualTo("Refreshed");
    assertThat(rocket.getMetrics())
        .extracting(Metric::getName)
        .containsExactly("Story Points", "Coding Time", "Review Time");

    var points = rocket.findMetric("Story Points").orElseThrow();
    assertThat(points.getAllowedValues()).containsExactly(1L, 2L, 3L, 5L, 8L, 13L);
    assertThat(points.getDescription()).isNull();
    assertThat(rocket.findTask("Launch").orElseThrow().total(points)).contains(5L);
  }

  @Test
  void mergeSkipsMetricWhoseTypeChanged() throws IOException {
    var source =
        write(
            "conf.yaml",
            """
            projects:
              - name: Rocket
                organization: Acme
                metrics:
                  - name: Story Points
                    metric_type: String
            """);

    var result = configImportService.importConfig(source, ImportStrategy.MERGE);

    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0)).contains("Story Points");
    var points =
        projectStore.requireByQualifiedName("acme/rocket").findMetric("Story Points").orElseThrow();
    assertThat(points.getValueKind()).isEqualTo(ValueKind.INTEGER);
    assertThat(points.getDescription()).isEqualTo("Estimate");
  }

  @Test
  void invalidSourceIsAConfigErrorAndLeavesStoreUnchanged() throws IOException {
    var source =
        write(
            "conf.yaml",
            """
            projects:
              - name: Rocket
                organization: Acme
                metrics:
                  - name: Story Points
                    metric_type: Bogus
            """);

    assertThatThrownBy(() -> configImportService.importConfig(source, ImportStrategy.OVERWRITE))
        .isInstanceOf(ConfigException.class);
    assertThatThrownBy(
            () -> configImportService.importConfig(dir.resolve("missing.yaml").toString(), null))
        .isInstanceOf(ConfigException.class);

    assertThat(projectStore.requireByQualifiedName("acme/rocket").getTasks()).hasSize(1);
  }

  @Test
  void failureDuringMergeRollsBackEarlierWrites() throws IOException {
    var source =
        write(
            "conf.yaml",
            """
            projects:
              - name: Fresh
                metrics:
                  - name: Points
                    metric_type: Integer
              - name: Rocket
                organization: Acme
                desc: Should not stick
            """);
    doThrow(new IllegalStateException("merge failed")).when(projectMerger).merge(any(), any());

    assertThatThrownBy(() -> configImportService.importConfig(source, ImportStrategy.MERGE))
        .hasMessage("merge failed");

    assertThat(projectStore.getByQualifiedName("fresh")).isEmpty();
    assertThat(projectStore.requireByQualifiedName("acme/rocket").getDescription())
        .isEqualTo("Original");
  }

  private String write(String fileName, String content) throws IOException {
    return Files.writeString(dir.resolve(fileName), content).toString();
  }
}
