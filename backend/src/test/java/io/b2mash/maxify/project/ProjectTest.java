package io.b2mash.maxify.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.maxify.exception.ConfigException;
import io.b2mash.maxify.exception.ModelException;
import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.unit.ValueKind;
import org.junit.jupiter.api.Test;

class ProjectTest {

  @Test
  void qualifiedNameIncludesOrganization() {
    assertThat(new Project("Rocket", "Acme", null).getQualifiedName()).isEqualTo("Acme/Rocket");
    assertThat(new Project("Rocket").getQualifiedName()).isEqualTo("Rocket");
    assertThat(new Project("Rocket", "", null).getOrganization()).isNull();
  }

  @Test
  void identityPartsMustNotContainSeparator() {
    assertThatThrownBy(() -> new Project("a/b")).isInstanceOf(ModelException.class);
    assertThatThrownBy(() -> new Project("Rocket", "x/y", null))
        .isInstanceOf(ModelException.class);
    assertThatThrownBy(() -> new Project(" ")).isInstanceOf(ModelException.class);
  }

  @Test
  void duplicateMetricNameIsAConfigErrorAndLeavesMetricsUnchanged() {
    var project = new Project("Rocket");
    var original = project.addMetric(new Metric("Story Points", ValueKind.INTEGER));

    assertThatThrownBy(() -> project.addMetric(new Metric("Story Points", ValueKind.DECIMAL)))
        .isInstanceOf(ConfigException.class);

    assertThat(project.getMetrics()).containsExactly(original);
    assertThat(original.getValueKind()).isEqualTo(ValueKind.INTEGER);
  }

  @Test
  void metricNamesAreCaseSensitiveWhenAdding() {
    var project = new Project("Rocket");
    project.addMetric(new Metric("Points", ValueKind.INTEGER));
    project.addMetric(new Metric("points", ValueKind.INTEGER));

    assertThat(project.getMetrics()).extracting(Metric::getName).containsExactly("Points", "points");
  }

  @Test
  void metricLookupFallsBackToNormalizedName() {
    var project = new Project("Rocket");
    var compileTime = project.addMetric(new Metric("Compile Time", ValueKind.DURATION));

    assertThat(project.metric("Compile Time")).contains(compileTime);
    assertThat(project.metric("compile_time")).contains(compileTime);
    assertThat(project.metric("COMPILE TIME")).contains(compileTime);
    assertThat(project.metric("link_time")).isEmpty();
    assertThat(project.findMetric("compile_time")).isEmpty();
  }

  @Test
  void metricsKeepInsertionOrder() {
    var project = new Project("Rocket");
    project.addMetric(new Metric("Zeta", ValueKind.INTEGER));
    project.addMetric(new Metric("Alpha", ValueKind.INTEGER));

    assertThat(project.getMetrics()).extracting(Metric::getName).containsExactly("Zeta", "Alpha");
    assertThat(project.getMetrics()).extracting(Metric::getSortOrder).containsExactly(0, 1);
  }

  @Test
  void taskIsCreatedOnceAndThenReused() {
    var project = new Project("Rocket");

    var first = project.task("Launch");
    var second = project.task("Launch");

    assertThat(second).isSameAs(first);
    assertThat(first.getProjectId()).isEqualTo(project.getId());
    assertThat(project.findTask("Land")).isEmpty();
    assertThat(project.getTasks()).containsExactly(first);
  }

  @Test
  void removingAMetricDiscardsItsDataPoints() {
    var project = new Project("Rocket");
    var points = project.addMetric(new Metric("Points", ValueKind.INTEGER));
    var notes = project.addMetric(new Metric("Notes", ValueKind.STRING));
    var task = project.task("Launch");
    task.record(points, 3L);
    task.record(notes, "ok");

    project.removeMetric("Points");

    assertThat(project.getMetrics()).containsExactly(notes);
    assertThat(task.getDataPoints()).hasSize(1);
    assertThat(task.dataPoints(points)).isEmpty();
  }

  @Test
  void normalizeIdentityLowercasesNameAndOrganization() {
    var project = new Project("Rocket", "Acme", "Keeps Its Case");

    project.normalizeIdentity();

    assertThat(project.getQualifiedName()).isEqualTo("acme/rocket");
    assertThat(project.getDescription()).isEqualTo("Keeps Its Case");
  }
}
