package io.b2mash.maxify.configimport;

import io.b2mash.maxify.exception.ConfigException;
import io.b2mash.maxify.exception.ModelException;
import io.b2mash.maxify.exception.ValueParsingException;
import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.project.Project;
import io.b2mash.maxify.project.QualifiedName;
import io.b2mash.maxify.unit.ValueKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

/**
 * Reads project definitions from YAML ({@code .yaml}, {@code .yml}) or JSON ({@code .json})
 * documents shaped as {@code projects: [{name, organization?, desc?, metrics: [...]}]}.
 */
@Component
public class DocumentProjectDefinitionLoader implements ProjectDefinitionLoader {

  private static final Logger log = LoggerFactory.getLogger(DocumentProjectDefinitionLoader.class);

  private final ObjectMapper jsonMapper;
  private final ObjectMapper yamlMapper;

  public DocumentProjectDefinitionLoader(ObjectMapper objectMapper) {
    this.jsonMapper = objectMapper;
    this.yamlMapper = YAMLMapper.builder().build();
  }

  @Override
  public List<Project> load(Path source) {
    var document = read(source);
    if (document == null || document.projects() == null) {
      throw new ConfigException("Definition " + source + " has no 'projects' section");
    }

    var projects = new ArrayList<Project>();
    var seen = new HashSet<String>();
    for (var definition : document.projects()) {
      var project = toProject(definition);
      var key = QualifiedName.parse(project.getQualifiedName()).canonical().toString();
      if (!seen.add(key)) {
        throw new ConfigException(
            "Project " + project.getQualifiedName() + " is defined more than once in " + source);
      }
      projects.add(project);
    }

    log.info("Loaded {} project definitions from {}", projects.size(), source);
    return projects;
  }

  private ProjectsDocument read(Path source) {
    if (!Files.isRegularFile(source)) {
      throw new ConfigException("Definition file not found: " + source);
    }
    var mapper = mapperFor(source);
    try (var in = Files.newInputStream(source)) {
      return mapper.readValue(in, ProjectsDocument.class);
    } catch (IOException e) {
      throw new ConfigException("Failed to read definition file " + source, e);
    } catch (JacksonException e) {
      throw new ConfigException(
          "Definition file " + source + " is malformed: " + e.getOriginalMessage(), e);
    }
  }

  private ObjectMapper mapperFor(Path source) {
    String fileName = source.getFileName().toString().toLowerCase(Locale.ROOT);
    if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
      return yamlMapper;
    }
    if (fileName.endsWith(".json")) {
      return jsonMapper;
    }
    throw new ConfigException("Unsupported definition format: " + source.getFileName());
  }

  private Project toProject(ProjectDefinition definition) {
    if (definition == null || isBlank(definition.name())) {
      throw new ConfigException("Every project requires a 'name'");
    }

    Project project;
    try {
      project = new Project(definition.name(), definition.organization(), definition.desc());
    } catch (ModelException e) {
      throw new ConfigException(e.getMessage(), e);
    }

    for (var metricDefinition : definition.metrics()) {
      project.addMetric(toMetric(project, metricDefinition));
    }
    return project;
  }

  private Metric toMetric(Project project, MetricDefinition definition) {
    if (definition == null || isBlank(definition.name())) {
      throw new ConfigException(
          "Every metric of project " + project.getQualifiedName() + " requires a 'name'");
    }
    String context = "metric " + definition.name() + " of project " + project.getQualifiedName();
    if (isBlank(definition.metricType())) {
      throw new ConfigException("Missing 'metric_type' for " + context);
    }
    var kind =
        ValueKind.fromIdentifier(definition.metricType())
            .orElseThrow(
                () ->
                    new ConfigException(
                        "Unknown metric type '" + definition.metricType() + "' for " + context));

    try {
      var metric = new Metric(definition.name(), kind);
      var allowed = parseRange(kind, definition.valueRange());
      var defaultValue =
          definition.defaultValue() != null
              ? kind.parse(String.valueOf(definition.defaultValue()))
              : null;
      metric.updateDefinition(definition.desc(), allowed, defaultValue);
      return metric;
    } catch (ValueParsingException | ModelException e) {
      throw new ConfigException("Invalid " + context + ": " + e.getMessage(), e);
    }
  }

  private static List<Object> parseRange(ValueKind kind, Object rawRange) {
    if (rawRange == null) {
      return null;
    }
    List<?> rawValues = rawRange instanceof List<?> list ? list : List.of(rawRange);
    var parsed = new ArrayList<>(rawValues.size());
    for (Object raw : rawValues) {
      parsed.add(kind.parse(String.valueOf(raw)));
    }
    return parsed;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
