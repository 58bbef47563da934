package io.b2mash.maxify.metric;

import io.b2mash.maxify.exception.ModelException;
import io.b2mash.maxify.unit.ValueKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A named measurement definition owned by exactly one project.
 *
 * <p>Allowed values and the default value are held in parsed form. They are validated against the
 * value kind whenever the definition changes, so a metric can never carry a default that its own
 * kind or allowed values reject.
 */
@Entity
@Table(name = "metrics")
public class Metric {

  @Id private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "name", nullable = false, length = 256)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "value_kind", nullable = false, length = 20)
  private ValueKind valueKind;

  @Enumerated(EnumType.STRING)
  @Column(name = "aggregation_policy", nullable = false, length = 20)
  private AggregationPolicy aggregationPolicy;

  @Column(name = "description")
  private String description;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "allowed_values")
  private List<String> allowedValues;

  @Column(name = "default_value")
  private String defaultValue;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Metric() {}

  public Metric(String name, ValueKind valueKind) {
    this(name, valueKind, valueKind != null ? AggregationPolicy.defaultFor(valueKind) : null);
  }

  public Metric(String name, ValueKind valueKind, AggregationPolicy aggregationPolicy) {
    if (name == null || name.isBlank()) {
      throw new ModelException("Invalid metric", "Metric name must not be blank");
    }
    if (valueKind == null) {
      throw new ModelException("Invalid metric", "Metric " + name + " has no value kind");
    }
    if (aggregationPolicy == null || !aggregationPolicy.isSupportedBy(valueKind)) {
      throw new ModelException(
          "Invalid metric",
          "Aggregation policy " + aggregationPolicy + " cannot be used with " + valueKind.label());
    }
    this.id = UUID.randomUUID();
    this.name = name;
    this.valueKind = valueKind;
    this.aggregationPolicy = aggregationPolicy;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /**
   * Replaces description, allowed values and default value in one step. Values must already be
   * parsed; nothing changes if any of them is rejected.
   *
   * @param allowedValues permitted values, or {@code null}/empty for no restriction
   * @param defaultValue default value, or {@code null} for none
   * @throws ModelException if a value does not match the value kind or the default is not allowed
   */
  public void updateDefinition(String description, List<?> allowedValues, Object defaultValue) {
    List<String> encodedAllowed = null;
    if (allowedValues != null && !allowedValues.isEmpty()) {
      encodedAllowed = new ArrayList<>(allowedValues.size());
      for (Object value : allowedValues) {
        encodedAllowed.add(valueKind.encode(value));
      }
    }

    String encodedDefault = null;
    if (defaultValue != null) {
      encodedDefault = valueKind.encode(defaultValue);
      if (encodedAllowed != null && !matchesAny(allowedValues, defaultValue)) {
        throw new ModelException(
            "Invalid metric",
            "Default value "
                + valueKind.format(defaultValue)
                + " of metric "
                + name
                + " is not one of its allowed values");
      }
    }

    this.description = description;
    this.allowedValues = encodedAllowed;
    this.defaultValue = encodedDefault;
    this.updatedAt = Instant.now();
  }

  /** Returns an unbound copy of this definition, suitable for adding to another project. */
  public Metric copyDefinition() {
    var copy = new Metric(name, valueKind, aggregationPolicy);
    copy.description = description;
    copy.allowedValues = allowedValues != null ? new ArrayList<>(allowedValues) : null;
    copy.defaultValue = defaultValue;
    return copy;
  }

  /** True if the value may be recorded against this metric. */
  public boolean isAllowed(Object value) {
    return allowedValues == null || matchesAny(getAllowedValues(), value);
  }

  /** Lowercase form with underscores read as spaces, so "compile_time" finds "Compile Time". */
  public static String normalizeName(String name) {
    return name.toLowerCase(Locale.ROOT).replace('_', ' ').trim();
  }

  /** Binds this metric to its owning project. Called by the project when the metric is added. */
  public void bindTo(UUID projectId, int sortOrder) {
    if (this.projectId != null && !this.projectId.equals(projectId)) {
      throw new ModelException(
          "Invalid metric reference", "Metric " + name + " already belongs to another project");
    }
    this.projectId = projectId;
    this.sortOrder = sortOrder;
  }

  private boolean matchesAny(List<?> candidates, Object value) {
    for (Object candidate : candidates) {
      if (valueKind.sameValue(candidate, value)) {
        return true;
      }
    }
    return false;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getName() {
    return name;
  }

  public ValueKind getValueKind() {
    return valueKind;
  }

  public AggregationPolicy getAggregationPolicy() {
    return aggregationPolicy;
  }

  public String getDescription() {
    return description;
  }

  /** Allowed values in parsed form; empty when the metric is unrestricted. */
  public List<Object> getAllowedValues() {
    if (allowedValues == null) {
      return List.of();
    }
    var decoded = new ArrayList<>(allowedValues.size());
    for (String encoded : allowedValues) {
      decoded.add(valueKind.decode(encoded));
    }
    return Collections.unmodifiableList(decoded);
  }

  public boolean hasAllowedValues() {
    return allowedValues != null;
  }

  /** Default value in parsed form, or {@code null}. */
  public Object getDefaultValue() {
    return defaultValue != null ? valueKind.decode(defaultValue) : null;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
