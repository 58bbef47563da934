package io.b2mash.maxify.metric.dto;

import io.b2mash.maxify.metric.AggregationPolicy;
import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.unit.ValueKind;
import java.util.List;

public record MetricResponse(
    String name,
    ValueKind valueKind,
    AggregationPolicy aggregationPolicy,
    String description,
    List<String> allowedValues,
    String defaultValue) {

  public static MetricResponse from(Metric metric) {
    var kind = metric.getValueKind();
    var defaultValue = metric.getDefaultValue();
    return new MetricResponse(
        metric.getName(),
        kind,
        metric.getAggregationPolicy(),
        metric.getDescription(),
        metric.getAllowedValues().stream().map(kind::format).toList(),
        defaultValue != null ? kind.format(defaultValue) : null);
  }
}
