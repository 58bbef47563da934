package io.b2mash.maxify.configimport;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One metric entry of a project definition. {@code valueRange} and {@code defaultValue} hold raw
 * document values (text, numbers, or a list for the range) that are parsed by the metric's unit.
 */
public record MetricDefinition(
    String name,
    @JsonProperty("metric_type") String metricType,
    String desc,
    @JsonProperty("value_range") Object valueRange,
    @JsonProperty("default_value") Object defaultValue) {}
