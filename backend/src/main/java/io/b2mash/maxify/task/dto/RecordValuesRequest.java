package io.b2mash.maxify.task.dto;

import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * Values to record against a task, as text keyed by metric name.
 *
 * @param description optional new task description
 * @param values raw values; each is parsed by its metric's value kind
 */
public record RecordValuesRequest(
    @Size(max = 4000) String description, Map<String, String> values) {}
