package io.b2mash.maxify.configimport.dto;

import io.b2mash.maxify.configimport.ImportStrategy;

/** Both fields are optional and fall back to the configured defaults. */
public record ImportRequest(String source, ImportStrategy strategy) {}
