package io.b2mash.maxify.configimport;

import java.util.List;

/** Root of a project definition document. */
public record ProjectsDocument(List<ProjectDefinition> projects) {}
