package io.b2mash.maxify.configimport;

import io.b2mash.maxify.project.Project;
import java.util.List;

/** Projects written by an import, in definition order, and any merge warnings. */
public record ImportResult(List<Project> projects, List<String> warnings) {}
