package io.b2mash.maxify.configimport;

/** How an import treats candidate projects whose qualified name already exists in the store. */
public enum ImportStrategy {
  /** Reject the whole import when any candidate collides. */
  ABORT,
  /** Refresh colliding projects field by field, keeping recorded task data. */
  MERGE,
  /** Delete colliding projects with all their data, then save the candidates. */
  OVERWRITE
}
