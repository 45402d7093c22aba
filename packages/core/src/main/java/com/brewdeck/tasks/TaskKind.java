package com.brewdeck.tasks;

/** Deduplication key for singleton tasks: at most one task per kind is outstanding. */
public enum TaskKind {
  LOAD_INSTALLED,
  LOAD_OUTDATED,
  SEARCH,
  INSTALL,
  UNINSTALL,
  UPDATE,
  PIN,
  UNPIN,
  UPDATE_ALL,
  CLEAN_CACHE,
  CLEANUP_OLD_VERSIONS,
  LOAD_SERVICES,
  START_SERVICE,
  STOP_SERVICE,
  RESTART_SERVICE,
  EXPORT_PACKAGES,
  IMPORT_PACKAGES
}
