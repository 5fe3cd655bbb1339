package com.gentoro.scenarios.setup.action;

/** The two passes in which a scenario's actions are replayed. */
public enum SetupPhase {
  /** Structural edits that do not depend on run-time directories. */
  STATIC,
  /** Edits that need paths resolved only once output directories exist. */
  DYNAMIC;

  public boolean isDynamic() {
    return this == DYNAMIC;
  }
}
