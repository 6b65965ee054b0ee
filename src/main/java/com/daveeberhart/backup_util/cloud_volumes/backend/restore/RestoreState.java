package com.daveeberhart.backup_util.cloud_volumes.backend.restore;

/**
 * Where a single object stands on its way to being readable.
 * <p>
 * The transition functions are pure; {@link ArchiveRestorer} drives them with real probes.
 *
 * @author deberhar
 */
public enum RestoreState {
  /** Not in an archival class; readable as-is. */
  STANDARD,
  /** Archived, and nobody has asked for it back yet. */
  ARCHIVED_UNREQUESTED,
  /** We asked for a restore; waiting for it to start showing up. */
  RESTORE_REQUESTED,
  /** A restore is underway (ours or someone else's). */
  RESTORING,
  /** Archived, but a restored copy is readable. */
  AVAILABLE;

  public boolean isTerminal() {
    return this == STANDARD || this == AVAILABLE;
  }

  public boolean isPolling() {
    return this == RESTORE_REQUESTED || this == RESTORING;
  }

  /**
   * Classify an object from its first probe.
   */
  public static RestoreState initial(RestoreProbe p_probe) {
    if (!p_probe.isArchival()) {
      return STANDARD;
    }
    if (!p_probe.hasRestoreStatus()) {
      return ARCHIVED_UNREQUESTED;
    }
    return p_probe.isRestoreOngoing() ? RESTORING : AVAILABLE;
  }

  /**
   * @return State after a restore request was answered.
   */
  public RestoreState afterRequest(RestoreRequestResult p_result) {
    if (this != ARCHIVED_UNREQUESTED) {
      throw new IllegalStateException("No restore request is expected in state " + this);
    }
    return p_result == RestoreRequestResult.ALREADY_IN_PROGRESS ? RESTORING : RESTORE_REQUESTED;
  }

  /**
   * @return State after re-probing an object whose restore we're waiting on.  A restore status
   *         that's gone away, or no longer ongoing, means the restore finished.
   */
  public RestoreState afterPoll(RestoreProbe p_probe) {
    if (!isPolling()) {
      throw new IllegalStateException("Not waiting on a restore in state " + this);
    }
    if (!p_probe.isArchival()) {
      return STANDARD;
    }
    return p_probe.isRestoreOngoing() ? RESTORING : AVAILABLE;
  }

}
