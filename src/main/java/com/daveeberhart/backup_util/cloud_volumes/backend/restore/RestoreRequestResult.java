package com.daveeberhart.backup_util.cloud_volumes.backend.restore;

/**
 * @author deberhar
 */
public enum RestoreRequestResult {
  ACCEPTED,
  /** Somebody else already started restoring the object; not an error. */
  ALREADY_IN_PROGRESS
}
