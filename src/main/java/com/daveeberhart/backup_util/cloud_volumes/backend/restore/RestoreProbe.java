package com.daveeberhart.backup_util.cloud_volumes.backend.restore;

/**
 * What a metadata probe found out about one object: its storage class, and the state of any
 * restore from the archival tier.
 *
 * @author deberhar
 */
public final class RestoreProbe {
  private final boolean archival;
  private final Boolean ongoingRestore;

  /**
   * @param p_archival whether the object sits in an archival (cold) storage class
   * @param p_ongoingRestore {@code null} if the object carries no restore status at all,
   *          otherwise whether a restore is still running
   */
  public RestoreProbe(boolean p_archival, Boolean p_ongoingRestore) {
    archival = p_archival;
    ongoingRestore = p_ongoingRestore;
  }

  public static RestoreProbe standard() {
    return new RestoreProbe(false, null);
  }

  public static RestoreProbe archived(Boolean p_ongoingRestore) {
    return new RestoreProbe(true, p_ongoingRestore);
  }

  public boolean isArchival() {
    return archival;
  }

  public boolean hasRestoreStatus() {
    return ongoingRestore != null;
  }

  public boolean isRestoreOngoing() {
    return ongoingRestore != null && ongoingRestore;
  }

  @Override
  public String toString() {
    return (archival ? "archival" : "standard") + (ongoingRestore == null ? "" : ", ongoing-request=" + ongoingRestore);
  }

}
