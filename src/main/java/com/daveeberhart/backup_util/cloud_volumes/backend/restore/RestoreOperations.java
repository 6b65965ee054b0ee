package com.daveeberhart.backup_util.cloud_volumes.backend.restore;

import java.io.IOException;

/**
 * The provider calls an {@link ArchiveRestorer} needs.
 *
 * @author deberhar
 */
public interface RestoreOperations {

  /**
   * Fetch the object's storage class and restore status.
   */
  RestoreProbe probe(String p_key) throws IOException;

  /**
   * Ask the provider to restore an archived object.
   *
   * @return {@link RestoreRequestResult#ALREADY_IN_PROGRESS} if the provider reports the restore
   *         was already requested; any other refusal is thrown
   */
  RestoreRequestResult requestRestore(String p_key) throws IOException;

}
