package com.daveeberhart.backup_util.cloud_volumes.volume;

import java.io.IOException;
import java.io.InputStream;

/**
 * A single named, checksummed chunk of backup data.
 * <p>
 * Volumes are created and destroyed by whoever produces them; backends and the upload pipeline
 * only read them.  Each call to {@link #openStream()} must return a fresh stream positioned at the
 * start of the data, so a failed upload can be attempted again.
 *
 * @author deberhar
 */
public interface Volume {

  /**
   * @return Name of the object this volume is stored as (relative to the backend's prefix).
   */
  String getObjectName();

  /**
   * @return Size of the data in bytes.
   */
  long getSize();

  /**
   * @return Hex-encoded MD5 digest of the data.
   */
  String getChecksum();

  /**
   * Open the volume's data for reading.  The caller closes the stream.
   *
   * @throws com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.VolumeMissingException
   *           if the backing storage no longer exists
   */
  InputStream openStream() throws IOException;

  /**
   * Remove the backing storage.
   */
  void delete() throws IOException;

}
