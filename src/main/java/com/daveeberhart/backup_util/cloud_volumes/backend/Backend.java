package com.daveeberhart.backup_util.cloud_volumes.backend;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import com.daveeberhart.backup_util.cloud_volumes.volume.Volume;

/**
 * Storage operations against one storage provider.
 * <p>
 * The lifecycle of a backend:
 * <ol>
 * <li>{@link BackendRegistry#forUri(String)} (or the implementation's constructor)</li>
 * <li>{@link #init(BackendConfig, BackendOption...)}</li>
 * <li>any number of {@link #upload(Volume)}, {@link #download(String)}, {@link #preDownload(List)},
 * {@link #list(String)}, {@link #delete(String)} calls; uploads may run concurrently</li>
 * <li>{@link #close()}</li>
 * </ol>
 * All object names are relative to the prefix given in the target URI.
 * <p>
 * Blocking calls honour thread interruption as their cancellation signal.
 *
 * @author deberhar
 */
public interface Backend extends Closeable {

  /**
   * Validate the target URI and open the provider client(s).
   *
   * @throws com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException.InvalidUriException
   *           if the URI's scheme doesn't belong to this backend, or no bucket is given
   */
  void init(BackendConfig p_config, BackendOption... p_options) throws IOException;

  /**
   * Store a volume as {@code prefix + volume.getObjectName()}.  Returns only once the provider has
   * durably stored the whole object.
   *
   * @throws com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.ChecksumFormatException
   *           without touching the provider, if the volume's checksum can't be decoded
   */
  void upload(Volume p_volume) throws IOException, InterruptedException;

  /**
   * @return The object's full content.  Doesn't check for archived objects; see {@link #preDownload(List)}.
   */
  InputStream download(String p_key) throws IOException;

  /**
   * Make sure every key is readable, restoring archived objects and waiting for the restores
   * to finish as needed.
   */
  void preDownload(List<String> p_keys) throws IOException, InterruptedException;

  /**
   * @return Every object name under the prefix, however many provider calls it takes.
   */
  List<String> list(String p_prefix) throws IOException;

  void delete(String p_key) throws IOException;

  /**
   * Release the provider client(s).  The backend can't be used afterwards.
   */
  @Override
  void close() throws IOException;

}
