package com.daveeberhart.backup_util.cloud_volumes.backend.file;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.cloud_volumes.backend.Backend;
import com.daveeberhart.backup_util.cloud_volumes.backend.BackendConfig;
import com.daveeberhart.backup_util.cloud_volumes.backend.BackendOption;
import com.daveeberhart.backup_util.cloud_volumes.backend.BackendUri;
import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.BackendClosedException;
import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.ChecksumMismatchException;
import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException.InvalidPrefixException;
import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException.InvalidUriException;
import com.daveeberhart.backup_util.cloud_volumes.progress.CopyProgressListener;
import com.daveeberhart.backup_util.cloud_volumes.volume.Checksums;
import com.daveeberhart.backup_util.cloud_volumes.volume.Volume;

/**
 * Stores objects as files below a local (or mounted) directory, addressed as
 * {@code file:///path/to/dir}.  Object names containing {@code /} become subdirectories.
 * <p>
 * There is no archival tier, so {@link #preDownload(List)} has nothing to do.
 *
 * @author deberhar
 */
public class FileBackend implements Backend {
  private static final Logger log = LoggerFactory.getLogger(FileBackend.class);

  public static final String SCHEME = "file";

  /** In-progress uploads are written under this name first, and never listed. */
  static final String TEMP_PREFIX = ".upload-";

  private volatile Path root;
  private BackendConfig config;

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#init(com.daveeberhart.backup_util.cloud_volumes.backend.BackendConfig, com.daveeberhart.backup_util.cloud_volumes.backend.BackendOption[])
   */
  @Override
  public void init(BackendConfig p_config, BackendOption... p_options) throws IOException {
    BackendUri uri = BackendUri.parse(p_config.getTargetUri());
    if (!SCHEME.equals(uri.getScheme())) {
      throw new InvalidUriException("Not a file URI: " + p_config.getTargetUri());
    }

    Path dir = Paths.get(uri.getLocation()).toAbsolutePath().normalize();
    if (!Files.isDirectory(dir)) {
      throw new NoSuchFileException(dir.toString(), null, "Backup directory does not exist");
    }

    for (BackendOption option : p_options) {
      option.applyTo(this);
    }
    config = p_config;
    root = dir;
    log.info("Initialized file backend in {}", dir);
  }

  /**
   * Copy the volume into place, verifying its checksum on the way.  The object only appears
   * once it's complete.
   *
   * @throws ChecksumMismatchException if the data doesn't match the volume's checksum
   */
  @Override
  public void upload(Volume p_volume) throws IOException, InterruptedException {
    byte[] expected = Checksums.decode(p_volume.getChecksum());
    Path target = resolve(p_volume.getObjectName());
    Files.createDirectories(target.getParent());

    Semaphore permits = config.getUploadPermits();
    permits.acquire();
    Path tmp = null;
    try (InputStream in = p_volume.openStream()) {
      tmp = Files.createTempFile(target.getParent(), TEMP_PREFIX, ".tmp");
      MessageDigest md = Checksums.newDigest();
      CopyProgressListener progress = new CopyProgressListener(p_volume.getObjectName(), "Copy", p_volume.getSize());
      try (OutputStream out = Files.newOutputStream(tmp)) {
        final byte[] buff = new byte[64 * 1024];
        int len;
        while ((len = in.read(buff, 0, buff.length)) >= 0) {
          if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted while copying " + p_volume);
          }
          md.update(buff, 0, len);
          out.write(buff, 0, len);
          progress.addBytesProcessed(len);
        }
      }
      progress.done();

      if (!MessageDigest.isEqual(expected, md.digest())) {
        throw new ChecksumMismatchException(p_volume + " does not match its checksum " + p_volume.getChecksum());
      }

      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      tmp = null;
      log.info("[OK] Stored {} as {}", p_volume, target);
    } finally {
      permits.release();
      if (tmp != null) {
        Files.deleteIfExists(tmp);
      }
    }
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#download(java.lang.String)
   */
  @Override
  public InputStream download(String p_key) throws IOException {
    return Files.newInputStream(resolve(p_key));
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#preDownload(java.util.List)
   */
  @Override
  public void preDownload(List<String> p_keys) {
    requireOpen();
  }

  /**
   * @return Names of all stored objects starting with the prefix, sorted.
   */
  @Override
  public List<String> list(String p_prefix) throws IOException {
    final Path dir = requireOpen();
    final String prefix = p_prefix == null ? "" : p_prefix;
    try (Stream<Path> files = Files.walk(dir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> !path.getFileName().toString().startsWith(TEMP_PREFIX))
          .map(path -> dir.relativize(path).toString().replace(File.separatorChar, '/'))
          .filter(name -> name.startsWith(prefix))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#delete(java.lang.String)
   */
  @Override
  public void delete(String p_key) throws IOException {
    Files.delete(resolve(p_key));
  }

  /* (non-Javadoc)
   * @see java.io.Closeable#close()
   */
  @Override
  public void close() {
    root = null;
  }

  private Path resolve(String p_name) {
    Path dir = requireOpen();
    Path path = dir.resolve(p_name).normalize();
    if (!path.startsWith(dir) || path.equals(dir)) {
      throw new InvalidPrefixException("Object name " + p_name + " points outside of " + dir);
    }
    return path;
  }

  private Path requireOpen() {
    Path dir = root;
    if (dir == null) {
      throw new BackendClosedException("File backend is not initialized, or has been closed");
    }
    return dir;
  }

}
