package com.daveeberhart.backup_util.cloud_volumes.volume;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;

import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.VolumeMissingException;

/**
 * A volume backed by a file on local disk.
 *
 * @author deberhar
 */
public class FileVolume implements Volume {
  private final File file;
  private final String objectName;
  private final long size;
  private final String checksum;

  public FileVolume(File p_file, String p_objectName, long p_size, String p_checksum) {
    file = p_file;
    objectName = p_objectName;
    size = p_size;
    checksum = p_checksum;
  }

  /**
   * Create a volume for an existing file, reading it once to compute the checksum.
   */
  public static FileVolume of(File p_file, String p_objectName) throws IOException {
    if (!p_file.isFile()) {
      throw new VolumeMissingException("Could not find volume " + p_objectName + " at " + p_file);
    }

    String checksum;
    try (InputStream in = new FileInputStream(p_file)) {
      checksum = Checksums.digest(in);
    }
    return new FileVolume(p_file, p_objectName, p_file.length(), checksum);
  }

  public File getFile() {
    return file;
  }

  @Override
  public String getObjectName() {
    return objectName;
  }

  @Override
  public long getSize() {
    return size;
  }

  @Override
  public String getChecksum() {
    return checksum;
  }

  @Override
  public InputStream openStream() throws IOException {
    try {
      return new BufferedInputStream(new FileInputStream(file));
    } catch (FileNotFoundException e) {
      throw new VolumeMissingException("Could not find volume " + objectName + " at " + file, e);
    }
  }

  @Override
  public void delete() throws IOException {
    Files.deleteIfExists(file.toPath());
  }

  @Override
  public String toString() {
    return "volume " + objectName;
  }

}
