package com.daveeberhart.backup_util.cloud_volumes.backend;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Semaphore;

import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException;

/**
 * Settings handed to {@link Backend#init(BackendConfig, BackendOption...)}.
 * <p>
 * Provider-specific options are looked up in the option map first, then as a system property of
 * the same name (e.g. {@code -Daws.region=us-east-2}), then fall back to a default.
 *
 * @author deberhar
 */
public class BackendConfig {
  public static final long DEFAULT_UPLOAD_CHUNK_SIZE = 10L * 1024 * 1024;
  public static final int DEFAULT_MAX_PARALLEL_UPLOADS = 5;

  private final String targetUri;
  private final long uploadChunkSize;
  private final int maxParallelUploads;
  private final Semaphore uploadPermits;
  private final Map<String, String> options;

  public BackendConfig(String p_targetUri) {
    this(p_targetUri, DEFAULT_UPLOAD_CHUNK_SIZE, DEFAULT_MAX_PARALLEL_UPLOADS, Collections.emptyMap());
  }

  public BackendConfig(String p_targetUri, long p_uploadChunkSize, int p_maxParallelUploads, Map<String, String> p_options) {
    if (p_uploadChunkSize <= 0) {
      throw new BadConfigException("Upload chunk size must be positive; was " + p_uploadChunkSize);
    }
    if (p_maxParallelUploads <= 0) {
      throw new BadConfigException("Max parallel uploads must be positive; was " + p_maxParallelUploads);
    }

    targetUri = p_targetUri;
    uploadChunkSize = p_uploadChunkSize;
    maxParallelUploads = p_maxParallelUploads;
    uploadPermits = new Semaphore(p_maxParallelUploads);
    options = Collections.unmodifiableMap(new HashMap<>(p_options));
  }

  public String getTargetUri() {
    return targetUri;
  }

  public long getUploadChunkSize() {
    return uploadChunkSize;
  }

  public int getMaxParallelUploads() {
    return maxParallelUploads;
  }

  /**
   * @return Budget bounding the transfers in flight against this backend, sized to {@link #getMaxParallelUploads()}.
   */
  public Semaphore getUploadPermits() {
    return uploadPermits;
  }

  /**
   * @return The option's value, preferring the option map over system properties.
   */
  public String getOption(String p_name, String p_default) {
    String val = options.get(p_name);
    if (val == null || val.trim().isEmpty()) {
      val = System.getProperty(p_name);
    }
    if (val == null || val.trim().isEmpty()) {
      return p_default;
    }
    return val.trim();
  }

  public int getIntOption(String p_name, int p_default) {
    String val = getOption(p_name, null);
    if (val == null) {
      return p_default;
    }
    try {
      return Integer.parseInt(val);
    } catch (NumberFormatException e) {
      throw new BadConfigException("Setting " + p_name + " must be a number; was " + val, e);
    }
  }

  /**
   * @param p_default used when the option isn't set
   * @return The option parsed as an ISO-8601 duration (e.g. {@code PT30S}).
   */
  public Duration getDurationOption(String p_name, Duration p_default) {
    String val = getOption(p_name, null);
    if (val == null) {
      return p_default;
    }
    try {
      return Duration.parse(val);
    } catch (DateTimeParseException e) {
      throw new BadConfigException("Setting " + p_name + " must be an ISO-8601 duration (e.g. PT30S); was " + val, e);
    }
  }

  @Override
  public String toString() {
    return "BackendConfig[" + targetUri + ", chunk " + uploadChunkSize + ", parallel " + maxParallelUploads + "]";
  }

}
