package com.daveeberhart.backup_util.cloud_volumes.progress;

/**
 * Reports progress of a stream copied by hand, e.g. into a file backend.
 *
 * @author deberhar
 */
public class CopyProgressListener extends BaseProgressListener {
  /** 512MB */
  private static final long REPORT_INTERVAL = 512 * 1024 * 1024;

  private long totalBytesProcessed;

  public CopyProgressListener(String caption, String action, long totalBytes) {
    super(caption, action, totalBytes, REPORT_INTERVAL);
  }

  public void addBytesProcessed(long bytes) {
    totalBytesProcessed += bytes;
    reportProgress(totalBytesProcessed);
  }

}
