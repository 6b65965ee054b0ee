package com.daveeberhart.backup_util.cloud_volumes.progress;

import com.amazonaws.event.ProgressEvent;
import com.amazonaws.services.s3.transfer.PersistableTransfer;
import com.amazonaws.services.s3.transfer.internal.S3ProgressListener;

/**
 * Reports the progress of an S3 transfer.  Multipart uploads call back from several threads.
 *
 * @author deberhar
 */
public class TransferProgressListener extends BaseProgressListener implements S3ProgressListener {
  /** 200MB */
  private static final long REPORT_INTERVAL = 200 * 1024 * 1024;

  private long totalBytesProcessed;

  public TransferProgressListener(String caption, long totalBytes) {
    super(caption, "Upload", totalBytes, REPORT_INTERVAL);
  }

  /* (non-Javadoc)
   * @see com.amazonaws.event.ProgressListener#progressChanged(com.amazonaws.event.ProgressEvent)
   */
  @Override
  public synchronized void progressChanged(ProgressEvent p_progressEvent) {
    totalBytesProcessed += p_progressEvent.getBytesTransferred();
    reportProgress(totalBytesProcessed);
  }

  /* (non-Javadoc)
   * @see com.amazonaws.services.s3.transfer.internal.S3ProgressListener#onPersistableTransfer(com.amazonaws.services.s3.transfer.PersistableTransfer)
   */
  @Override
  public void onPersistableTransfer(PersistableTransfer p_persistableTransfer) {
    // Nop.
  }

}
