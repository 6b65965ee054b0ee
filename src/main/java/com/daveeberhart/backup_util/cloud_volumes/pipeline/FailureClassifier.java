package com.daveeberhart.backup_util.cloud_volumes.pipeline;

import java.io.FileNotFoundException;
import java.nio.file.NoSuchFileException;

import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.retry.RetryUtils;
import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.BackendClosedException;
import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.PermanentFailureException;
import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException;

/**
 * Sorts upload failures into the ones worth retrying and the ones that will never succeed.
 * <p>
 * Permanent: anything wrong with the volume itself (bad checksum, missing file), configuration
 * errors, a closed backend, programming errors, and provider rejections (4xx) other than throttling and timeouts.
 * Everything else (network trouble, throttling, 5xx responses, I/O errors) is transient.
 *
 * @author deberhar
 */
public final class FailureClassifier {

  private FailureClassifier() {
  }

  public static boolean isPermanent(Throwable p_failure) {
    for (Throwable t = p_failure; t != null; t = t.getCause()) {
      if (t instanceof PermanentFailureException
          || t instanceof BackendClosedException
          || t instanceof BadConfigException
          || t instanceof FileNotFoundException
          || t instanceof NoSuchFileException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }

    if (p_failure instanceof AmazonServiceException) {
      return isPermanent((AmazonServiceException)p_failure);
    }
    if (p_failure instanceof AmazonClientException) {
      return !((AmazonClientException)p_failure).isRetryable();
    }

    return p_failure instanceof IllegalArgumentException
        || p_failure instanceof IllegalStateException
        || p_failure instanceof NullPointerException
        || p_failure instanceof UnsupportedOperationException;
  }

  private static boolean isPermanent(AmazonServiceException p_failure) {
    if (RetryUtils.isThrottlingException(p_failure) || RetryUtils.isClockSkewError(p_failure)) {
      return false;
    }

    int status = p_failure.getStatusCode();
    if (status == 408 || status == 429 || status >= 500) {
      return false;
    }
    return status >= 400;
  }

}
