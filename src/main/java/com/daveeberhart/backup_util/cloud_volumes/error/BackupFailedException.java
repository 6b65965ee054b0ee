package com.daveeberhart.backup_util.cloud_volumes.error;

/**
 * Base class for failures while moving volumes to or from a backend.
 * <p>
 * Subclasses extending {@link PermanentFailureException} describe problems with the volume itself;
 * retrying them can never succeed.
 *
 * @author deberhar
 */
public class BackupFailedException extends RuntimeException {

  public BackupFailedException(String p_mesg) {
    super(p_mesg);
  }

  public BackupFailedException(String p_mesg, Throwable e) {
    super(p_mesg, e);
  }

  /**
   * Marker parent for errors that must not be retried.
   */
  public static class PermanentFailureException extends BackupFailedException {
    public PermanentFailureException(String p_mesg) {
      super(p_mesg);
    }

    public PermanentFailureException(String p_mesg, Throwable p_e) {
      super(p_mesg, p_e);
    }
  }

  /**
   * The volume's checksum is not a hex-encoded digest of the expected length.
   */
  public static class ChecksumFormatException extends PermanentFailureException {
    public ChecksumFormatException(String p_mesg) {
      super(p_mesg);
    }

    public ChecksumFormatException(String p_mesg, Throwable p_e) {
      super(p_mesg, p_e);
    }
  }

  /**
   * The bytes that arrived don't hash to the volume's checksum.
   */
  public static class ChecksumMismatchException extends PermanentFailureException {
    public ChecksumMismatchException(String p_mesg) {
      super(p_mesg);
    }
  }

  /**
   * The local file backing a volume is gone.
   */
  public static class VolumeMissingException extends PermanentFailureException {
    public VolumeMissingException(String p_mesg) {
      super(p_mesg);
    }

    public VolumeMissingException(String p_mesg, Throwable p_e) {
      super(p_mesg, p_e);
    }
  }

  public static class RestoreTimeoutException extends BackupFailedException {
    public RestoreTimeoutException(String p_mesg) {
      super(p_mesg);
    }
  }

  /**
   * A backend was used before {@code init} or after {@code close}.
   */
  public static class BackendClosedException extends BackupFailedException {
    public BackendClosedException(String p_mesg) {
      super(p_mesg);
    }
  }

  /**
   * Thrown by an upload run's join handle; the cause is the first volume failure recorded.
   */
  public static class UploadFailedException extends BackupFailedException {
    public UploadFailedException(String p_mesg, Throwable p_e) {
      super(p_mesg, p_e);
    }
  }

}
