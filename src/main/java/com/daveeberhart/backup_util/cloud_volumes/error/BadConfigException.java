package com.daveeberhart.backup_util.cloud_volumes.error;

/**
 * Configuration can't be used as given.  Never retried.
 *
 * @author deberhar
 */
public class BadConfigException extends RuntimeException {

  public BadConfigException(String p_mesg) {
    super(p_mesg);
  }

  public BadConfigException(String p_mesg, Throwable p_e) {
    super(p_mesg, p_e);
  }

  /**
   * Target URI is malformed, or names a scheme no backend is registered for.
   */
  public static class InvalidUriException extends BadConfigException {
    public InvalidUriException(String p_mesg) {
      super(p_mesg);
    }
  }

  public static class InvalidPrefixException extends BadConfigException {
    public InvalidPrefixException(String p_mesg) {
      super(p_mesg);
    }
  }

}
