package com.daveeberhart.backup_util.cloud_volumes.pipeline;

/**
 * What an upload run does with the remaining volumes once one volume has failed for good.
 *
 * @author deberhar
 */
public enum FailurePolicy {
  /** Keep uploading everything else; the run still reports the first failure. */
  CONTINUE,
  /** Stop dispatching, interrupt uploads in flight, and report the first failure. */
  ABORT
}
