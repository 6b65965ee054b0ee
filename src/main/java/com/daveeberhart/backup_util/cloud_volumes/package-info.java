/**
 * A library to store backup volumes in object storage (Amazon S3, or a plain directory),
 * and bring them back on demand.
 * <p>
 * Volumes are uploaded in parallel with retries, and archived objects are restored from
 * Glacier before they're downloaded.
 */
package com.daveeberhart.backup_util.cloud_volumes;
