package com.daveeberhart.backup_util.cloud_volumes.backend.s3;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.AmazonS3Exception;
import com.amazonaws.services.s3.model.GlacierJobParameters;
import com.amazonaws.services.s3.model.HeadBucketRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.RestoreObjectRequest;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.amazonaws.services.s3.model.StorageClass;
import com.amazonaws.services.s3.model.Tier;
import com.amazonaws.services.s3.transfer.TransferManager;
import com.amazonaws.services.s3.transfer.TransferManagerBuilder;
import com.amazonaws.services.s3.transfer.Upload;
import com.amazonaws.services.s3.transfer.model.UploadResult;
import com.daveeberhart.backup_util.cloud_volumes.Sleeper;
import com.daveeberhart.backup_util.cloud_volumes.backend.Backend;
import com.daveeberhart.backup_util.cloud_volumes.backend.BackendConfig;
import com.daveeberhart.backup_util.cloud_volumes.backend.BackendOption;
import com.daveeberhart.backup_util.cloud_volumes.backend.BackendUri;
import com.daveeberhart.backup_util.cloud_volumes.backend.restore.ArchiveRestorer;
import com.daveeberhart.backup_util.cloud_volumes.backend.restore.PollSchedule;
import com.daveeberhart.backup_util.cloud_volumes.backend.restore.RestoreOperations;
import com.daveeberhart.backup_util.cloud_volumes.backend.restore.RestoreProbe;
import com.daveeberhart.backup_util.cloud_volumes.backend.restore.RestoreRequestResult;
import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.BackendClosedException;
import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException;
import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException.InvalidUriException;
import com.daveeberhart.backup_util.cloud_volumes.progress.TransferProgressListener;
import com.daveeberhart.backup_util.cloud_volumes.volume.Checksums;
import com.daveeberhart.backup_util.cloud_volumes.volume.Volume;

/**
 * Amazon S3 (and S3-compatible) storage, addressed as {@code s3://bucket[/prefix]}.
 * <p>
 * The prefix is prepended to object names verbatim, so use {@code s3://bucket/backups/} to keep
 * objects under a "directory".
 * <p>
 * Objects that lifecycle rules moved to Glacier or Glacier Deep Archive must be restored before
 * they can be downloaded; {@link #preDownload(List)} takes care of that, and can take hours.
 * <p>
 * Settings (see {@link BackendConfig#getOption(String, String)}):
 * <ul>
 * <li>{@value #OPT_REGION}: AWS region, if not configured in the environment</li>
 * <li>{@value #OPT_ENDPOINT}: custom endpoint for S3-compatible stores (e.g. MinIO); forces path-style access</li>
 * <li>{@value #OPT_STORAGE_CLASS}: storage class for uploads (default {@code STANDARD})</li>
 * <li>{@value #OPT_RESTORE_TIER}: Glacier retrieval tier (default {@code Standard})</li>
 * <li>{@value #OPT_RESTORE_RETENTION_DAYS}: how long restored copies are kept (default 3)</li>
 * <li>{@value #OPT_POLL_INTERVAL}, {@value #OPT_MAX_POLL_INTERVAL}, {@value #OPT_MAX_POLL_TIME}: restore polling, as ISO-8601 durations</li>
 * </ul>
 *
 * @author deberhar
 */
public class S3Backend implements Backend, RestoreOperations {
  private static final Logger log = LoggerFactory.getLogger(S3Backend.class);

  public static final String SCHEME = "s3";

  public static final String OPT_REGION = "aws.region";
  public static final String OPT_ENDPOINT = "aws.s3.endpoint";
  public static final String OPT_STORAGE_CLASS = "aws.s3.storageClass";
  public static final String OPT_RESTORE_TIER = "aws.glacier.restoreTier";
  public static final String OPT_RESTORE_RETENTION_DAYS = "aws.glacier.restoreRetentionDays";
  public static final String OPT_POLL_INTERVAL = "restore.pollInterval";
  public static final String OPT_MAX_POLL_INTERVAL = "restore.maxPollInterval";
  public static final String OPT_MAX_POLL_TIME = "restore.maxPollTime";

  /** User metadata key holding the hex MD5 of the uploaded volume. */
  static final String USER_METADATA_MD5 = "md5";
  static final String RESTORE_ALREADY_IN_PROGRESS = "RestoreAlreadyInProgress";

  private static final Set<String> ARCHIVAL_STORAGE_CLASSES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
      StorageClass.Glacier.toString(),
      StorageClass.DeepArchive.toString()
  )));

  protected volatile AmazonS3 s3;
  protected volatile TransferManager tm;
  protected String bucket;
  protected String prefix = "";

  private BackendConfig config;
  private Sleeper sleeper = Sleeper.THREAD;
  private StorageClass storageClass;
  private Tier restoreTier;
  private int retentionDays;
  private ArchiveRestorer restorer;

  /**
   * Use the given client instead of building one from the environment.
   */
  public static BackendOption withS3Client(AmazonS3 p_s3) {
    return backend -> {
      if (backend instanceof S3Backend) {
        ((S3Backend)backend).s3 = p_s3;
      }
    };
  }

  /**
   * Use the given transfer manager for uploads instead of building one around the client.
   */
  public static BackendOption withTransferManager(TransferManager p_tm) {
    return backend -> {
      if (backend instanceof S3Backend) {
        ((S3Backend)backend).tm = p_tm;
      }
    };
  }

  /**
   * Wait between restore polls with the given sleeper.
   */
  public static BackendOption withSleeper(Sleeper p_sleeper) {
    return backend -> {
      if (backend instanceof S3Backend) {
        ((S3Backend)backend).sleeper = p_sleeper;
      }
    };
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#init(com.daveeberhart.backup_util.cloud_volumes.backend.BackendConfig, com.daveeberhart.backup_util.cloud_volumes.backend.BackendOption[])
   */
  @Override
  public void init(BackendConfig p_config, BackendOption... p_options) throws IOException {
    BackendUri uri = BackendUri.parse(p_config.getTargetUri());
    if (!SCHEME.equals(uri.getScheme())) {
      throw new InvalidUriException("Not an S3 URI: " + p_config.getTargetUri());
    }
    if (uri.getBucket().isEmpty()) {
      throw new InvalidUriException("S3 URI is missing a bucket: " + p_config.getTargetUri());
    }

    config = p_config;
    for (BackendOption option : p_options) {
      option.applyTo(this);
    }

    storageClass = parseStorageClass(p_config.getOption(OPT_STORAGE_CLASS, StorageClass.Standard.toString()));
    restoreTier = parseRestoreTier(p_config.getOption(OPT_RESTORE_TIER, Tier.Standard.toString()));
    retentionDays = p_config.getIntOption(OPT_RESTORE_RETENTION_DAYS, 3);
    PollSchedule schedule = new PollSchedule(
        p_config.getDurationOption(OPT_POLL_INTERVAL, PollSchedule.DEFAULT_INITIAL_INTERVAL),
        p_config.getDurationOption(OPT_MAX_POLL_INTERVAL, PollSchedule.DEFAULT_MAX_INTERVAL),
        p_config.getDurationOption(OPT_MAX_POLL_TIME, PollSchedule.DEFAULT_MAX_WAIT));

    if (s3 == null) {
      s3 = buildClient(p_config);
    }
    if (tm == null) {
      final int maxParallel = p_config.getMaxParallelUploads();
      tm = TransferManagerBuilder.standard()
          .withS3Client(s3)
          .withMinimumUploadPartSize(p_config.getUploadChunkSize())
          .withMultipartUploadThreshold(p_config.getUploadChunkSize())
          .withExecutorFactory(() -> Executors.newFixedThreadPool(maxParallel))
          .build();
    }
    restorer = new ArchiveRestorer(this, schedule, sleeper);

    try {
      s3.headBucket(new HeadBucketRequest(uri.getBucket()));
    } catch (RuntimeException e) {
      try {
        close();
      } catch (IOException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }

    bucket = uri.getBucket();
    prefix = uri.getPrefix();
    log.info("Initialized S3 backend for bucket {} (prefix '{}', storage class {})", bucket, prefix, storageClass);
  }

  private AmazonS3 buildClient(BackendConfig p_config) {
    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard();
    String region = p_config.getOption(OPT_REGION, null);
    String endpoint = p_config.getOption(OPT_ENDPOINT, null);
    if (endpoint != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region == null ? "us-east-1" : region))
             .withPathStyleAccessEnabled(true);
    } else if (region != null) {
      builder.withRegion(region);
    }
    return builder.build();
  }

  private static StorageClass parseStorageClass(String p_val) {
    try {
      return StorageClass.fromValue(p_val);
    } catch (IllegalArgumentException e) {
      throw new BadConfigException("Unrecognized value for " + OPT_STORAGE_CLASS + ": " + p_val, e);
    }
  }

  private static Tier parseRestoreTier(String p_val) {
    try {
      return Tier.fromValue(p_val);
    } catch (IllegalArgumentException e) {
      throw new BadConfigException("Unrecognized value for " + OPT_RESTORE_TIER + ": " + p_val, e);
    }
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#upload(com.daveeberhart.backup_util.cloud_volumes.volume.Volume)
   */
  @Override
  public void upload(Volume p_volume) throws IOException, InterruptedException {
    byte[] md5 = Checksums.decode(p_volume.getChecksum());
    TransferManager transfers = requireOpen(tm);

    String key = prefix + p_volume.getObjectName();
    ObjectMetadata md = new ObjectMetadata();
    md.setContentLength(p_volume.getSize());
    md.addUserMetadata(USER_METADATA_MD5, Checksums.toHex(md5));
    if (p_volume.getSize() <= config.getUploadChunkSize()) {
      // Single PUT: S3 verifies the digest for us.  Multipart ETags aren't MD5s, so nothing to check there.
      md.setContentMD5(Base64.getEncoder().encodeToString(md5));
    }

    Semaphore permits = config.getUploadPermits();
    permits.acquire();
    try (InputStream in = p_volume.openStream()) {
      log.info("Uploading {} as {}", p_volume, key);
      PutObjectRequest req = new PutObjectRequest(bucket, key, in, md);
      req.setStorageClass(storageClass);

      TransferProgressListener progress = new TransferProgressListener(p_volume.getObjectName(), p_volume.getSize());
      Upload upload = transfers.upload(req, progress);
      UploadResult res;
      try {
        res = upload.waitForUploadResult();
      } catch (InterruptedException e) {
        upload.abort();
        throw e;
      }
      progress.done();
      log.info("[OK] Uploaded {} as {} (ETag {})", p_volume, key, res.getETag());
    } finally {
      permits.release();
    }
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#download(java.lang.String)
   */
  @Override
  public InputStream download(String p_key) throws IOException {
    return requireOpen(s3).getObject(bucket, prefix + p_key).getObjectContent();
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#preDownload(java.util.List)
   */
  @Override
  public void preDownload(List<String> p_keys) throws IOException, InterruptedException {
    if (p_keys == null || p_keys.isEmpty()) {
      return;
    }
    requireOpen(s3);
    restorer.ensureAvailable(p_keys);
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.restore.RestoreOperations#probe(java.lang.String)
   */
  @Override
  public RestoreProbe probe(String p_key) {
    ObjectMetadata md = requireOpen(s3).getObjectMetadata(bucket, prefix + p_key);
    boolean archival = md.getStorageClass() != null && ARCHIVAL_STORAGE_CLASSES.contains(md.getStorageClass());
    return new RestoreProbe(archival, md.getOngoingRestore());
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.restore.RestoreOperations#requestRestore(java.lang.String)
   */
  @Override
  public RestoreRequestResult requestRestore(String p_key) {
    RestoreObjectRequest rreq = new RestoreObjectRequest(bucket, prefix + p_key);
    rreq.setExpirationInDays(retentionDays);
    rreq.setGlacierJobParameters(new GlacierJobParameters().withTier(restoreTier));
    try {
      requireOpen(s3).restoreObjectV2(rreq);
    } catch (AmazonS3Exception e) {
      if (RESTORE_ALREADY_IN_PROGRESS.equals(e.getErrorCode())) {
        return RestoreRequestResult.ALREADY_IN_PROGRESS;
      }
      throw e;
    }

    log.info("Started restore of object {} from Amazon Glacier to S3 (eta: {})", p_key, getRestoreTime(restoreTier));
    return RestoreRequestResult.ACCEPTED;
  }

  private String getRestoreTime(Tier p_restoreTier) {
    switch (p_restoreTier) {
    case Bulk:
      return "5-12 hours";
    case Expedited:
      return "1-5 minutes";
    default:
      return "3-5 hours";
    }
  }

  /**
   * Follows continuation tokens until the listing is no longer truncated.  A failure on any page
   * fails the whole listing.
   */
  @Override
  public List<String> list(String p_prefix) throws IOException {
    AmazonS3 client = requireOpen(s3);
    String fullPrefix = prefix + (p_prefix == null ? "" : p_prefix);

    List<String> names = new ArrayList<>();
    String token = null;
    ListObjectsV2Result page;
    do {
      ListObjectsV2Request req = new ListObjectsV2Request()
          .withBucketName(bucket)
          .withPrefix(fullPrefix)
          .withContinuationToken(token);
      page = client.listObjectsV2(req);
      for (S3ObjectSummary summary : page.getObjectSummaries()) {
        names.add(stripPrefix(summary.getKey()));
      }
      token = page.getNextContinuationToken();
    } while (page.isTruncated());

    return names;
  }

  private String stripPrefix(String p_key) {
    return p_key.startsWith(prefix) ? p_key.substring(prefix.length()) : p_key;
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.cloud_volumes.backend.Backend#delete(java.lang.String)
   */
  @Override
  public void delete(String p_key) throws IOException {
    requireOpen(s3).deleteObject(bucket, prefix + p_key);
  }

  /**
   * Shut down the transfer manager and the client.  Both are forgotten even if shutting them down
   * fails, so this backend can't be used again either way.
   */
  @Override
  public void close() throws IOException {
    TransferManager oldTm = tm;
    AmazonS3 oldS3 = s3;
    tm = null;
    s3 = null;
    restorer = null;

    RuntimeException failure = null;
    try {
      if (oldTm != null) {
        oldTm.shutdownNow(false);
      }
    } catch (RuntimeException e) {
      failure = e;
    }
    try {
      if (oldS3 != null) {
        oldS3.shutdown();
      }
    } catch (RuntimeException e) {
      if (failure == null) {
        failure = e;
      } else {
        failure.addSuppressed(e);
      }
    }

    if (failure != null) {
      throw new IOException("Failed to shut down S3 client for bucket " + bucket, failure);
    }
  }

  private static <T> T requireOpen(T p_handle) {
    if (p_handle == null) {
      throw new BackendClosedException("S3 backend is not initialized, or has been closed");
    }
    return p_handle;
  }

}
