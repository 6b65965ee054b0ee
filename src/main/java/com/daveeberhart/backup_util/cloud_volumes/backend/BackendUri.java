package com.daveeberhart.backup_util.cloud_volumes.backend;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException.InvalidUriException;

/**
 * A parsed {@code scheme://bucket[/prefix]} target.
 *
 * @author deberhar
 */
public final class BackendUri {
  private static final Pattern URI_PATTERN = Pattern.compile("([a-zA-Z][a-zA-Z0-9+.-]*)://(.*)");

  private final String scheme;
  private final String location;
  private final String bucket;
  private final String prefix;

  private BackendUri(String p_scheme, String p_location, String p_bucket, String p_prefix) {
    scheme = p_scheme;
    location = p_location;
    bucket = p_bucket;
    prefix = p_prefix;
  }

  /**
   * @throws InvalidUriException if there's no scheme, or nothing follows it
   */
  public static BackendUri parse(String p_uri) {
    if (p_uri == null) {
      throw new InvalidUriException("No target URI given");
    }

    Matcher m = URI_PATTERN.matcher(p_uri.trim());
    if (!m.matches()) {
      throw new InvalidUriException("Target URI must look like scheme://bucket[/prefix]; was " + p_uri);
    }

    String scheme = m.group(1).toLowerCase();
    String location = m.group(2);
    int slash = location.indexOf('/');
    String bucket = slash < 0 ? location : location.substring(0, slash);
    String prefix = slash < 0 ? "" : location.substring(slash + 1);
    if (location.isEmpty()) {
      throw new InvalidUriException("Target URI is missing a bucket: " + p_uri);
    }

    return new BackendUri(scheme, location, bucket, prefix);
  }

  public String getScheme() {
    return scheme;
  }

  /**
   * @return Everything after {@code ://}.
   */
  public String getLocation() {
    return location;
  }

  /**
   * @return The first path segment; empty for a location like {@code /var/backups}.
   */
  public String getBucket() {
    return bucket;
  }

  /**
   * @return Whatever follows the bucket, without the leading slash; may be empty.
   */
  public String getPrefix() {
    return prefix;
  }

  @Override
  public String toString() {
    return scheme + "://" + location;
  }

}
