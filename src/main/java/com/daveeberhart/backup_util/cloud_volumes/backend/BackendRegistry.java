package com.daveeberhart.backup_util.cloud_volumes.backend;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import com.daveeberhart.backup_util.cloud_volumes.backend.file.FileBackend;
import com.daveeberhart.backup_util.cloud_volumes.backend.s3.S3Backend;
import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException.InvalidUriException;

/**
 * Maps URI schemes to backend implementations.
 * <p>
 * The shared registry knows {@value S3Backend#SCHEME} and {@value FileBackend#SCHEME}.
 *
 * @author deberhar
 */
public class BackendRegistry {
  private static final BackendRegistry DEFAULT = new BackendRegistry()
      .register(S3Backend.SCHEME, true, S3Backend::new)
      .register(FileBackend.SCHEME, false, FileBackend::new);

  private final Map<String, Entry> backends = new ConcurrentHashMap<>();

  /**
   * @return The registry used by {@link #forUri(String)}.
   */
  public static BackendRegistry defaultRegistry() {
    return DEFAULT;
  }

  /**
   * Look up a backend in the {@link #defaultRegistry() default registry}.
   *
   * @see #create(String)
   */
  public static Backend forUri(String p_uri) {
    return DEFAULT.create(p_uri);
  }

  /**
   * @param p_scheme URI scheme, e.g. {@code s3}
   * @param p_requiresBucket whether URIs for this scheme must name a bucket (i.e. not start with {@code scheme:///})
   * @param p_factory creates uninitialized backend instances
   * @return this registry
   */
  public BackendRegistry register(String p_scheme, boolean p_requiresBucket, Supplier<? extends Backend> p_factory) {
    backends.put(p_scheme.toLowerCase(), new Entry(p_requiresBucket, p_factory));
    return this;
  }

  public Set<String> getSchemes() {
    return Collections.unmodifiableSet(new TreeSet<>(backends.keySet()));
  }

  /**
   * Create a new backend for the URI's scheme.  The backend still needs to be
   * {@link Backend#init(BackendConfig, BackendOption...) initialized}.
   *
   * @throws InvalidUriException if the URI is malformed or its scheme isn't registered
   */
  public Backend create(String p_uri) {
    BackendUri uri = BackendUri.parse(p_uri);
    Entry entry = backends.get(uri.getScheme());
    if (entry == null) {
      throw new InvalidUriException("No backend is registered for scheme '" + uri.getScheme() + "' (known: " + getSchemes() + ")");
    }
    if (entry.requiresBucket && uri.getBucket().isEmpty()) {
      throw new InvalidUriException("Target URI is missing a bucket: " + p_uri);
    }

    return entry.factory.get();
  }

  private static final class Entry {
    private final boolean requiresBucket;
    private final Supplier<? extends Backend> factory;

    private Entry(boolean p_requiresBucket, Supplier<? extends Backend> p_factory) {
      requiresBucket = p_requiresBucket;
      factory = p_factory;
    }
  }

}
