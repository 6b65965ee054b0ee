package com.daveeberhart.backup_util.cloud_volumes.backend;

/**
 * Overrides part of a backend's wiring during {@link Backend#init(BackendConfig, BackendOption...)},
 * typically to substitute a test double for a provider client.
 * <p>
 * Options ignore backends they don't apply to.
 *
 * @author deberhar
 */
@FunctionalInterface
public interface BackendOption {

  void applyTo(Backend p_backend);

}
