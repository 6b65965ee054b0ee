package com.daveeberhart.backup_util.cloud_volumes.backend;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

import com.daveeberhart.backup_util.cloud_volumes.backend.file.FileBackend;
import com.daveeberhart.backup_util.cloud_volumes.backend.s3.S3Backend;
import com.daveeberhart.backup_util.cloud_volumes.error.BadConfigException.InvalidUriException;

/**
 * @author deberhar
 */
public class BackendRegistryTest {

  @Test
  public void testDefaultSchemes() {
    Assert.assertEquals(Arrays.asList("file", "s3"), Arrays.asList(BackendRegistry.defaultRegistry().getSchemes().toArray()));
    Assert.assertTrue(BackendRegistry.forUri("s3://bucket/prefix") instanceof S3Backend);
    Assert.assertTrue(BackendRegistry.forUri("file:///var/backups") instanceof FileBackend);
  }

  @Test
  public void testNewInstanceEachTime() {
    Assert.assertNotSame(BackendRegistry.forUri("s3://bucket"), BackendRegistry.forUri("s3://bucket"));
  }

  @Test(expected=InvalidUriException.class)
  public void testUnknownScheme() {
    BackendRegistry.forUri("gs://bucket");
  }

  @Test(expected=InvalidUriException.class)
  public void testMissingBucket() {
    BackendRegistry.forUri("s3:///prefix");
  }

  @Test(expected=InvalidUriException.class)
  public void testMalformed() {
    BackendRegistry.forUri("bucket");
  }

  @Test
  public void testRegister() {
    Backend backend = Mockito.mock(Backend.class);
    BackendRegistry registry = new BackendRegistry().register("MEM", false, () -> backend);

    Assert.assertSame(backend, registry.create("mem://anything"));
    Assert.assertEquals(1, registry.getSchemes().size());
    Assert.assertFalse(BackendRegistry.defaultRegistry().getSchemes().contains("mem"));
  }

}
