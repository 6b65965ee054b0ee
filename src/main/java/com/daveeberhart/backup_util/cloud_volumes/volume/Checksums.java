package com.daveeberhart.backup_util.cloud_volumes.volume;

import java.io.IOException;
import java.io.InputStream;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import com.daveeberhart.backup_util.cloud_volumes.error.BackupFailedException.ChecksumFormatException;

/**
 * MD5 helpers for volume checksums.
 *
 * @author deberhar
 */
public final class Checksums {
  public static final String ALGORITHM = "MD5";
  public static final int DIGEST_LENGTH = 16;

  private static final Pattern HEX_DIGEST = Pattern.compile("[0-9a-fA-F]{" + (DIGEST_LENGTH * 2) + "}");

  private Checksums() {
  }

  /**
   * Decode a hex checksum, refusing anything that isn't exactly one MD5 digest.
   *
   * @throws ChecksumFormatException if the string isn't valid hex of the digest length
   */
  public static byte[] decode(String p_hex) {
    if (p_hex == null || !HEX_DIGEST.matcher(p_hex).matches()) {
      throw new ChecksumFormatException("Checksum is not a hex-encoded " + ALGORITHM + " digest: " + p_hex);
    }

    try {
      return Hex.decode(p_hex);
    } catch (DecoderException e) {
      throw new ChecksumFormatException("Checksum is not a hex-encoded " + ALGORITHM + " digest: " + p_hex, e);
    }
  }

  public static String toHex(byte[] p_digest) {
    return Hex.toHexString(p_digest);
  }

  public static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(ALGORITHM + " is required of every JRE", e);
    }
  }

  /**
   * Read a stream to the end, returning the hex digest of everything read.
   */
  public static String digest(InputStream p_in) throws IOException {
    MessageDigest md = newDigest();
    try (DigestInputStream digin = new DigestInputStream(p_in, md)) {
      byte[] buff = new byte[64 * 1024];
      while (digin.read(buff, 0, buff.length) >= 0) {
        // Loop.
      }
    }
    return toHex(md.digest());
  }

}
