package com.scholary.audiobook.checkpoint;

import com.scholary.audiobook.chunking.Chapter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/** Computes the SHA-256 fingerprint that ties a checkpoint to its source text. */
public final class SourceHasher {

  private SourceHasher() {}

  public static String hash(List<Chapter> chapters) {
    MessageDigest digest = sha256();
    for (Chapter chapter : chapters) {
      digest.update(chapter.title().getBytes(StandardCharsets.UTF_8));
      digest.update((byte) 0);
      digest.update(chapter.text().getBytes(StandardCharsets.UTF_8));
      digest.update((byte) 0);
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
