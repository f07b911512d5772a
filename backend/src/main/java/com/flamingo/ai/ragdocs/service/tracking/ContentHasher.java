package com.flamingo.ai.ragdocs.service.tracking;

import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/** Streams file bytes through SHA-256; the file is never held in memory as a whole. */
@Component
public class ContentHasher {

  public String hash(Path file) throws IOException {
    return MoreFiles.asByteSource(file).hash(Hashing.sha256()).toString();
  }
}
