package com.flamingo.ai.ragdocs.service.tracking;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last observed state of one tracked documentation file. Mutated in place when the file is
 * re-indexed; keyed by {@code filePath}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FileFingerprint {

  private String filePath;

  /** Hex SHA-256 of the file bytes. */
  private String hash;

  /** File modification time, epoch millis. */
  private long lastModified;

  private String technology;

  /** When the file was last handed to the indexer, epoch millis. */
  private long lastIndexed;

  /** Whether the record carries the fields change detection needs. */
  boolean isComplete() {
    return filePath != null && !filePath.isBlank() && hash != null && technology != null;
  }
}
