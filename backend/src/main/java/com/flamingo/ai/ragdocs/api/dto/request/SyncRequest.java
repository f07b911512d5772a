package com.flamingo.ai.ragdocs.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for syncing a technology's documentation directory. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

  @NotBlank(message = "Path is required")
  private String path;
}
