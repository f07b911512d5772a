package com.flamingo.ai.ragdocs.api.dto.response;

import com.flamingo.ai.ragdocs.service.rag.SyncReport;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed sync. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncReportResponse {

  private String technology;
  private int newFiles;
  private int modifiedFiles;
  private int deletedFiles;
  private int chunksIndexed;
  private List<String> failedFiles;
  private List<String> skippedFiles;

  public static SyncReportResponse fromReport(SyncReport report) {
    return SyncReportResponse.builder()
        .technology(report.technology())
        .newFiles(report.newFiles())
        .modifiedFiles(report.modifiedFiles())
        .deletedFiles(report.deletedFiles())
        .chunksIndexed(report.chunksIndexed())
        .failedFiles(report.failedFiles())
        .skippedFiles(report.skippedFiles())
        .build();
  }
}
