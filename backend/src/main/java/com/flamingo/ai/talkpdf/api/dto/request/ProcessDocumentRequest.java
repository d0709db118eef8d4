package com.flamingo.ai.talkpdf.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a pipeline run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessDocumentRequest {

  @NotNull(message = "documentId is required")
  private UUID documentId;

  /** Audio language code; English when omitted. */
  @Size(max = 10, message = "language must not exceed 10 characters")
  private String language;
}
