package com.flamingo.ai.talkpdf.api.dto.response;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Acknowledgement returned as soon as a run is admitted. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessDocumentResponse {

  private boolean success;
  private UUID documentId;
  private String status;
  private String message;
}
