package com.flamingo.ai.talkpdf.api.dto.response;

import com.flamingo.ai.talkpdf.domain.entity.Document;
import com.flamingo.ai.talkpdf.domain.enums.DocumentStatus;
import com.flamingo.ai.talkpdf.domain.model.PageContent;
import com.flamingo.ai.talkpdf.domain.model.StudyPrompt;
import com.flamingo.ai.talkpdf.domain.model.TtsMetadata;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String fileName;
  private String fileType;
  private Long fileSizeBytes;
  private DocumentStatus status;
  private String summary;
  private List<StudyPrompt> studyPrompts;
  private List<PageContent> pageContents;
  private Integer pageCount;
  private String audioRef;
  private Integer audioDurationSeconds;
  private String audioLanguage;
  private TtsMetadata ttsMetadata;
  private String processingError;
  private LocalDateTime uploadedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .fileName(document.getFileName())
        .fileType(document.getFileType())
        .fileSizeBytes(document.getFileSizeBytes())
        .status(document.getStatus())
        .summary(document.getSummary())
        .studyPrompts(document.getStudyPrompts())
        .pageContents(document.getPageContents())
        .pageCount(document.getPageCount())
        .audioRef(document.getAudioRef())
        .audioDurationSeconds(document.getAudioDurationSeconds())
        .audioLanguage(document.getAudioLanguage())
        .ttsMetadata(document.getTtsMetadata())
        .processingError(document.getProcessingError())
        .uploadedAt(document.getUploadedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
