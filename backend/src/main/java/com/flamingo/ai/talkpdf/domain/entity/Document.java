package com.flamingo.ai.talkpdf.domain.entity;

import com.flamingo.ai.talkpdf.domain.converter.PageContentListConverter;
import com.flamingo.ai.talkpdf.domain.converter.StudyPromptListConverter;
import com.flamingo.ai.talkpdf.domain.converter.TtsMetadataConverter;
import com.flamingo.ai.talkpdf.domain.enums.DocumentStatus;
import com.flamingo.ai.talkpdf.domain.model.PageContent;
import com.flamingo.ai.talkpdf.domain.model.StudyPrompt;
import com.flamingo.ai.talkpdf.domain.model.TtsMetadata;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A user-owned document and the results of its latest pipeline run. */
@Entity
@Table(name = "documents", indexes = @Index(name = "idx_documents_owner", columnList = "owner_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false)
  private String ownerId;

  @Column(nullable = false)
  private String fileName;

  /** Opaque blob-store reference of the uploaded file. */
  @Column(nullable = false)
  private String fileRef;

  private Long fileSizeBytes;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.UPLOADED;

  @Column(columnDefinition = "TEXT")
  private String summary;

  @Convert(converter = StudyPromptListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<StudyPrompt> studyPrompts = new ArrayList<>();

  @Convert(converter = PageContentListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<PageContent> pageContents = new ArrayList<>();

  private Integer pageCount;

  /** Blob-store reference of the synthesized audio, null when synthesis produced nothing. */
  private String audioRef;

  private Integer audioDurationSeconds;

  /** Language requested for the audio rendering (ISO-like code). */
  private String audioLanguage;

  @Convert(converter = TtsMetadataConverter.class)
  @Column(columnDefinition = "TEXT")
  private TtsMetadata ttsMetadata;

  /** Error message if the last run failed. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    if (uploadedAt == null) {
      uploadedAt = LocalDateTime.now();
    }
  }

  /** Whether the given caller owns this document. */
  public boolean isOwnedBy(String userId) {
    return ownerId != null && ownerId.equals(userId);
  }

  /** File family derived from the name; anything other than a Word document counts as pdf. */
  public String getFileType() {
    String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
    return name.endsWith(".docx") || name.endsWith(".doc") ? "word" : "pdf";
  }

  /** Marks the document as processing for the requested audio language. */
  public void startProcessing(String language) {
    this.status = DocumentStatus.PROCESSING;
    this.audioLanguage = language;
    this.processingError = null;
  }

  /** Marks the document as successfully processed. */
  public void markReady() {
    this.status = DocumentStatus.READY;
    this.processingError = null;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markError(String errorMessage) {
    this.status = DocumentStatus.ERROR;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }
}
