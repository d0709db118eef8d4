package com.flamingo.ai.talkpdf.api.rest;

import com.flamingo.ai.talkpdf.api.dto.request.ProcessDocumentRequest;
import com.flamingo.ai.talkpdf.api.dto.response.DocumentResponse;
import com.flamingo.ai.talkpdf.api.dto.response.ProcessDocumentResponse;
import com.flamingo.ai.talkpdf.domain.entity.Document;
import com.flamingo.ai.talkpdf.service.document.DocumentStateService;
import com.flamingo.ai.talkpdf.service.identity.CallerIdentityResolver;
import com.flamingo.ai.talkpdf.service.pipeline.DocumentIntakeService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for starting pipeline runs and reading their results. */
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentProcessingController {

  private final CallerIdentityResolver identityResolver;
  private final DocumentIntakeService intakeService;
  private final DocumentStateService documentStateService;

  /** Admits a document for background processing and returns immediately. */
  @PostMapping("/process")
  public ResponseEntity<ProcessDocumentResponse> processDocument(
      @Valid @RequestBody ProcessDocumentRequest request, HttpServletRequest httpRequest) {
    String userId = identityResolver.resolveUserId(httpRequest);
    Document document =
        intakeService.submit(userId, request.getDocumentId(), request.getLanguage());

    return ResponseEntity.ok(
        ProcessDocumentResponse.builder()
            .success(true)
            .documentId(document.getId())
            .status(document.getStatus().getValue())
            .message("Document processing started. You will be able to listen once it is ready.")
            .build());
  }

  /** Gets a document with its latest results. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(
      @PathVariable UUID documentId, HttpServletRequest httpRequest) {
    String userId = identityResolver.resolveUserId(httpRequest);
    return ResponseEntity.ok(
        DocumentResponse.fromEntity(documentStateService.getOwned(documentId, userId)));
  }
}
