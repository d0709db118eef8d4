package com.flamingo.ai.talkpdf.service.document;

import com.flamingo.ai.talkpdf.domain.entity.Document;
import com.flamingo.ai.talkpdf.domain.repository.DocumentRepository;
import com.flamingo.ai.talkpdf.exception.DocumentNotFoundException;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;

/**
 * Owner-scoped reads and writes of documents.
 *
 * <p>Every write re-reads the row filtered by owner, so a document that changed hands is never
 * touched. Writes retry on SQLite lock contention; each attempt runs in its own repository
 * transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStateService {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final DocumentRepository documentRepository;

  /** Loads a document owned by the caller. */
  public Document getOwned(UUID documentId, String ownerId) {
    return documentRepository
        .findByIdAndOwnerId(documentId, ownerId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  /** Flips an owned document to processing for the requested language. */
  public Document markProcessing(UUID documentId, String ownerId, String language) {
    return update(documentId, ownerId, document -> document.startProcessing(language))
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  /** Forces an owned document into error; does nothing when the owner no longer matches. */
  public boolean markErrorIfOwned(UUID documentId, String ownerId, String errorMessage) {
    return update(documentId, ownerId, document -> document.markError(errorMessage)).isPresent();
  }

  /**
   * Applies a mutation to an owned document and saves it.
   *
   * @return the saved document, or empty when the document is missing or not owned
   */
  public Optional<Document> update(UUID documentId, String ownerId, Consumer<Document> mutation) {
    for (int attempt = 1; ; attempt++) {
      try {
        Optional<Document> document = documentRepository.findByIdAndOwnerId(documentId, ownerId);
        if (document.isEmpty()) {
          log.warn("Document {} not found for owner {}, skipping write", documentId, ownerId);
          return Optional.empty();
        }
        mutation.accept(document.get());
        return Optional.of(documentRepository.saveAndFlush(document.get()));
      } catch (CannotAcquireLockException e) {
        if (attempt >= MAX_RETRIES) {
          log.error("Failed to update document {} after {} retries", documentId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on document {}, retry {}/{}", documentId, attempt, MAX_RETRIES);
        sleep(RETRY_DELAY_MS * attempt);
      }
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during retry", ie);
    }
  }
}
