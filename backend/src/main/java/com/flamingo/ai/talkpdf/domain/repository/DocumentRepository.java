package com.flamingo.ai.talkpdf.domain.repository;

import com.flamingo.ai.talkpdf.domain.entity.Document;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Finds a document only if it belongs to the given owner. */
  Optional<Document> findByIdAndOwnerId(UUID id, String ownerId);
}
