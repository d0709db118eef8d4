package com.flamingo.ai.talkpdf.domain.repository;

import com.flamingo.ai.talkpdf.domain.entity.UsageEvent;
import com.flamingo.ai.talkpdf.domain.enums.UsageActionType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for UsageEvent entities. */
@Repository
public interface UsageEventRepository extends JpaRepository<UsageEvent, UUID> {

  boolean existsByUserIdAndActionTypeAndDocumentId(
      String userId, UsageActionType actionType, UUID documentId);

  /** Events of a user created in {@code [from, to)}. */
  List<UsageEvent> findByUserIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
      String userId, Instant from, Instant to);
}
