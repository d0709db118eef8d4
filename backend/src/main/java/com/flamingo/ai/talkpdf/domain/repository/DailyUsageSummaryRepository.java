package com.flamingo.ai.talkpdf.domain.repository;

import com.flamingo.ai.talkpdf.domain.entity.DailyUsageSummary;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for DailyUsageSummary entities. */
@Repository
public interface DailyUsageSummaryRepository extends JpaRepository<DailyUsageSummary, UUID> {

  Optional<DailyUsageSummary> findByUserIdAndUsageDate(String userId, LocalDate usageDate);
}
