package com.flamingo.ai.talkpdf.service.plan;

import com.flamingo.ai.talkpdf.domain.entity.UserProfile;
import com.flamingo.ai.talkpdf.domain.enums.PlanTier;
import com.flamingo.ai.talkpdf.domain.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Reads the tier from the {@code profiles} table on every call. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfilePlanProvider implements PlanProvider {

  private final UserProfileRepository userProfileRepository;

  @Override
  @Transactional(readOnly = true)
  public PlanTier currentPlan(String userId) {
    PlanTier tier =
        userProfileRepository
            .findById(userId)
            .map(UserProfile::getSubscriptionPlan)
            .map(PlanTier::fromValue)
            .orElse(PlanTier.FREE);
    log.debug("Resolved plan {} for user {}", tier, userId);
    return tier;
  }
}
