package com.flamingo.ai.talkpdf.service.plan;

import com.flamingo.ai.talkpdf.domain.enums.PlanTier;

/** Source of a user's current subscription tier. */
public interface PlanProvider {

  /** Current tier of the user; {@link PlanTier#FREE} when unknown. Never cached. */
  PlanTier currentPlan(String userId);
}
