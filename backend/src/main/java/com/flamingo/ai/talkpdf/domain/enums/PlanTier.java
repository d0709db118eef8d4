package com.flamingo.ai.talkpdf.domain.enums;

import java.util.Locale;

/** Subscription tier of a document owner. Determines every per-run budget. */
public enum PlanTier {
  FREE,
  PLUS,
  PRO;

  /** Config key used under {@code talkpdf.plans}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a stored plan value leniently. Unknown or missing values fall back to {@link #FREE}.
   */
  public static PlanTier fromValue(String value) {
    if (value == null || value.isBlank()) {
      return FREE;
    }
    for (PlanTier tier : values()) {
      if (tier.key().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return tier;
      }
    }
    return FREE;
  }
}
