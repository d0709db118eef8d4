package com.flamingo.ai.talkpdf.service.identity;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the authenticated caller of a request. */
public interface CallerIdentityResolver {

  /**
   * Returns the caller's user id.
   *
   * @throws com.flamingo.ai.talkpdf.exception.UnauthorizedException when no identity is present
   */
  String resolveUserId(HttpServletRequest request);
}
