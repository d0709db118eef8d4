package com.flamingo.ai.talkpdf.service.identity;

import com.flamingo.ai.talkpdf.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Reads the user id placed on the request by the authenticating gateway. */
@Component
public class GatewayHeaderIdentityResolver implements CallerIdentityResolver {

  private final String headerName;

  public GatewayHeaderIdentityResolver(
      @Value("${talkpdf.identity.header:X-User-Id}") String headerName) {
    this.headerName = headerName;
  }

  @Override
  public String resolveUserId(HttpServletRequest request) {
    String userId = request.getHeader(headerName);
    if (userId == null || userId.isBlank()) {
      throw new UnauthorizedException("Missing caller identity header " + headerName);
    }
    return userId.trim();
  }
}
