package com.flamingo.ai.talkpdf.api.rest;

import com.flamingo.ai.talkpdf.api.dto.response.DailyUsageResponse;
import com.flamingo.ai.talkpdf.service.identity.CallerIdentityResolver;
import com.flamingo.ai.talkpdf.service.usage.UsageAccountingService;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing the caller's usage totals. */
@RestController
@RequestMapping("/usage")
@RequiredArgsConstructor
public class UsageController {

  private final CallerIdentityResolver identityResolver;
  private final UsageAccountingService usageAccountingService;
  private final Clock clock;

  /** Usage of one UTC day, today when no date is given. */
  @GetMapping("/daily")
  public ResponseEntity<DailyUsageResponse> getDailyUsage(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate date,
      HttpServletRequest httpRequest) {
    String userId = identityResolver.resolveUserId(httpRequest);
    LocalDate day = date != null ? date : LocalDate.now(clock.withZone(ZoneOffset.UTC));
    return ResponseEntity.ok(
        DailyUsageResponse.fromEntity(usageAccountingService.getDailySummary(userId, day)));
  }
}
