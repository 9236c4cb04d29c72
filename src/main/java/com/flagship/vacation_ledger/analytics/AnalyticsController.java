package com.flagship.vacation_ledger.analytics;

import com.flagship.vacation_ledger.identity.Principal;
import com.flagship.vacation_ledger.identity.PrincipalResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final PrincipalResolver principalResolver;

    @GetMapping
    public ResponseEntity<AnalyticsSummary> getAnalytics(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId) {
        Principal principal = principalResolver.resolve(callerId);
        return ResponseEntity.ok(analyticsService.summary(principal));
    }
}
