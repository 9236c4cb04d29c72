package com.flagship.vacation_ledger.ledger;

import com.flagship.vacation_ledger.account.AccountRole;
import com.flagship.vacation_ledger.analytics.AnalyticsCache;
import com.flagship.vacation_ledger.identity.Principal;
import com.flagship.vacation_ledger.identity.PrincipalResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manager-only repair endpoint for the used-days counters.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final BalanceLedgerService ledgerService;
    private final PrincipalResolver principalResolver;
    private final AnalyticsCache analyticsCache;

    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationResult> reconcile(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId) {

        Principal principal = principalResolver.resolve(callerId);
        principal.requireRole(AccountRole.MANAGER, "reconcile the ledger");

        log.info("Ledger reconciliation requested by {}", principal.getAccountId());
        ReconciliationResult result = ledgerService.reconcileAll();
        if (!result.getCorrections().isEmpty()) {
            analyticsCache.invalidate();
        }
        return ResponseEntity.ok(result);
    }
}
