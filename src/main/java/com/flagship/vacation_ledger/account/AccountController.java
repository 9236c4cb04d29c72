package com.flagship.vacation_ledger.account;

import com.flagship.vacation_ledger.account.dto.AccountResponse;
import com.flagship.vacation_ledger.account.dto.CreateAccountRequest;
import com.flagship.vacation_ledger.account.dto.UpdateAccountRequest;
import com.flagship.vacation_ledger.identity.Principal;
import com.flagship.vacation_ledger.identity.PrincipalResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final PrincipalResolver principalResolver;

    @GetMapping("/me")
    public ResponseEntity<AccountResponse> me(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId) {
        Principal principal = principalResolver.resolve(callerId);
        return ResponseEntity.ok(AccountResponse.from(accountService.me(principal)));
    }

    @GetMapping
    public ResponseEntity<List<AccountResponse>> listAccounts(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId) {
        Principal principal = principalResolver.resolve(callerId);
        List<AccountResponse> body = accountService.list(principal).stream()
            .map(AccountResponse::from)
            .toList();
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> getAccount(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @PathVariable("id") Long id) {
        Principal principal = principalResolver.resolve(callerId);
        return ResponseEntity.ok(AccountResponse.from(accountService.get(principal, id)));
    }

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @Valid @RequestBody CreateAccountRequest request) {
        Principal principal = principalResolver.resolve(callerId);
        Account created = accountService.create(principal, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<AccountResponse> updateAccount(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateAccountRequest request) {
        Principal principal = principalResolver.resolve(callerId);
        return ResponseEntity.ok(AccountResponse.from(accountService.update(principal, id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @PathVariable("id") Long id) {
        Principal principal = principalResolver.resolve(callerId);
        accountService.delete(principal, id);
        return ResponseEntity.noContent().build();
    }
}
