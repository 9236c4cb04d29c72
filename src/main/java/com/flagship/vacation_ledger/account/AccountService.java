package com.flagship.vacation_ledger.account;

import com.flagship.vacation_ledger.account.dto.CreateAccountRequest;
import com.flagship.vacation_ledger.account.dto.UpdateAccountRequest;
import com.flagship.vacation_ledger.analytics.AnalyticsCache;
import com.flagship.vacation_ledger.exception.ConflictException;
import com.flagship.vacation_ledger.exception.NotFoundException;
import com.flagship.vacation_ledger.exception.ValidationException;
import com.flagship.vacation_ledger.identity.Principal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Account management.
 *
 * Managers create, list and delete accounts; an account may read and update
 * its own profile. Role, employee code and the used-days counter are never
 * changed here.
 */
@Service
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final AnalyticsCache analyticsCache;
    private final int defaultDaysTotal;

    public AccountService(AccountRepository accountRepository,
                          PasswordEncoder passwordEncoder,
                          AnalyticsCache analyticsCache,
                          @Value("${vacation.default-days-total:20}") int defaultDaysTotal) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.analyticsCache = analyticsCache;
        this.defaultDaysTotal = defaultDaysTotal;
    }

    @Transactional(readOnly = true)
    public List<Account> list(Principal principal) {
        principal.requireRole(AccountRole.MANAGER, "list accounts");
        return accountRepository.findAllByOrderByCreatedAtDesc().stream()
            .map(AccountEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Account get(Principal principal, Long accountId) {
        principal.requireManagerOrSelf(accountId);
        return load(accountId).toDomain();
    }

    @Transactional(readOnly = true)
    public Account me(Principal principal) {
        return load(principal.getAccountId()).toDomain();
    }

    /**
     * @throws ConflictException if the email or employee code is already taken
     */
    @Transactional
    public Account create(Principal principal, CreateAccountRequest request) {
        principal.requireRole(AccountRole.MANAGER, "create accounts");

        String email = request.getEmail().trim();
        if (accountRepository.existsByEmail(email)) {
            throw new ConflictException("Email already exists: " + email);
        }
        if (accountRepository.existsByEmployeeCode(request.getEmployeeCode())) {
            throw new ConflictException("Employee code already exists: " + request.getEmployeeCode());
        }

        AccountRole role = request.getRole() != null ? request.getRole() : AccountRole.EMPLOYEE;
        int total = request.getVacationDaysTotal() != null ? request.getVacationDaysTotal() : defaultDaysTotal;

        AccountEntity entity = AccountEntity.create(
            request.getName().trim(),
            email,
            request.getEmployeeCode(),
            passwordEncoder.encode(request.getPassword()),
            role,
            total
        );

        AccountEntity saved = saveUnique(entity);
        log.info("Account created: id={}, role={}, vacationDaysTotal={}", saved.getId(), role, total);
        analyticsCache.invalidate();
        return saved.toDomain();
    }

    /**
     * Updates name, email and/or password. Null fields are left unchanged.
     *
     * @throws ConflictException if the new email belongs to another account
     */
    @Transactional
    public Account update(Principal principal, Long accountId, UpdateAccountRequest change) {
        principal.requireManagerOrSelf(accountId);
        AccountEntity entity = load(accountId);

        String email = change.getEmail() != null ? change.getEmail().trim() : null;
        if (email != null && accountRepository.existsByEmailAndIdNot(email, accountId)) {
            throw new ConflictException("Email already exists: " + email);
        }

        entity.updateProfile(
            change.getName() != null ? change.getName().trim() : null,
            email,
            change.getPassword() != null ? passwordEncoder.encode(change.getPassword()) : null
        );

        AccountEntity saved = saveUnique(entity);
        log.info("Account updated: id={}", accountId);
        analyticsCache.invalidate();
        return saved.toDomain();
    }

    /**
     * Deletes an account; its requests go with it.
     *
     * @throws ValidationException if a manager tries to delete their own account
     */
    @Transactional
    public void delete(Principal principal, Long accountId) {
        principal.requireRole(AccountRole.MANAGER, "delete accounts");
        if (principal.owns(accountId)) {
            throw new ValidationException(ValidationException.Reason.SELF_DELETE,
                "Cannot delete your own account");
        }
        AccountEntity entity = load(accountId);
        accountRepository.delete(entity);
        log.info("Account deleted: id={}", accountId);
        analyticsCache.invalidate();
    }

    private AccountEntity load(Long accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> NotFoundException.account(accountId));
    }

    // A concurrent writer can still take the email between the exists check and the insert.
    private AccountEntity saveUnique(AccountEntity entity) {
        try {
            return accountRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Email or employee code already exists", e);
        }
    }
}
