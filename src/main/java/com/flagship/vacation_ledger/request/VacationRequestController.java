package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.identity.Principal;
import com.flagship.vacation_ledger.identity.PrincipalResolver;
import com.flagship.vacation_ledger.request.dto.CreateVacationRequest;
import com.flagship.vacation_ledger.request.dto.DecisionRequest;
import com.flagship.vacation_ledger.request.dto.UpdateVacationRequest;
import com.flagship.vacation_ledger.request.dto.VacationRequestResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for the vacation request workflow.
 *
 * The caller is identified by the X-Account-Id header; all rules (role,
 * ownership, state, eligibility) are enforced by {@link VacationRequestService}.
 */
@RestController
@RequestMapping("/api/requests")
@RequiredArgsConstructor
@Slf4j
public class VacationRequestController {

    private final VacationRequestService requestService;
    private final PrincipalResolver principalResolver;

    /**
     * Lists requests. Employees are always limited to their own requests.
     */
    @GetMapping
    public ResponseEntity<List<VacationRequestResponse>> listRequests(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "accountId", required = false) Long accountId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        Principal principal = principalResolver.resolve(callerId);
        RequestFilter filter = RequestFilter.builder()
            .status(RequestStatus.fromValue(status))
            .search(search)
            .accountId(accountId)
            .from(from)
            .to(to)
            .build();

        List<VacationRequestResponse> body = requestService.list(principal, filter).stream()
            .map(VacationRequestResponse::from)
            .toList();
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<VacationRequestResponse> getRequest(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @PathVariable("id") Long id) {
        Principal principal = principalResolver.resolve(callerId);
        return ResponseEntity.ok(VacationRequestResponse.from(requestService.get(principal, id)));
    }

    @PostMapping
    public ResponseEntity<VacationRequestResponse> createRequest(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @Valid @RequestBody CreateVacationRequest request) {

        log.info("Received vacation request: start={}, end={}", request.getStartDate(), request.getEndDate());
        Principal principal = principalResolver.resolve(callerId);
        VacationRequest created = requestService.create(
            principal, request.getStartDate(), request.getEndDate(), request.getReason());

        return ResponseEntity.status(HttpStatus.CREATED).body(VacationRequestResponse.from(created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<VacationRequestResponse> updateRequest(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateVacationRequest request) {

        Principal principal = principalResolver.resolve(callerId);
        VacationRequest updated = requestService.edit(
            principal, id, request.getStartDate(), request.getEndDate(), request.getReason());
        return ResponseEntity.ok(VacationRequestResponse.from(updated));
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<VacationRequestResponse> approveRequest(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @PathVariable("id") Long id,
            @Valid @RequestBody(required = false) DecisionRequest decision) {

        Principal principal = principalResolver.resolve(callerId);
        VacationRequest approved = requestService.approve(principal, id, notesOf(decision));
        return ResponseEntity.ok(VacationRequestResponse.from(approved));
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<VacationRequestResponse> rejectRequest(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @PathVariable("id") Long id,
            @Valid @RequestBody(required = false) DecisionRequest decision) {

        Principal principal = principalResolver.resolve(callerId);
        VacationRequest rejected = requestService.reject(principal, id, notesOf(decision));
        return ResponseEntity.ok(VacationRequestResponse.from(rejected));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRequest(
            @RequestHeader(PrincipalResolver.ACCOUNT_ID_HEADER) Long callerId,
            @PathVariable("id") Long id) {

        Principal principal = principalResolver.resolve(callerId);
        requestService.delete(principal, id);
        return ResponseEntity.noContent().build();
    }

    private static String notesOf(DecisionRequest decision) {
        return decision != null ? decision.getManagerNotes() : null;
    }
}
