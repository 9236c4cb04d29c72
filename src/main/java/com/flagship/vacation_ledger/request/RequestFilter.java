package com.flagship.vacation_ledger.request;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Criteria for listing vacation requests. Null fields do not constrain the result.
 *
 * - status: exact match
 * - search: case-insensitive substring of the owner's name or the request reason
 * - accountId: owner of the request
 * - from / to: requests starting on or after {@code from} and ending on or before {@code to}
 */
@Value
@Builder(toBuilder = true)
public class RequestFilter {
    RequestStatus status;
    String search;
    Long accountId;
    LocalDate from;
    LocalDate to;

    public static RequestFilter none() {
        return RequestFilter.builder().build();
    }

    public RequestFilter scopedTo(Long ownerAccountId) {
        return toBuilder().accountId(ownerAccountId).build();
    }

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }
}
