package com.flagship.vacation_ledger.request;

import lombok.Value;

/**
 * A request together with the name and email of the account that owns it.
 */
@Value
public class VacationRequestView {
    VacationRequest request;
    String accountName;
    String accountEmail;
}
