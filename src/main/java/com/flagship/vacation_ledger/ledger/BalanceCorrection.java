package com.flagship.vacation_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * One account whose stored counter disagreed with its approved requests.
 */
@Value
public class BalanceCorrection {

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("previous_days")
    int previousDays;

    @JsonProperty("recomputed_days")
    int recomputedDays;

    @JsonIgnore
    public boolean isDrifted() {
        return previousDays != recomputedDays;
    }
}
