package com.flagship.vacation_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class ReconciliationResult {

    @JsonProperty("accounts_checked")
    int accountsChecked;

    @JsonProperty("corrections")
    List<BalanceCorrection> corrections;

    @JsonProperty("accounts_corrected")
    public int getAccountsCorrected() {
        return corrections.size();
    }
}
