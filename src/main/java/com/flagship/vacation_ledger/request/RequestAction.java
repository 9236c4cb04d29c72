package com.flagship.vacation_ledger.request;

/**
 * Operations that act on an existing vacation request.
 */
public enum RequestAction {
    EDIT("modified"),
    DELETE("deleted"),
    APPROVE("approved"),
    REJECT("rejected");

    private final String pastTense;

    RequestAction(String pastTense) {
        this.pastTense = pastTense;
    }

    public String getPastTense() {
        return pastTense;
    }
}
