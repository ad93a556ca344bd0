package com.flagship.spv_ledger.history;

public enum SortDirection {
    ASC,
    DESC
}
