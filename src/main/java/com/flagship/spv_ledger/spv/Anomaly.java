package com.flagship.spv_ledger.spv;

import lombok.Value;

@Value
public class Anomaly {
    AnomalyType type;
    String address;
    long amount;
}
