package com.company.errorbudget.engine;

import lombok.Value;

@Value
public class BurnRateBreakdown {
    double burnRate5m;
    double burnRate1h;
    double burnRate24h;
    double composite;
}
