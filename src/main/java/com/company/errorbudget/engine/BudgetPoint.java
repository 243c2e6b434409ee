package com.company.errorbudget.engine;

import lombok.Value;

import java.time.Instant;

/**
 * Budget remaining (percent) observed at one evaluation instant.
 */
@Value
public class BudgetPoint {
    Instant timestamp;
    double remaining;
}
