package com.company.errorbudget.engine;

import com.company.errorbudget.domain.ErrorBudgetLedgerEntry;
import lombok.Value;

/**
 * Ledger state after one accrual step plus the derived budget percentages.
 */
@Value
public class LedgerAccrual {
    ErrorBudgetLedgerEntry entry;
    double accruedErrorHours;
    double consumedPercentage;
    double remainingPercentage;
    boolean rolledOver;
}
