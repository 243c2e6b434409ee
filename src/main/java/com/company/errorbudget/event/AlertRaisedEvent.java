package com.company.errorbudget.event;

import com.company.errorbudget.domain.Alert;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Published after a new alert is persisted; drives notification delivery.
 */
@Getter
@AllArgsConstructor
public class AlertRaisedEvent {
    private final Alert alert;
}
