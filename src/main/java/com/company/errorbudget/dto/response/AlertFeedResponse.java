package com.company.errorbudget.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertFeedResponse {
    private List<AlertResponse> alerts;
    private int total;
    private int unacknowledged;
}
