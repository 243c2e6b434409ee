package com.company.errorbudget.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeResponse {
    private int requested;
    private int acknowledged;
    private String acknowledgedBy;
}
