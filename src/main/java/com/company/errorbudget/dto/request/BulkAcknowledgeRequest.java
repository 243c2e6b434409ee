package com.company.errorbudget.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkAcknowledgeRequest {
    @NotEmpty(message = "alert_ids must not be empty")
    @Size(max = 500)
    private List<Long> alertIds;

    @Size(max = 200)
    private String acknowledgedBy;
}
