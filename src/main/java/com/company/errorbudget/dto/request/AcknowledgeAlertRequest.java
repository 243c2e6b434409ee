package com.company.errorbudget.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of an acknowledgement; defaults to the authenticated caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeAlertRequest {
    @Size(max = 200)
    private String acknowledgedBy;
}
