package com.company.errorbudget.dto.request;

import jakarta.validation.Valid;
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
public class IngestTrafficRequest {
    @NotEmpty(message = "samples must not be empty")
    @Size(max = 5000)
    @Valid
    private List<TrafficSampleRequest> samples;
}
