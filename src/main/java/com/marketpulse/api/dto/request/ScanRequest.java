package com.marketpulse.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import lombok.Data;

/** Provider-backed scan: chains and regime are loaded server-side. */
@Data
public class ScanRequest {

    @NotEmpty(message = "symbols must not be empty")
    @Size(max = 200, message = "symbols must not exceed 200")
    private List<String> symbols;

    @Valid
    @NotNull(message = "criteria is required")
    private CriteriaRequest criteria;

    @NotNull(message = "asof is required")
    private LocalDate asof;
}
