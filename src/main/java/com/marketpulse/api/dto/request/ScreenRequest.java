package com.marketpulse.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;
import lombok.Data;

/** Screen over caller-supplied chains. {@code regime} is classified first when present. */
@Data
public class ScreenRequest {

    @Valid
    @NotEmpty(message = "universe must not be empty")
    private List<SymbolChainRequest> universe;

    @Valid
    @NotNull(message = "criteria is required")
    private CriteriaRequest criteria;

    @Valid
    private RegimeRequest regime;

    @NotNull(message = "asof is required")
    private LocalDate asof;
}
