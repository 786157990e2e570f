package com.marketpulse.api.dto.request;

import com.marketpulse.domain.enums.RegimeBasis;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.Data;

@Data
public class RegimeRequest {

    @NotNull(message = "currentLevel is required")
    @PositiveOrZero(message = "currentLevel must not be negative")
    private Double currentLevel;

    @NotEmpty(message = "history must not be empty")
    private List<Double> history;

    /** Configured basis when absent. */
    private RegimeBasis basis;
}
