package com.marketpulse.domain.enums;

public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH,
    VERY_HIGH
}
