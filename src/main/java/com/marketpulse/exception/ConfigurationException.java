package com.marketpulse.exception;

import java.util.Map;

/**
 * Screening criteria or application settings that cannot be applied, e.g. an empty
 * or inverted band (min > max) or scoring weights that do not sum to 100.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }
}
