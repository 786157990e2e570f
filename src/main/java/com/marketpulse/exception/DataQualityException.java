package com.marketpulse.exception;

import java.util.Map;

/**
 * A contract lacks the quotes needed for analysis or scoring. The screener catches
 * this per contract and drops the contract instead of failing the batch.
 */
public class DataQualityException extends BaseException {

    public DataQualityException(String message) {
        super(ErrorCode.DATA_QUALITY_ERROR, message);
    }

    public DataQualityException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_QUALITY_ERROR, message, details);
    }
}
