package com.synthetic.solvency.api;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;

final class RequestValues {

    private RequestValues() {
    }

    static long required(Long value, String field) {
        if (value == null) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, field + " is required");
        }
        return value;
    }

    static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, field + " is required");
        }
        return value;
    }
}
