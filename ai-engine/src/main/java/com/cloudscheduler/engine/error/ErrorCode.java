package com.cloudscheduler.engine.error;

public enum ErrorCode {
    BAD_REQUEST, INSUFFICIENT_HISTORY, INVALID_INPUT, INTERNAL_ERROR
}
