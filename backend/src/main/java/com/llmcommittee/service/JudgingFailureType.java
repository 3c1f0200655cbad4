package com.llmcommittee.service;

import org.springframework.http.HttpStatus;

public enum JudgingFailureType {
    PRECONDITION_FAILED(HttpStatus.BAD_REQUEST, "precondition_failed"),
    ALL_JUDGES_FAILED(HttpStatus.BAD_GATEWAY, "all_judges_failed"),
    CANCELLED(HttpStatus.CONFLICT, "cancelled");

    private final HttpStatus status;
    private final String code;

    JudgingFailureType(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
