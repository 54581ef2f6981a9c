package com.qurse.backend.common.exception;

public record FieldViolation(String field, String message) {}
