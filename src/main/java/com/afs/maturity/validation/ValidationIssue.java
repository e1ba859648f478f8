package com.afs.maturity.validation;

public record ValidationIssue(String code, String message, String node) {}
