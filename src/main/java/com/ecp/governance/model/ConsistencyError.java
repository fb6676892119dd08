package com.ecp.governance.model;

public record ConsistencyError(String check, String severity, String referenceId, String message) {}
