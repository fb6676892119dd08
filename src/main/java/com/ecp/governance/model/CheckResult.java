package com.ecp.governance.model;

import java.util.List;

public record CheckResult(String description, String severity, List<ConsistencyError> errors) {

    public boolean failed() {
        return !errors.isEmpty();
    }
}
