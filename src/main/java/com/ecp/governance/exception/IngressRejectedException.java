package com.ecp.governance.exception;

import java.util.List;

/**
 * A decision failed context validation at the ingress gate. Nothing was written.
 */
public class IngressRejectedException extends RuntimeException {

    private final List<String> missingFields;

    public IngressRejectedException(List<String> missingFields) {
        super("Missing required context fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
