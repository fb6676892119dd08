package com.ecp.governance.controller;

import java.util.Map;

final class RequestFields {

    private RequestFields() {
    }

    /**
     * @return the field's value, or null when absent
     * @throws IllegalArgumentException if the field is present but not a string
     */
    static String optionalString(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalArgumentException(field + " must be a string");
    }
}
