package com.claude.patternlearning.exception;

public class TenantNotFoundException extends PatternLearningException {
    private static final String DEFAULT_ERROR_CODE = "ERR-TENANT-404";

    public TenantNotFoundException(String tenantId) {
        super(String.format("Tenant with identifier %s not found", tenantId));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
