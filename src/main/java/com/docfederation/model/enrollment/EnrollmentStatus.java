package com.docfederation.model.enrollment;

public enum EnrollmentStatus {
    ACTIVE,
    SUSPENDED
}
