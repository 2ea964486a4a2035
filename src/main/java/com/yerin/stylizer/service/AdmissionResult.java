package com.yerin.stylizer.service;

import com.yerin.stylizer.domain.Job;

public record AdmissionResult(Job job, RejectReason reason) {

    public enum RejectReason {
        CAPACITY_EXCEEDED,
        DUPLICATE_JOB_ID
    }

    public static AdmissionResult accepted(Job job) {
        return new AdmissionResult(job, null);
    }

    public static AdmissionResult rejected(RejectReason reason) {
        return new AdmissionResult(null, reason);
    }

    public boolean accepted() {
        return job != null;
    }
}
