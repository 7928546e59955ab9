package com.example.kodeposimport.exception;

public class JobNotFoundException extends ImportException {
    public JobNotFoundException(String jobId) {
        super(ImportErrorCode.JOB_NOT_FOUND, "Import job not found: " + jobId);
    }
}
