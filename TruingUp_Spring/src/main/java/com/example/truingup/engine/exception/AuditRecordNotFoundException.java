package com.example.truingup.engine.exception;

public class AuditRecordNotFoundException extends TruingUpException {

    public AuditRecordNotFoundException(String checksum) {
        super("No audit record with checksum " + checksum);
    }
}
