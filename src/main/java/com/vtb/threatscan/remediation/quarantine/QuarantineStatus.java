package com.vtb.threatscan.remediation.quarantine;

public enum QuarantineStatus {
    ACTIVE,
    RESTORED,
    DELETED
}
