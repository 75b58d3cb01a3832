package com.ivamare.eventstore.model;

/**
 * Kind of remediation suggested for an event.
 */
public enum RepairActionType {
    IGNORE_NO_ACTION_REQUIRED,
    REBOOT_SYSTEM,
    HARDWARE_INSPECTION,
    CHECK_USER_APP_AND_GPU
}
