package io.clustermanager.commission;

/**
 * Phases of a commission event.
 *
 * CREATED -> VALIDATING -> PREPARING_INVENTORY -> SETTING_PROVISIONING -> RUNNING
 * -> COMMITTING | ROLLING_BACK -> DONE. Any synchronous failure ends in REJECTED.
 */
public enum CommissionState {
    CREATED,
    VALIDATING,
    PREPARING_INVENTORY,
    SETTING_PROVISIONING,
    RUNNING,
    COMMITTING,
    ROLLING_BACK,
    DONE,
    REJECTED
}
