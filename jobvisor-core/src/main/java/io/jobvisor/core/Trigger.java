package io.jobvisor.core;

/**
 * Why a job was dispatched.
 */
public enum Trigger {
    CLOCK,
    CASCADE,
    MANUAL,
    SUPERVISOR
}
