package io.warden.policy;

public enum PolicyPhase {
    /** Before the connector is invoked; the task carries resolved inputs but no output. */
    PRE_DISPATCH,
    /** After the connector returned; the task carries its candidate output. */
    PRE_COMPLETION
}
