package io.seatwatch.api.pool;

/**
 * Why a borrow was refused.
 */
public enum FailureReason {
    /** Every seat of the pool is borrowed. */
    EXHAUSTED,
    /** The overage allowance is used up while total capacity remains. */
    MAX_OVERAGE,
    /** The pool was soft-deactivated. */
    INACTIVE,
    /** No pool with that name. */
    UNKNOWN_POOL
}
