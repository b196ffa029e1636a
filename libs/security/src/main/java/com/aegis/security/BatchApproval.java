package com.aegis.security;

/**
 * Policy for combining per-element decisions when a descriptor targets several resources.
 */
public enum BatchApproval {
    /** At least one element must be allowed. */
    ANY,
    /** Every element must be allowed. */
    ALL
}
