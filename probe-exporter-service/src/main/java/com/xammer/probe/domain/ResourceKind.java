package com.xammer.probe.domain;

/**
 * Kinds of provider resources created by the probes. The declaration order is
 * the order in which the garbage collector sweeps them: an address must be
 * released before the instance it points at goes away, and a bucket is the
 * last thing a storage probe creates a dependency on.
 */
public enum ResourceKind {
    ADDRESS,
    INSTANCE,
    KEY_PAIR,
    BUCKET
}
