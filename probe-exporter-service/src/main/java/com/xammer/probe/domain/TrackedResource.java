package com.xammer.probe.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A provider resource carrying one of our names. Nothing about it is cached:
 * the garbage collector builds these from a fresh listing on every sweep.
 */
@Data
@AllArgsConstructor
public class TrackedResource {
    private ResourceKind kind;
    private String id; // instance id, key name, allocation id or bucket name
    private ResourceName name;
}
