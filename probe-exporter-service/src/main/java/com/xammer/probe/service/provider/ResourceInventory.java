package com.xammer.probe.service.provider;

import com.xammer.probe.domain.ResourceKind;
import com.xammer.probe.domain.TrackedResource;

import java.util.List;

/**
 * Tag-based view of everything this exporter has created, used by the garbage
 * collector. Only resources whose name parses as ours are returned.
 */
public interface ResourceInventory {

    List<TrackedResource> list(ResourceKind kind);

    void delete(TrackedResource resource);
}
