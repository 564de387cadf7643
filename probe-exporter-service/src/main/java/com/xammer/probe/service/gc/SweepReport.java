package com.xammer.probe.service.gc;

import com.xammer.probe.domain.GcCandidate;
import com.xammer.probe.domain.ResourceKind;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Outcome of one sweep. */
@Getter
public class SweepReport {

    private final Instant startedAt;
    private final List<GcCandidate> deleted = new ArrayList<>();
    private final List<GcCandidate> failed = new ArrayList<>();
    private final Set<ResourceKind> listFailures = EnumSet.noneOf(ResourceKind.class);
    private int retained;
    private String abortReason;

    public SweepReport(Instant startedAt) {
        this.startedAt = startedAt;
    }

    void deleted(GcCandidate candidate) {
        deleted.add(candidate);
    }

    void failed(GcCandidate candidate) {
        failed.add(candidate);
    }

    void retained(int count) {
        retained += count;
    }

    void listFailed(ResourceKind kind) {
        listFailures.add(kind);
    }

    void abort(String reason) {
        abortReason = reason;
    }

    public boolean isAborted() {
        return abortReason != null;
    }
}
