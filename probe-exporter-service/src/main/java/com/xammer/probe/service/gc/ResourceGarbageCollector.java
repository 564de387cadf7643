package com.xammer.probe.service.gc;

import com.xammer.probe.config.ProbeProperties;
import com.xammer.probe.domain.GcCandidate;
import com.xammer.probe.domain.ResourceKind;
import com.xammer.probe.domain.TrackedResource;
import com.xammer.probe.exception.ProbeException;
import com.xammer.probe.service.probe.ScrapeDeadline;
import com.xammer.probe.service.provider.CloudSession;
import com.xammer.probe.service.provider.CloudSessionFactory;
import com.xammer.probe.service.provider.ResourceInventory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deletes tagged resources older than the retention threshold, whatever
 * happened to the probe that created them.
 * <p>
 * Safe to run next to live probes: the retention threshold is longer than the
 * longest scrape, so a resource still in use is never old enough to qualify.
 */
@Service
public class ResourceGarbageCollector {

    private static final Logger logger = LoggerFactory.getLogger(ResourceGarbageCollector.class);

    private final CloudSessionFactory sessionFactory;
    private final GarbageCollectorStatistics statistics;
    private final Duration retention;
    private final Duration sweepTimeout;
    private final Clock clock;

    private volatile ScrapeDeadline runningSweep;

    public ResourceGarbageCollector(CloudSessionFactory sessionFactory, ProbeProperties properties,
                                    GarbageCollectorStatistics statistics, Clock clock) {
        this.sessionFactory = sessionFactory;
        this.statistics = statistics;
        this.retention = properties.getGc().getRetention();
        this.sweepTimeout = properties.getGc().getSweepTimeout();
        this.clock = clock;
    }

    public SweepReport sweep() {
        SweepReport report = new SweepReport(clock.instant());
        ScrapeDeadline deadline = ScrapeDeadline.after(sweepTimeout, clock);
        runningSweep = deadline;
        try (CloudSession session = sessionFactory.openSession(deadline)) {
            logger.debug("Garbage collection sweep authenticated as {}", session.getIdentity());
            for (ResourceKind kind : ResourceKind.values()) {
                if (deadline.isExpired()) {
                    report.abort("sweep stopped before " + kind);
                    logger.warn("Garbage collection sweep stopped before {}", kind);
                    break;
                }
                sweepKind(session.inventory(), kind, deadline, report);
            }
        } catch (ProbeException e) {
            report.abort(e.getMessage());
            logger.error("Garbage collection sweep could not start: {}", e.getMessage());
        } catch (RuntimeException e) {
            report.abort(e.toString());
            logger.error("Garbage collection sweep failed unexpectedly", e);
        } finally {
            runningSweep = null;
            statistics.record(report);
        }
        logger.info("Garbage collection sweep done: {} deleted, {} failed, {} retained",
                report.getDeleted().size(), report.getFailed().size(), report.getRetained());
        return report;
    }

    /** Makes an in-flight sweep stop at its next provider call. */
    public void cancelRunningSweep() {
        ScrapeDeadline deadline = runningSweep;
        if (deadline != null) {
            deadline.cancel();
        }
    }

    /** Resources whose age, relative to {@code now}, exceeds the retention threshold. */
    public List<GcCandidate> collectable(List<TrackedResource> resources, Instant now) {
        return resources.stream()
                .filter(resource -> resource.getName() != null)
                .map(resource -> GcCandidate.of(resource, now))
                .filter(candidate -> candidate.isOlderThan(retention))
                .collect(Collectors.toList());
    }

    private void sweepKind(ResourceInventory inventory, ResourceKind kind, ScrapeDeadline deadline, SweepReport report) {
        List<TrackedResource> listed;
        try {
            listed = inventory.list(kind);
        } catch (ProbeException e) {
            report.listFailed(kind);
            logger.warn("Cannot list {} resources: {}", kind, e.getMessage());
            return;
        } catch (RuntimeException e) {
            report.listFailed(kind);
            logger.error("Unexpected error listing {} resources", kind, e);
            return;
        }
        List<GcCandidate> candidates = collectable(listed, clock.instant());
        report.retained(listed.size() - candidates.size());
        for (GcCandidate candidate : candidates) {
            if (deadline.isExpired()) {
                logger.warn("Garbage collection sweep stopped during {}", kind);
                return;
            }
            TrackedResource resource = candidate.getResource();
            try {
                inventory.delete(resource);
                report.deleted(candidate);
                logger.info("Deleted {} {} ({}), age {}", kind, resource.getId(), resource.getName(), candidate.getAge());
            } catch (ProbeException e) {
                report.failed(candidate);
                logger.warn("Failed to delete {} {} ({}): {}", kind, resource.getId(), resource.getName(), e.getMessage());
            } catch (RuntimeException e) {
                report.failed(candidate);
                logger.error("Unexpected error deleting {} {} ({})", kind, resource.getId(), resource.getName(), e);
            }
        }
    }
}
