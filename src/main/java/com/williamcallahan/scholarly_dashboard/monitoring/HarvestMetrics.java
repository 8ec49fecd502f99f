/**
 * Counters and timers for catalog harvesting
 *
 * @author William Callahan
 */

package com.williamcallahan.scholarly_dashboard.monitoring;

import com.williamcallahan.scholarly_dashboard.repository.InsertSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

@Service
public class HarvestMetrics {

    // Counters
    private final Counter pagesFetched;
    private final Counter recordsProcessed;
    private final Counter rowsInserted;
    private final Counter rowsAlreadyPresent;
    private final Counter rowsSkipped;
    private final Counter harvestFailures;

    // Gauges
    private final AtomicInteger activeHarvests = new AtomicInteger(0);

    // Timers
    private final Timer pageTimer;

    public HarvestMetrics(MeterRegistry meterRegistry) {
        this.pagesFetched = Counter.builder("harvest.pages.fetched")
            .description("Number of catalog pages fetched")
            .register(meterRegistry);

        this.recordsProcessed = Counter.builder("harvest.records.processed")
            .description("Number of work records written to the sink and/or database")
            .register(meterRegistry);

        this.rowsInserted = Counter.builder("harvest.rows")
            .tag("outcome", "inserted")
            .description("Rows inserted by insert-if-absent")
            .register(meterRegistry);

        this.rowsAlreadyPresent = Counter.builder("harvest.rows")
            .tag("outcome", "already_present")
            .description("Rows whose primary key was already stored")
            .register(meterRegistry);

        this.rowsSkipped = Counter.builder("harvest.rows")
            .tag("outcome", "skipped")
            .description("Rows skipped for a missing primary key")
            .register(meterRegistry);

        this.harvestFailures = Counter.builder("harvest.failures")
            .description("Number of harvests that ended in FAILED")
            .register(meterRegistry);

        Gauge.builder("harvest.active", activeHarvests, AtomicInteger::get)
            .description("Number of harvests currently running")
            .register(meterRegistry);

        this.pageTimer = Timer.builder("harvest.page.duration")
            .description("Time to fetch and persist one page")
            .register(meterRegistry);
    }

    public void recordPageFetched() {
        pagesFetched.increment();
    }

    public void recordRecordsProcessed(int count) {
        recordsProcessed.increment(count);
    }

    public void recordInserts(InsertSummary summary) {
        if (summary == null) {
            return;
        }
        rowsInserted.increment(summary.inserted());
        rowsAlreadyPresent.increment(summary.alreadyPresent());
        rowsSkipped.increment(summary.skipped());
    }

    public void recordFailure() {
        harvestFailures.increment();
    }

    public void harvestStarted() {
        activeHarvests.incrementAndGet();
    }

    public void harvestFinished() {
        activeHarvests.decrementAndGet();
    }

    public Timer pageTimer() {
        return pageTimer;
    }
}
