package io.blockchain.datastore.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public final class ReplicationMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter recordsStored = Counter.builder("datastore.records.stored")
            .description("Records written to the database")
            .register(registry);
    private static final Counter recordsDeleted = Counter.builder("datastore.records.deleted")
            .description("Records removed from the database after a revert")
            .register(registry);
    private static final Counter replicationFailures = Counter.builder("datastore.replication.failures")
            .description("Failed store/delete/checkpoint calls")
            .register(registry);
    private static final Timer changeTime = Timer.builder("datastore.consensus.change.time")
            .description("Time spent processing one consensus change for one namespace")
            .register(registry);

    private ReplicationMetrics() {}

    public static void recordStored() {
        recordsStored.increment();
    }

    public static void recordDeleted() {
        recordsDeleted.increment();
    }

    public static void replicationFailure() {
        replicationFailures.increment();
    }

    public static void recordChange(Runnable processing) {
        changeTime.record(processing);
    }

    public static void controlEvent(String action) {
        Counter.builder("datastore.control.events")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                m.getId().getTags().forEach(t -> sb.append('{').append(t.getKey()).append('=').append(t.getValue()).append('}'));
                sb.append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
