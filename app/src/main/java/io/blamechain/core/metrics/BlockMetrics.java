package io.blamechain.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class BlockMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksMined = registry.counter("blocks.mined");
    private static final Counter actionsEnqueued = registry.counter("actions.enqueued");
    private static final Timer miningTime = registry.timer("block.mining.time");
    private static final DistributionSummary miningAttempts = DistributionSummary.builder("block.mining.attempts")
            .description("Nonces tried per mined block")
            .register(registry);
    private static final Counter miningTimeouts = Counter.builder("block.mining.timeouts")
            .description("Mining attempts that exhausted the configured cap")
            .register(registry);

    private BlockMetrics() {}

    public static <T> T recordMining(Supplier<T> miningLogic) {
        return miningTime.record(miningLogic);
    }

    public static void blockMined(long attempts) {
        blocksMined.increment();
        miningAttempts.record(attempts);
    }

    public static void miningTimedOut() {
        miningTimeouts.increment();
    }

    public static void actionEnqueued() {
        actionsEnqueued.increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                m.getId().getTags().forEach(tag -> sb.append(',').append(tag.getKey()).append('=').append(tag.getValue()));
                sb.append("} ").append(meas.getValue()).append('\n');
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
