package io.folioledger.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksProduced = registry.counter("ledger.blocks.produced");
    private static final Counter blocksConfirmed = registry.counter("ledger.blocks.confirmed");
    private static final Counter blocksRejected = registry.counter("ledger.blocks.rejected");
    private static final Counter txEvicted = registry.counter("ledger.transactions.evicted");
    private static final Counter syncBlocksReceived = registry.counter("sync.blocks.received");
    private static final Counter handshakesRejected = registry.counter("sync.handshakes.rejected");
    private static final Timer productionTime = registry.timer("ledger.block.production.time");

    private LedgerMetrics() {}

    public static <T> T recordProduction(Supplier<T> blockProductionLogic) {
        return productionTime.record(blockProductionLogic);
    }

    public static void blockProduced() {
        blocksProduced.increment();
    }

    public static void blockConfirmed() {
        blocksConfirmed.increment();
    }

    public static void blockRejected() {
        blocksRejected.increment();
    }

    public static void transactionEvicted() {
        txEvicted.increment();
    }

    public static void blocksReceived(int count) {
        syncBlocksReceived.increment(count);
    }

    public static void handshakeRejected() {
        handshakesRejected.increment();
    }

    public static Timer.Sample startHttp() {
        return Timer.start(registry);
    }

    public static void stopHttp(Timer.Sample sample, String method, String path, int status) {
        Timer timer = Timer
                .builder("http.server.requests")
                .description("HTTP server request duration")
                .tag("method", method)
                .tag("path", path)
                .tag("status", Integer.toString(status))
                .register(registry);
        sample.stop(timer);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            StringBuilder tags = new StringBuilder();
            for (Tag tag : m.getId().getTags()) {
                tags.append(tag.getKey()).append('=').append(tag.getValue()).append(',');
            }
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append('{')
                  .append(tags)
                  .append("stat=")
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
