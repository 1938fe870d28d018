package de.bsommerfeld.xivpatch.updater.update;

import com.google.common.base.Ticker;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TransferMeterTest {

    private static final class ManualTicker extends Ticker {
        private long nanos;

        void advanceMillis(long millis) {
            nanos += TimeUnit.MILLISECONDS.toNanos(millis);
        }

        @Override
        public long read() {
            return nanos;
        }
    }

    private final ManualTicker ticker = new ManualTicker();

    @Test
    void sample_shouldRespectReportInterval() {
        TransferMeter meter = new TransferMeter(1000, 500, ticker);

        ticker.advanceMillis(100);
        meter.progress(100);
        assertTrue(meter.sample("a", 1, 1).isEmpty());

        ticker.advanceMillis(400);
        assertTrue(meter.sample("a", 1, 1).isPresent());
        assertTrue(meter.sample("a", 1, 1).isEmpty());
    }

    @Test
    void snapshot_shouldComputeSpeedFromNetworkBytesOnly() {
        TransferMeter meter = new TransferMeter(3000, 500, ticker);
        meter.skip(1000);

        ticker.advanceMillis(1000);
        meter.progress(500);

        TransferStats stats = meter.snapshot("b", 2, 3);
        assertEquals(1500, stats.transferredBytes());
        assertEquals(500, stats.bytesPerSecond());
        assertEquals(3, stats.remainingSeconds());
        assertEquals(0.5, stats.ratio(), 1e-9);
    }

    @Test
    void progress_shouldNotDoubleCountRestartedTransfer() {
        TransferMeter meter = new TransferMeter(1000, 500, ticker);
        meter.progress(400);
        meter.progress(100);
        meter.progress(600);
        meter.finishPatch(1000);

        ticker.advanceMillis(1000);
        TransferStats stats = meter.snapshot("c", 1, 1);
        assertEquals(1000, stats.transferredBytes());
        assertEquals(900, stats.bytesPerSecond());
        assertEquals(1.0, meter.ratio());
    }

    @Test
    void snapshot_shouldReportUnknownRemainingWithoutThroughput() {
        TransferMeter meter = new TransferMeter(1000, 500, ticker);
        ticker.advanceMillis(10);

        TransferStats stats = meter.snapshot("d", 1, 1);
        assertEquals(-1, stats.remainingSeconds());
        assertEquals("?", stats.formattedRemaining());
    }
}
