package relay.pump;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultInFlightTrackerTest {

    @Test
    void secondAcquireOfSameDeliveryFails() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        assertTrue(tracker.tryAcquire("d-1"));
        assertFalse(tracker.tryAcquire("d-1"));
        assertTrue(tracker.tryAcquire("d-2"));
        assertEquals(2, tracker.size());
    }

    @Test
    void releaseAllowsReacquisition() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        tracker.tryAcquire("d-1");
        tracker.release("d-1");

        assertTrue(tracker.tryAcquire("d-1"));
    }

    @Test
    void releasingUnknownDeliveryIsNoOp() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        tracker.release("missing");

        assertEquals(0, tracker.size());
    }

    @Test
    void staleEntryCanBeTakenOverAfterTtl() throws InterruptedException {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker(20);

        assertTrue(tracker.tryAcquire("d-1"));
        Thread.sleep(50);

        assertTrue(tracker.tryAcquire("d-1"));
    }

    @Test
    void negativeTtlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultInFlightTracker(-1));
    }
}
