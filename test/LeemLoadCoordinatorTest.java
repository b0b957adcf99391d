import java.io.File;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link LeemLoadCoordinator} class.
 * The frames are not read from files; the ingestor creates stacks whose depth
 * is taken from the energy step of the request, so the deliveries can be told apart.
 */
public class LeemLoadCoordinatorTest {

    private static final long TIMEOUT_MILLIS = 5000;

    private LeemTestLog log;
    private CountDownLatch releaseSlowLoad;
    private LeemLoadCoordinator coordinator;

    @Before
    public void setup() throws Exception {
        log = new LeemTestLog();
        releaseSlowLoad = new CountDownLatch(1);
        coordinator = new LeemLoadCoordinator(new FakeIngestor(), log);
    }

    @After
    public void tearDown() throws Exception {
        releaseSlowLoad.countDown();
    }

    @Test
    public void testSuccessfulLoadIsDeliveredOnce() throws Exception {
        final RecordingListener listener = new RecordingListener();
        coordinator.submit(request("fast", 4), listener);

        Assert.assertTrue("no delivery", listener.await());
        Assert.assertTrue("load thread not finished", coordinator.waitForLoad(TIMEOUT_MILLIS));
        Assert.assertEquals("invalid number of deliveries", 1, listener.readyCount.get());
        Assert.assertEquals("failure reported", 0, listener.failedCount.get());
        Assert.assertEquals("invalid stack", 4, listener.stack.get().getDepth());
        Assert.assertFalse("still loading", coordinator.isLoading());
    }

    @Test
    public void testFailureIsDelivered() throws Exception {
        final RecordingListener listener = new RecordingListener();
        coordinator.submit(request("broken", 4), listener);

        Assert.assertTrue("no delivery", listener.await());
        coordinator.waitForLoad(TIMEOUT_MILLIS);
        Assert.assertEquals("stack delivered", 0, listener.readyCount.get());
        Assert.assertEquals("invalid number of failures", 1, listener.failedCount.get());
        final Exception error = listener.error.get();
        Assert.assertTrue("invalid error type " + error, error instanceof LeemIngestException);
        Assert.assertEquals(LeemIngestException.Reason.NO_FRAMES, ((LeemIngestException) error).getReason());
    }

    @Test
    public void testSupersededLoadIsNotDelivered() throws Exception {
        final RecordingListener first = new RecordingListener();
        final RecordingListener second = new RecordingListener();
        coordinator.submit(request("slow", 7), first);
        Assert.assertTrue("not loading", coordinator.isLoading());
        coordinator.submit(request("fast", 3), second);

        Assert.assertTrue("second load not delivered", second.await());
        releaseSlowLoad.countDown();
        Assert.assertTrue("superseded load not discarded",
                          log.waitFor("Discarded result of superseded load", TIMEOUT_MILLIS));

        Assert.assertEquals("superseded load delivered", 0, first.readyCount.get() + first.failedCount.get());
        Assert.assertEquals("invalid number of deliveries", 1, second.readyCount.get());
        Assert.assertEquals("invalid stack", 3, second.stack.get().getDepth());
    }

    @Test
    public void testSameListenerGetsOnlyLatestLoad() throws Exception {
        final RecordingListener listener = new RecordingListener();
        coordinator.submit(request("slow", 7), listener);
        coordinator.submit(request("fast", 3), listener);

        Assert.assertTrue("no delivery", listener.await());
        releaseSlowLoad.countDown();
        Assert.assertTrue(log.waitFor("Discarded result of superseded load", TIMEOUT_MILLIS));

        Assert.assertEquals("invalid number of deliveries", 1, listener.readyCount.get());
        Assert.assertEquals("stack of superseded load delivered", 3, listener.stack.get().getDepth());
    }

    @Test
    public void testDetach() throws Exception {
        final RecordingListener listener = new RecordingListener();
        coordinator.submit(request("slow", 7), listener);
        coordinator.detach();
        Assert.assertFalse("loading after detach", coordinator.isLoading());
        releaseSlowLoad.countDown();
        Assert.assertTrue(log.waitFor("Discarded result of superseded load", TIMEOUT_MILLIS));
        Assert.assertEquals("detached listener called", 0, listener.readyCount.get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testListenerRequired() throws Exception {
        coordinator.submit(request("fast", 3), null);
    }

    private static LeemLoadRequest request(final String name,
                                           final int depth) {
        return LeemLoadRequest.raw(new File(name), 2, 2, 16, true, ".dat", 0, depth);
    }

    /** Creates stacks without files: depth = energy step; 'broken' fails, 'slow' waits for the latch. */
    private class FakeIngestor extends LeemFrameIngestor {

        FakeIngestor() {
            super(log);
        }

        @Override
        public LeemStack load(final LeemLoadRequest request) throws LeemIngestException {
            final String name = request.getDirectory().getName();
            if ("broken".equals(name)) {
                throw new LeemIngestException(LeemIngestException.Reason.NO_FRAMES, request.getDirectory(), "no frames");
            }
            if ("slow".equals(name)) {
                try {
                    releaseSlowLoad.await(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return LeemTestFrames.makeStack(request.getHeight(), request.getWidth(), (int) request.getEnergyStep());
        }
    }

    private static class RecordingListener implements LeemLoadListener {

        private final AtomicInteger readyCount = new AtomicInteger();
        private final AtomicInteger failedCount = new AtomicInteger();
        private final AtomicReference<LeemStack> stack = new AtomicReference<>();
        private final AtomicReference<Exception> error = new AtomicReference<>();
        private final CountDownLatch delivered = new CountDownLatch(1);

        @Override
        public void stackReady(final LeemStack stack) {
            readyCount.incrementAndGet();
            this.stack.set(stack);
            delivered.countDown();
        }

        @Override
        public void loadFailed(final LeemLoadRequest request,
                               final Exception error) {
            failedCount.incrementAndGet();
            this.error.set(error);
            delivered.countDown();
        }

        boolean await() throws InterruptedException {
            return delivered.await(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        }
    }
}
