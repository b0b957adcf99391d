import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link LeemStackStore} class.
 */
public class LeemStackStoreTest {

    @Test
    public void testEmptyStore() throws Exception {
        final LeemStackStore store = new LeemStackStore();
        Assert.assertFalse("empty store has data", store.hasData());
        Assert.assertNull("empty store has stack", store.getStack());
        Assert.assertFalse(store.isSmoothed(0, 0));
        try {
            store.getSpectrum(0, 0);
            Assert.fail("spectrum of empty store returned");
        } catch (final IllegalStateException e) {
            Assert.assertNotNull(e.getMessage());
        }
    }

    @Test
    public void testSmoothedSpectrumIsCalculatedOnce() throws Exception {
        final LeemStackStore store = new LeemStackStore();
        store.publish(LeemTestFrames.makeStack(3, 4, 12));
        final LeemSmoother smoother = new LeemSmoother(LeemSmoother.WindowType.FLAT, 10, null);

        final double[] first = store.getSmoothedSpectrum(1, 2, smoother);
        Assert.assertEquals("invalid length", 12, first.length);
        Assert.assertTrue("not cached", store.isSmoothed(1, 2));
        Assert.assertFalse("other pixel cached", store.isSmoothed(2, 1));

        first[0] = -1;      // must not modify the cache
        final double[] second = store.getSmoothedSpectrum(1, 2, smoother);
        Assert.assertEquals("smoothed more than once", 1, store.getSmoothCount());
        Assert.assertArrayEquals("cached curve differs",
                                 smoother.smooth(store.getSpectrum(1, 2)), second, 0);

        store.getSmoothedSpectrum(2, 1, smoother);
        Assert.assertEquals("second pixel not smoothed", 2, store.getSmoothCount());
    }

    @Test
    public void testPublishResetsCache() throws Exception {
        final LeemStackStore store = new LeemStackStore();
        final LeemSmoother smoother = new LeemSmoother(LeemSmoother.WindowType.HANNING, 4, null);
        store.publish(LeemTestFrames.makeStack(3, 4, 6));
        store.getSmoothedSpectrum(0, 0, smoother);

        final LeemStack replacement = LeemTestFrames.makeStack(2, 2, 8);
        store.publish(replacement);
        Assert.assertSame("stack not replaced", replacement, store.getStack());
        Assert.assertEquals("cache not reset", 0, store.getSmoothCount());
        Assert.assertFalse("pixel still cached", store.isSmoothed(0, 0));
        Assert.assertEquals("invalid length after publish", 8, store.getSmoothedSpectrum(0, 0, smoother).length);

        store.resetSmoothCache();
        Assert.assertFalse("pixel cached after reset", store.isSmoothed(0, 0));

        store.clear();
        Assert.assertFalse("data after clear", store.hasData());
    }

    @Test
    public void testFailedSmoothingIsNotCached() throws Exception {
        final LeemStackStore store = new LeemStackStore();
        store.publish(LeemTestFrames.makeStack(2, 2, 5));
        final LeemSmoother smoother = new LeemSmoother(LeemSmoother.WindowType.FLAT, 10, null);
        try {
            store.getSmoothedSpectrum(0, 0, smoother);
            Assert.fail("5 points smoothed with window of 10");
        } catch (final LeemSmoothException e) {
            Assert.assertEquals(LeemSmoothException.Reason.SEQUENCE_TOO_SHORT, e.getReason());
        }
        Assert.assertFalse("failed curve cached", store.isSmoothed(0, 0));
        Assert.assertEquals(0, store.getSmoothCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPixelOutsideImage() throws Exception {
        final LeemStackStore store = new LeemStackStore();
        store.publish(LeemTestFrames.makeStack(3, 4, 12));
        store.getSmoothedSpectrum(3, 0, new LeemSmoother(LeemSmoother.WindowType.FLAT, 10, null));
    }
}
