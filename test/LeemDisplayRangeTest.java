import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ShortProcessor;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link LeemDisplayRange} class.
 */
public class LeemDisplayRangeTest {

    @Test
    public void testLinearMapping() throws Exception {
        final ShortProcessor ip = makeRow(0, 50, 100, 200, 65535);
        final ByteProcessor mapped = LeemDisplayRange.map(ip, 0, 100);
        Assert.assertEquals("invalid width", 5, mapped.getWidth());
        Assert.assertEquals("invalid height", 1, mapped.getHeight());
        Assert.assertArrayEquals("invalid mapped values", new int[] {0, 127, 255, 255, 255}, getValues(mapped));
    }

    @Test
    public void testValuesBelowLowerAreBlack() throws Exception {
        final ShortProcessor ip = makeRow(0, 99, 100, 101, 355);
        Assert.assertArrayEquals("invalid mapped values",
                                 new int[] {0, 0, 0, 1, 255}, getValues(LeemDisplayRange.map(ip, 100, 355)));
    }

    @Test
    public void testSourceIsNotModified() throws Exception {
        final ShortProcessor ip = makeRow(0, 50, 100, 200);
        final Object before = ip.getPixelsCopy();
        LeemDisplayRange.map(ip, 10, 60);
        Assert.assertArrayEquals("source modified", (short[]) before, (short[]) ip.getPixels());
    }

    @Test
    public void testDefaultRangeIsDataRange() throws Exception {
        final ShortProcessor ip = makeRow(10, 15, 20);
        Assert.assertArrayEquals("invalid mapped values", new int[] {0, 127, 255}, getValues(LeemDisplayRange.map(ip)));

        final ShortProcessor flat = makeRow(7, 7, 7);
        Assert.assertArrayEquals("invalid mapping of flat image", new int[] {0, 0, 0}, getValues(LeemDisplayRange.map(flat)));
    }

    @Test
    public void testFloatData() throws Exception {
        final FloatProcessor fp = new FloatProcessor(4, 1, new float[] {-1f, 25f, 50f, Float.NaN});
        Assert.assertArrayEquals("invalid mapped values", new int[] {0, 127, 255, 0}, getValues(LeemDisplayRange.map(fp, 0, 50)));
    }

    @Test
    public void testInvalidRanges() throws Exception {
        final double[][] ranges = {{100, 100}, {100, 50}, {-1, 10}, {0, 65536}, {65535, 65535.5}, {0, -5}};
        final ShortProcessor ip = makeRow(0, 1);
        for (final double[] range : ranges) {
            try {
                LeemDisplayRange.map(ip, range[0], range[1]);
                Assert.fail("range " + range[0] + "-" + range[1] + " accepted");
            } catch (final LeemRangeException e) {
                Assert.assertEquals("invalid lower in exception", range[0], e.getLower(), 0);
            }
        }
        // largest valid range
        LeemDisplayRange.checkRange(0, 65535);
        LeemDisplayRange.checkRange(65534, 65535);
    }

    private static ShortProcessor makeRow(final int... values) {
        final ShortProcessor ip = new ShortProcessor(values.length, 1);
        for (int i = 0; i < values.length; i++) {
            ip.set(i, values[i]);
        }
        return ip;
    }

    private static int[] getValues(final ByteProcessor bp) {
        final int[] values = new int[bp.getPixelCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = bp.get(i);
        }
        return values;
    }
}
