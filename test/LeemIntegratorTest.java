import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link LeemIntegrator} class.
 */
public class LeemIntegratorTest {

    @Test
    public void testUniformStack() throws Exception {
        final ImageStack volume = new ImageStack(5, 5);
        for (int k = 0; k < 3; k++) {
            final ShortProcessor ip = new ShortProcessor(5, 5);
            ip.setValue(1);
            ip.fill();
            volume.addSlice(ip);
        }
        Assert.assertArrayEquals("invalid 3x3 sums",
                                 new double[] {9, 9, 9}, LeemIntegrator.integrate(volume, 2, 2, 1), 0);
        Assert.assertArrayEquals("invalid 5x5 sums",
                                 new double[] {25, 25, 25}, LeemIntegrator.integrate(volume, 2, 2, 2), 0);
        Assert.assertArrayEquals("invalid single pixel",
                                 new double[] {1, 1, 1}, LeemIntegrator.integrate(volume, 0, 4, 0), 0);
    }

    @Test
    public void testSumsPerSlice() throws Exception {
        final LeemStack stack = LeemTestFrames.makeStack(3, 4, 3);
        // window rows 0-2, cols 0-2: 9*k*100 + 3*(0+10+20) + 3*(0+1+2)
        Assert.assertArrayEquals("invalid sums",
                                 new double[] {99, 999, 1899}, LeemIntegrator.integrate(stack, 1, 1, 1), 0);
    }

    @Test
    public void testUnsignedAndFloatPixels() throws Exception {
        final ImageStack shorts = new ImageStack(3, 3);
        final ShortProcessor sp = new ShortProcessor(3, 3);
        sp.setValue(60000);
        sp.fill();
        shorts.addSlice(sp);
        Assert.assertEquals("16-bit samples not unsigned", 540000.0, LeemIntegrator.integrate(shorts, 1, 1, 1)[0], 0);

        final ImageStack bytes = new ImageStack(3, 3);
        final ByteProcessor bp = new ByteProcessor(3, 3);
        bp.setValue(200);
        bp.fill();
        bytes.addSlice(bp);
        Assert.assertEquals("8-bit samples not unsigned", 1800.0, LeemIntegrator.integrate(bytes, 1, 1, 1)[0], 0);

        final ImageStack floats = new ImageStack(3, 3);
        final ImageProcessor fp = new FloatProcessor(3, 3);
        fp.setValue(0.5);
        fp.fill();
        floats.addSlice(fp);
        Assert.assertEquals("invalid float sum", 4.5, LeemIntegrator.integrate(floats, 1, 1, 1)[0], 1e-6);
    }

    @Test
    public void testWindowOutsideImageIsRejected() throws Exception {
        final LeemStack stack = LeemTestFrames.makeStack(5, 5, 2);
        final int[][] windows = {{0, 2, 1}, {2, 0, 1}, {4, 2, 1}, {2, 4, 1}, {2, 2, 3}, {2, 2, -1}};
        for (final int[] w : windows) {
            try {
                LeemIntegrator.integrate(stack, w[0], w[1], w[2]);
                Assert.fail("window row=" + w[0] + " col=" + w[1] + " halfWidth=" + w[2] + " accepted");
            } catch (final LeemWindowException e) {
                Assert.assertEquals("invalid row in exception", w[0], e.getRow());
            }
        }
        Assert.assertTrue(LeemIntegrator.isInside(5, 5, 2, 2, 2));
        Assert.assertFalse(LeemIntegrator.isInside(5, 5, 2, 2, 3));
    }
}
