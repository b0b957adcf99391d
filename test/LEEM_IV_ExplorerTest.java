import ij.ImagePlus;
import ij.gui.Overlay;
import ij.gui.Roi;
import ij.process.ByteProcessor;
import java.awt.EventQueue;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the markers of the {@link LEEM_IV_Explorer} class.
 */
public class LEEM_IV_ExplorerTest {

    private LeemStack stack;
    private LeemSelections selections;
    private LEEM_IV_Explorer explorer;

    @Before
    public void setup() throws Exception {
        stack = LeemTestFrames.makeStack(20, 30, 3);
        selections = new LeemSelections();
        explorer = new LEEM_IV_Explorer();
        explorer.session = new LeemSession(new LeemTestLog());
        explorer.imp = new ImagePlus("frame", new ByteProcessor(30, 20));
        selections.addListener(explorer);
    }

    @Test
    public void testMarkerOfFirstColorStartsNewOverlay() throws Exception {
        Overlay overlay = null;
        for (int i = 0; i <= LeemSelections.PALETTE.length; i++) {
            final LeemSelections.Selection selection = selections.add(stack, i, i);
            overlay = LEEM_IV_Explorer.addToOverlay(overlay, new Roi(i, i, 1, 1), selection);
        }
        Assert.assertEquals("markers of previous selections kept", 1, overlay.size());
    }

    @Test
    public void testClickAfterUsedUpPaletteKeepsOnlyNewMarker() throws Exception {
        final AtomicInteger sizeAfterClicks = new AtomicInteger(-1);
        EventQueue.invokeAndWait(new Runnable() {
            @Override
            public void run() {
                for (int i = 0; i <= LeemSelections.PALETTE.length; i++) {
                    explorer.addMarker(selections.add(stack, i, i));
                }
                sizeAfterClicks.set(explorer.imp.getOverlay().size());
            }
        });
        Assert.assertEquals("old markers not removed", 1, sizeAfterClicks.get());

        // let anything queued by the clicks run
        EventQueue.invokeAndWait(new Runnable() {
            @Override
            public void run() {
            }
        });
        final Overlay overlay = explorer.imp.getOverlay();
        Assert.assertNotNull("marker of new selection removed", overlay);
        Assert.assertEquals(1, overlay.size());
        Assert.assertEquals("invalid marker color", LeemSelections.PALETTE[0], overlay.get(0).getStrokeColor());
    }

    @Test
    public void testClearOutsideEventThread() throws Exception {
        selections.add(stack, 1, 1);
        explorer.addMarker(selections.getSelections().get(0));
        Assert.assertEquals(1, explorer.imp.getOverlay().size());

        selections.clear();
        EventQueue.invokeAndWait(new Runnable() {
            @Override
            public void run() {
            }
        });
        Assert.assertNull("markers not removed", explorer.imp.getOverlay());
    }
}
