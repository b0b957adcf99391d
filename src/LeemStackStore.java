import java.util.Arrays;


/**
 *  Holds the current stack (volume and energy axis) of a session and the
 *  cache of smoothed spectra.
 *
 *  The smoothed spectrum of a pixel is calculated when it is requested for the
 *  first time; thereafter the cached curve is returned. The cache is keyed by the
 *  pixel position only; it is cleared when a new stack is published and when
 *  the session changes the smoothing parameters.
 *
 *  All methods are synchronized; views sharing a store are thus serialized.
 *  Before the first stack is published, the store is empty and hasData() is false.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemStackStore {
    private LeemStack stack;
    private boolean[] visited;          //per pixel, index row*width+col
    private double[][] smoothed;        //smoothed spectra, null where not visited
    private int smoothCount;            //number of spectra calculated, for diagnostics

    /** Replaces the current stack (if any) and resets the smoothing cache */
    public synchronized void publish(LeemStack stack) {
        if (stack == null)
            throw new IllegalArgumentException("No stack to publish");
        this.stack = stack;
        int nPixels = stack.getWidth()*stack.getHeight();
        visited = new boolean[nPixels];
        smoothed = new double[nPixels][];
        smoothCount = 0;
    }

    /** Returns to the empty state */
    public synchronized void clear() {
        stack = null;
        visited = null;
        smoothed = null;
        smoothCount = 0;
    }

    /** Returns whether a stack has been published */
    public synchronized boolean hasData() {
        return stack != null;
    }

    /** Returns the current stack, or null if there is none */
    public synchronized LeemStack getStack() {
        return stack;
    }

    /** Returns the raw spectrum of a pixel
     *  @throws IllegalStateException if there is no stack */
    public synchronized double[] getSpectrum(int row, int col) {
        return requireStack().getSpectrum(row, col);
    }

    /** Returns the smoothed spectrum of a pixel. Calculated with the given smoother
     *  when requested for the first time, afterwards taken from the cache.
     *  @throws IllegalStateException if there is no stack
     *  @throws LeemSmoothException if smoothing fails; then nothing is cached */
    public synchronized double[] getSmoothedSpectrum(int row, int col, LeemSmoother smoother) {
        LeemStack stack = requireStack();
        if (!stack.contains(row, col))
            throw new IllegalArgumentException("Pixel (row="+row+", col="+col+") outside of image");
        int p = row*stack.getWidth() + col;
        if (!visited[p]) {
            smoothed[p] = smoother.smooth(stack.getSpectrum(row, col));
            visited[p] = true;
            smoothCount++;
        }
        return smoothed[p].clone();
    }

    /** Returns whether the smoothed spectrum of the pixel is in the cache */
    public synchronized boolean isSmoothed(int row, int col) {
        return stack != null && stack.contains(row, col) && visited[row*stack.getWidth() + col];
    }

    /** Marks all pixels as not visited */
    public synchronized void resetSmoothCache() {
        if (stack == null) return;
        Arrays.fill(visited, false);
        Arrays.fill(smoothed, null);
        smoothCount = 0;
    }

    /** Returns how many spectra were smoothed since the last reset of the cache */
    public synchronized int getSmoothCount() {
        return smoothCount;
    }

    private LeemStack requireStack() {
        if (stack == null)
            throw new IllegalStateException("No stack loaded");
        return stack;
    }
}
