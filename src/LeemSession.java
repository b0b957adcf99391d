import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import java.io.File;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;


/**
 *  One interactive LEEM or LEED I(V) session: the current stack with its cache
 *  of smoothed spectra, the user selections, background loading and export
 *  of the selection curves.
 *
 *  The session is the boundary where failed requests are handled: invalid
 *  user requests and failed loads are reported to the log of the session and
 *  the request is skipped (methods return null or false); the session remains
 *  usable and a previously loaded stack stays valid.
 *  The views (image, plots) are registered as Listeners and get the data
 *  via the session; they must not modify the stack.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemSession implements LeemLoadListener {

    /** Notified after loading. The calls come from the loading thread. */
    public interface Listener {
        /** A new stack is available; the current slice is in the middle of the stack */
        void stackChanged(LeemStack stack);
        /** Loading failed; the previous stack (if any) is still valid */
        void loadFailed(LeemLoadRequest request, Exception error);
    }

    private final LeemLog log;
    private final LeemStackStore store = new LeemStackStore();
    private final LeemSelections selections = new LeemSelections();
    private final LeemLoadCoordinator coordinator;
    private final LeemCurveSaver curveSaver;
    private final ArrayList<Listener> listeners = new ArrayList<Listener>();
    private LeemSmoother smoother;          //for the live curve and, if smoothOutput, for the selection curves
    private int boxHalfWidth;               //LEED integration window
    private boolean smoothOutput;           //whether selection curves are smoothed
    private int currentSlice;               //0-based
    private boolean smoothErrorReported;    //report smoothing errors of the live curve only once per stack

    /** Creates a session with the default smoothing (flat, 10 points) and LEED window */
    public LeemSession(LeemLog log) {
        this(new LeemFrameIngestor(log), log);
    }

    /** Creates a session reading the frames with the given ingestor */
    public LeemSession(LeemFrameIngestor ingestor, LeemLog log) {
        this.log = log;
        coordinator = new LeemLoadCoordinator(ingestor, log);
        curveSaver = new LeemCurveSaver(log);
        smoother = new LeemSmoother(LeemSmoother.DEFAULT_WINDOW_TYPE, LeemSmoother.DEFAULT_WINDOW_LEN, log);
        boxHalfWidth = (int)LeemParams.getDefaultValue(LeemParams.LEED_BOX_HALFWIDTH);
    }

    /** Takes smoothing, LEED window and output smoothing from the LeemParams */
    public void applyParams() {
        try {
            setSmoothing(LeemSmoother.WindowType.fromIndex(LeemParams.getInt(LeemParams.SMOOTH_WINDOW_TYPE)),
                    LeemParams.getInt(LeemParams.SMOOTH_WINDOW_LEN));
        } catch (LeemSmoothException e) {
            log.error("Invalid smoothing parameters, keeping "+getSmoother()+": "+e.getMessage());
        }
        try {
            setBoxHalfWidth(LeemParams.getInt(LeemParams.LEED_BOX_HALFWIDTH));
        } catch (IllegalArgumentException e) {
            log.error("Invalid LEED window, keeping half-width "+getBoxHalfWidth()+": "+e.getMessage());
        }
        setSmoothOutput(LeemParams.getBoolean(LeemParams.SMOOTH_OUTPUT));
    }

    public void addListener(Listener listener) {
        synchronized(listeners) {
            listeners.add(listener);
        }
    }

    public void removeListener(Listener listener) {
        synchronized(listeners) {
            listeners.remove(listener);
        }
    }

    /* ---------------- loading ---------------- */

    /** Starts loading a stack in the background. A load still running is superseded;
     *  its result will be discarded. */
    public void load(LeemLoadRequest request) {
        log.log("Loading "+request);
        coordinator.submit(request, this);
    }

    /** Waits for the latest load to finish, at most 'timeoutMillis' (0 = no limit).
     *  Returns whether it has finished. */
    public boolean waitForLoad(long timeoutMillis) throws InterruptedException {
        return coordinator.waitForLoad(timeoutMillis);
    }

    /** Returns whether a load is running */
    public boolean isLoading() {
        return coordinator.isLoading();
    }

    /** Called by the coordinator when the stack is loaded */
    public void stackReady(LeemStack stack) {
        store.publish(stack);
        selections.clear();
        synchronized(this) {
            currentSlice = stack.getDepth()/2;
            smoothErrorReported = false;
        }
        log.log("Loaded "+stack);
        for (Listener listener : getListeners())
            listener.stackChanged(stack);
    }

    /** Called by the coordinator when loading has failed */
    public void loadFailed(LeemLoadRequest request, Exception error) {
        String message = error instanceof LeemIngestException ?
                ((LeemIngestException)error).getReason()+": "+error.getMessage() : error.toString();
        log.error("Loading failed, "+message+(store.hasData() ? "; keeping the previous data" : ""));
        for (Listener listener : getListeners())
            listener.loadFailed(request, error);
    }

    /** Returns whether a stack is loaded */
    public boolean hasData() {
        return store.hasData();
    }

    /** Returns the current stack or null */
    public LeemStack getStack() {
        return store.getStack();
    }

    /* ---------------- smoothing and curves ---------------- */

    /** Returns the smoothed I(V) curve of a pixel, for the live view under the cursor.
     *  Returns null if there is no data, the pixel is outside the image or smoothing fails. */
    public double[] hoverCurve(int row, int col) {
        LeemStack stack = store.getStack();
        if (stack == null || !stack.contains(row, col))
            return null;
        try {
            synchronized(this) {    //no caching with a smoother replaced meanwhile
                return store.getSmoothedSpectrum(row, col, smoother);
            }
        } catch (LeemSmoothException e) {
            synchronized(this) {
                if (smoothErrorReported) return null;
                smoothErrorReported = true;
            }
            log.error("Cannot smooth I(V) curves: "+e.getMessage());
            return null;
        } catch (IllegalArgumentException e) {
            return null;            //a new stack of different size has arrived
        }
    }

    /** Sets the smoothing window for the live curve (and the output, if smoothed).
     *  The cached smoothed curves are discarded.
     *  @throws LeemSmoothException if the window type or length is invalid; then nothing changes */
    public void setSmoothing(LeemSmoother.WindowType windowType, int windowLength) {
        LeemSmoother newSmoother = new LeemSmoother(windowType, windowLength, log);
        synchronized(this) {
            smoother = newSmoother;
            smoothErrorReported = false;
            store.resetSmoothCache();
        }
    }

    public synchronized LeemSmoother getSmoother() {
        return smoother;
    }

    /** Sets whether the curves of the selections are smoothed (for the plot and the export) */
    public synchronized void setSmoothOutput(boolean smoothOutput) {
        this.smoothOutput = smoothOutput;
    }

    public synchronized boolean isSmoothOutput() {
        return smoothOutput;
    }

    /** Sets the half-width of the LEED integration window for the next selections */
    public synchronized void setBoxHalfWidth(int halfWidth) {
        if (halfWidth < 0)
            throw new IllegalArgumentException("Negative integration window half-width: "+halfWidth);
        boxHalfWidth = halfWidth;
    }

    public synchronized int getBoxHalfWidth() {
        return boxHalfWidth;
    }

    /* ---------------- selections ---------------- */

    /** Selects a pixel (LEEM); returns the selection or null if not possible */
    public LeemSelections.Selection selectPoint(int row, int col) {
        return select(row, col, LeemSelections.NO_WINDOW);
    }

    /** Selects an integration window around a pixel (LEED); returns the selection or null if not possible */
    public LeemSelections.Selection selectWindow(int row, int col) {
        return select(row, col, getBoxHalfWidth());
    }

    private LeemSelections.Selection select(int row, int col, int halfWidth) {
        LeemStack stack = store.getStack();
        if (stack == null) {
            log.error("No data loaded, cannot select");
            return null;
        }
        try {
            return selections.add(stack, row, col, halfWidth);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return null;
        }
    }

    /** Removes all selections */
    public void clearSelections() {
        selections.clear();
    }

    /** Returns the selections; views may register as LeemSelections.Listener there */
    public LeemSelections getSelections() {
        return selections;
    }

    /** Returns the I(V) curve of a selection: the raw spectrum of a pixel or the
     *  intensity integrated over a window, smoothed if 'smooth output' is on.
     *  Returns null if there is no data.
     *  @throws LeemSmoothException if smoothing fails
     *  @throws IllegalArgumentException if the selection does not fit the current stack */
    public double[] getSelectionCurve(LeemSelections.Selection selection) {
        LeemStack stack = store.getStack();
        if (stack == null) return null;
        LeemSmoother smoother;
        boolean smoothOutput;
        synchronized(this) {
            smoother = this.smoother;
            smoothOutput = this.smoothOutput;
        }
        if (selection.isWindow()) {
            double[] curve = LeemIntegrator.integrate(stack, selection.getRow(), selection.getCol(), selection.getHalfWidth());
            return smoothOutput ? smoother.smooth(curve) : curve;
        } else
            return smoothOutput ?
                    store.getSmoothedSpectrum(selection.getRow(), selection.getCol(), smoother) :
                    stack.getSpectrum(selection.getRow(), selection.getCol());
    }

    /* ---------------- display ---------------- */

    /** Returns the current slice mapped to 8 bits with the full data range, or null if there is no data */
    public ByteProcessor getDisplayFrame() {
        return getDisplayFrame(Double.NaN, Double.NaN);
    }

    /** Returns the current slice mapped to 8 bits for the range 'lower' to 'upper'
     *  (NaN for the data minimum or maximum). Returns null if there is no data
     *  or the range is invalid. */
    public ByteProcessor getDisplayFrame(double lower, double upper) {
        LeemStack stack = store.getStack();
        if (stack == null) return null;
        ImageProcessor ip = stack.getVolume().getProcessor(Math.min(getSlice(), stack.getDepth()-1) + 1);
        try {
            return LeemDisplayRange.map(ip, lower, upper);
        } catch (LeemRangeException e) {
            log.error(e.getMessage());
            return null;
        }
    }

    /** Returns the current slice index (0-based) */
    public synchronized int getSlice() {
        return currentSlice;
    }

    /** Sets the current slice; the index is limited to the stack. Returns the new index. */
    public synchronized int setSlice(int index) {
        LeemStack stack = store.getStack();
        if (stack == null) return currentSlice;
        if (index < 0) index = 0;
        if (index >= stack.getDepth()) index = stack.getDepth() - 1;
        currentSlice = index;
        return currentSlice;
    }

    public synchronized int nextSlice() {
        return setSlice(currentSlice + 1);
    }

    public synchronized int previousSlice() {
        return setSlice(currentSlice - 1);
    }

    /** Goes to the slice with the energy nearest to the given one. If there is no data or the
     *  energy is outside the energy range, logs an error and returns -1; otherwise the new index. */
    public synchronized int setEnergy(double energy) {
        LeemStack stack = store.getStack();
        if (stack == null) {
            log.error("Cannot go to "+LeemUtils.d2s(energy)+" eV; no data loaded");
            return -1;
        }
        int index = LeemEnergyAxis.indexOf(stack.getEnergies(), energy);
        if (index < 0) {
            log.error("Energy "+LeemUtils.d2s(energy)+" eV outside of "+stack.getEnergies()[0]+
                    "-"+stack.getEnergies()[stack.getDepth()-1]+" eV");
            return -1;
        }
        return setSlice(index);
    }

    /** Returns the energy of the current slice, NaN if there is no data */
    public double getCurrentEnergy() {
        LeemStack stack = store.getStack();
        if (stack == null) return Double.NaN;
        return stack.getEnergy(Math.min(getSlice(), stack.getDepth()-1));
    }

    /* ---------------- export ---------------- */

    /** Writes the curves of all selections to <directory>/<baseName><index>.txt, in the background.
     *  Returns false if nothing is written: no data or selections, smoothing failed,
     *  or a previous export has not finished. */
    public boolean exportCurves(File directory, String baseName) {
        LeemStack stack = store.getStack();
        List<LeemSelections.Selection> selected = selections.getSelections();
        if (stack == null || selected.isEmpty()) {
            log.error("Nothing to export; "+(stack == null ? "no data loaded" : "no selections"));
            return false;
        }
        ArrayList<double[]> curves = new ArrayList<double[]>(selected.size());
        try {
            for (LeemSelections.Selection selection : selected)
                curves.add(getSelectionCurve(selection));
        } catch (IllegalArgumentException e) {
            log.error("Cannot export I(V) curves: "+e.getMessage());
            return false;
        }
        return curveSaver.save(directory, baseName, stack.getEnergies(), curves,
                makeLogLines(stack, selected, directory, baseName));
    }

    /** Creates the lines of the log file written with the curves: the input, the analysis
     *  settings, the files with their selections, the parameters and the messages of the session */
    String[] makeLogLines(LeemStack stack, List<LeemSelections.Selection> selected, File directory, String baseName) {
        ArrayList<String> lines = new ArrayList<String>(50);
        lines.add("LEEM I(V) Explorer export");
        lines.add(new SimpleDateFormat("yyyy-MM-dd HH:mm").format(new Date()));
        lines.add("");
        lines.add("Input: "+stack);
        lines.add("Smoothing: "+getSmoother()+(isSmoothOutput() ? ", also for the exported curves" : ", live curve only"));
        lines.add("LEED window half-width: "+getBoxHalfWidth());
        lines.add("");
        lines.add("Files:");
        for (int i=0; i<selected.size(); i++)
            lines.add(LeemCurveSaver.getFile(directory, baseName, i).getName()+": "+selected.get(i));
        lines.add("");
        lines.add("Parameters (in machine-readable form):");
        lines.addAll(Arrays.asList(LeemParams.getParameterLines()));
        lines.add("");
        lines.add("Session log:");
        lines.addAll(Arrays.asList(log.getLogLines()));
        return lines.toArray(new String[0]);
    }

    /** Waits until the files of the latest export are written; returns false if writing failed */
    public boolean waitForExport() throws InterruptedException {
        return curveSaver.waitForCompletion();
    }

    public LeemLog getLog() {
        return log;
    }

    /** For diagnostics: the number of spectra smoothed since the cache was last reset */
    public int getSmoothCount() {
        return store.getSmoothCount();
    }

    private Listener[] getListeners() {
        synchronized(listeners) {
            return listeners.toArray(new Listener[0]);
        }
    }
}
