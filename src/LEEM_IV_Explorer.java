import ij.*;
import ij.gui.*;
import ij.io.DirectoryChooser;
import ij.plugin.PlugIn;
import ij.process.ByteProcessor;
import ij.util.Tools;
import java.awt.*;
import java.awt.event.*;
import java.io.File;
import java.util.List;

/**
 *  This ImageJ plugin loads a stack of LEEM or LEED frames (one per energy)
 *  and shows the I(V) curves.
 *
 *  The frame at the current energy is displayed; the arrow keys (or &lt; and &gt;)
 *  change the energy. With the mouse over the image, the smoothed I(V) curve of
 *  the pixel under the cursor is plotted. A click selects the pixel (LEEM),
 *  ALT-click selects a square integration window around it (LEED); the curves
 *  of the selections are plotted in their colors.
 *  'g' goes to a given energy, 'e' exports the curves of the selections as text files,
 *  'c' clears the selections, 's' shows the parameters dialog.
 */

/** This ImageJ plugin is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LEEM_IV_Explorer implements PlugIn, LeemSession.Listener, LeemSelections.Listener,
        MouseListener, MouseMotionListener, KeyListener, ImageListener {
    final static String PLUGIN_NAME = "LEEM I(V) Explorer";
    final static String[] MODE_NAMES = new String[] {"Raw frames with header", "Image files"};
    final static String[] BIT_DEPTHS = new String[] {"8", "16", "32"};
    final static String[] WINDOW_NAMES = new String[] {"flat", "hanning", "hamming", "bartlett", "blackman"};
    final static String SELECTION_ROI_NAME = "selection";
    LeemIJLog log;
    LeemSession session;
    ImagePlus imp;                  //the frame at the current energy, 8-bit
    PlotWindow plotWindow;          //live curve and selection curves
    boolean curveErrorReported;     //report failing selection curves only once per stack
    static String exportBaseName = "iv";

    /** The plugin is invoked by ImageJ using this method. */
    public void run(String arg) {
        if (IJ.versionLessThan("1.53d")) return;
        if (!showLoadDialog()) return;
        LeemLoadRequest request;
        try {
            request = LeemLoadRequest.fromParams();
        } catch (IllegalArgumentException e) {
            IJ.error(PLUGIN_NAME, e.getMessage());
            return;
        }
        log = new LeemIJLog(PLUGIN_NAME);
        session = new LeemSession(log);
        session.applyParams();
        session.addListener(this);
        session.getSelections().addListener(this);
        ImagePlus.addImageListener(this);
        session.load(request);
    }

    /** Asks for the input files and the analysis parameters, and saves them in the LeemParams.
     *  Returns false on cancel. */
    boolean showLoadDialog() {
        GenericDialog gd = new GenericDialog(PLUGIN_NAME);
        gd.addDirectoryField("Directory", LeemParams.getString(LeemParams.SOURCE_PATH), 40);
        gd.addStringField("File extension", LeemParams.getString(LeemParams.FILE_EXTENSION), 8);
        gd.addChoice("Input type", MODE_NAMES, MODE_NAMES[LeemParams.getInt(LeemParams.MODE) == LeemParams.MODE_IMAGE ? 1 : 0]);
        gd.setInsets(15, 0, 0);
        gd.addMessage("Raw frames:");
        gd.addNumericField("Width", LeemParams.getInt(LeemParams.FRAME_WIDTH), 0, 6, "pixels");
        gd.addNumericField("Height", LeemParams.getInt(LeemParams.FRAME_HEIGHT), 0, 6, "pixels");
        String bitDepth = Integer.toString(LeemParams.getInt(LeemParams.BIT_DEPTH));
        gd.addChoice("Bits per sample", BIT_DEPTHS, bitDepth);
        gd.addCheckbox("Little-endian byte order", LeemParams.getBoolean(LeemParams.LITTLE_ENDIAN));
        gd.setInsets(15, 0, 0);
        gd.addNumericField("Start energy", LeemParams.get(LeemParams.START_ENERGY), 2, 6, "eV");
        gd.addNumericField("Energy step", LeemParams.get(LeemParams.ENERGY_STEP), 2, 6, "eV");
        int windowType = LeemParams.getInt(LeemParams.SMOOTH_WINDOW_TYPE);
        if (windowType < 0 || windowType >= WINDOW_NAMES.length) windowType = 0;
        gd.addChoice("Smoothing window", WINDOW_NAMES, WINDOW_NAMES[windowType]);
        gd.addNumericField("Smoothing window length", LeemParams.getInt(LeemParams.SMOOTH_WINDOW_LEN), 0, 6, "points");
        gd.addCheckbox("Smooth selection curves", LeemParams.getBoolean(LeemParams.SMOOTH_OUTPUT));
        gd.addNumericField("LEED window half-width", LeemParams.getInt(LeemParams.LEED_BOX_HALFWIDTH), 0, 6, "pixels");
        gd.addHelp(getHelpText());
        gd.showDialog();
        if (gd.wasCanceled()) return false;
        LeemParams.setString(LeemParams.SOURCE_PATH, gd.getNextString());
        LeemParams.setString(LeemParams.FILE_EXTENSION, gd.getNextString());
        LeemParams.set(LeemParams.MODE, gd.getNextChoiceIndex() == 1 ? LeemParams.MODE_IMAGE : LeemParams.MODE_RAW);
        setIfNumber(LeemParams.FRAME_WIDTH, gd.getNextNumber());
        setIfNumber(LeemParams.FRAME_HEIGHT, gd.getNextNumber());
        LeemParams.set(LeemParams.BIT_DEPTH, Tools.parseDouble(gd.getNextChoice()));
        LeemParams.set(LeemParams.LITTLE_ENDIAN, gd.getNextBoolean());
        setIfNumber(LeemParams.START_ENERGY, gd.getNextNumber());
        setIfNumber(LeemParams.ENERGY_STEP, gd.getNextNumber());
        LeemParams.set(LeemParams.SMOOTH_WINDOW_TYPE, gd.getNextChoiceIndex());
        setIfNumber(LeemParams.SMOOTH_WINDOW_LEN, gd.getNextNumber());
        LeemParams.set(LeemParams.SMOOTH_OUTPUT, gd.getNextBoolean());
        setIfNumber(LeemParams.LEED_BOX_HALFWIDTH, gd.getNextNumber());
        LeemParams.saveToPrefs();
        return true;
    }

    static void setIfNumber(int key, double value) {
        if (!Double.isNaN(value))
            LeemParams.set(key, value);
    }

    /** Macro interface: sets a numeric parameter, e.g. call('LEEM_IV_Explorer.setValue', 'energyStep', '0.5');
     *  Returns an empty String if ok, otherwise the error message */
    public static String setValue(String name, String value) {
        double v = Tools.parseDouble(value);
        if (Double.isNaN(v))
            return "ERROR: not a number: '"+value+"'";
        String result = LeemParams.setValue(name, v);
        if (result != null) return result;
        LeemParams.saveToPrefs();
        return "";
    }

    /* ---------------- session callbacks (from the loading thread) ---------------- */

    public void stackChanged(final LeemStack stack) {
        EventQueue.invokeLater(new Runnable() {
                public void run() {
                    curveErrorReported = false;
                    showFrame();
                    showCurves(null);
                }
            });
    }

    public void loadFailed(LeemLoadRequest request, Exception error) {
        if (!session.hasData())
            IJ.showStatus(PLUGIN_NAME+": nothing loaded");
    }

    /** Removes the markers. When called on the event dispatch thread (a click that has used up
     *  the palette), the markers are removed at once, before the marker of the new selection is added. */
    public void selectionsCleared() {
        Runnable clear = new Runnable() {
                public void run() {
                    ImagePlus imp = LEEM_IV_Explorer.this.imp;
                    if (imp == null) return;
                    imp.setOverlay(null);
                    showCurves(null);
                }
            };
        if (EventQueue.isDispatchThread())
            clear.run();
        else
            EventQueue.invokeLater(clear);
    }

    /* ---------------- display ---------------- */

    /** Shows the frame at the current energy; creates the image window if required */
    void showFrame() {
        ByteProcessor frame = session.getDisplayFrame();
        if (frame == null) return;
        String title = PLUGIN_NAME+" E="+IJ.d2s(session.getCurrentEnergy(), 2)+" eV";
        if (imp == null || imp.getWindow() == null) {
            imp = new ImagePlus(title, frame);
            imp.show();
            ImageCanvas canvas = imp.getCanvas();
            if (canvas != null) {
                canvas.addMouseListener(this);
                canvas.addMouseMotionListener(this);
                canvas.removeKeyListener(IJ.getInstance());    //keys not handled here are forwarded to ImageJ
                canvas.addKeyListener(this);
            }
        } else {
            Overlay overlay = imp.getOverlay();
            imp.setProcessor(title, frame);
            imp.setOverlay(overlay);
        }
    }

    /** Plots the selection curves and, if not null, the live curve */
    void showCurves(double[] liveCurve) {
        LeemStack stack = session.getStack();
        if (stack == null) return;
        double[] energies = stack.getEnergies();
        Plot plot = new Plot(PLUGIN_NAME+" I(V)", "Energy (eV)", "Intensity");
        List<LeemSelections.Selection> selections = session.getSelections().getSelections();
        for (LeemSelections.Selection selection : selections) {
            double[] curve;
            try {
                curve = session.getSelectionCurve(selection);
            } catch (IllegalArgumentException e) {
                if (!curveErrorReported)
                    session.getLog().error("No I(V) curve for selection "+selection+": "+e.getMessage());
                curveErrorReported = true;
                continue;
            }
            if (curve == null) continue;
            plot.setColor(selection.getColor());
            plot.addPoints(energies, curve, Plot.LINE);
        }
        if (liveCurve != null) {
            plot.setColor(Color.BLACK);
            plot.addPoints(energies, liveCurve, Plot.LINE);
        }
        plot.setLimitsToFit(false);
        if (plotWindow == null || plotWindow.isClosed()) {
            plotWindow = plot.show();
            if (imp != null && imp.getWindow() != null) imp.getWindow().toFront();
        } else
            plotWindow.drawPlot(plot);
    }

    /** Marks a selection in the image overlay, in the color of its curve */
    void addMarker(LeemSelections.Selection selection) {
        Roi roi;
        if (selection.isWindow()) {
            int hw = selection.getHalfWidth();
            roi = new Roi(selection.getCol()-hw, selection.getRow()-hw, 2*hw+1, 2*hw+1);
        } else {
            roi = new PointRoi(selection.getCol()+0.5, selection.getRow()+0.5);
            ((PointRoi)roi).setPointType(PointRoi.CROSSHAIR);
        }
        roi.setStrokeColor(selection.getColor());
        imp.setOverlay(addToOverlay(imp.getOverlay(), roi, selection));
    }

    /** Returns the overlay with the marker added. The first color starts a new overlay,
     *  thus the markers of a previous round of selections never remain. */
    static Overlay addToOverlay(Overlay overlay, Roi roi, LeemSelections.Selection selection) {
        if (overlay == null || selection.getColorIndex() == 0)
            overlay = new Overlay();
        overlay.add(roi, SELECTION_ROI_NAME);
        return overlay;
    }

    /** Asks for the directory and file name prefix and writes the curves of the selections */
    void exportCurves() {
        String directory = LeemParams.getString(LeemParams.SAVE_DIRECTORY);
        DirectoryChooser.setDefaultDirectory(directory);
        DirectoryChooser dc = new DirectoryChooser("Output directory for I(V) curves");
        directory = dc.getDirectory();
        if (directory == null) return;
        GenericDialog gd = new GenericDialog(PLUGIN_NAME+" Export");
        gd.addStringField("File name (index & .txt will be added)", exportBaseName, 20);
        gd.showDialog();
        if (gd.wasCanceled()) return;
        exportBaseName = gd.getNextString().trim();
        LeemParams.setString(LeemParams.SAVE_DIRECTORY, directory);
        if (session.exportCurves(new File(directory), exportBaseName))
            IJ.showStatus("Writing "+session.getSelections().size()+" I(V) curves to "+directory);
    }

    /** Asks for an energy and shows the frame nearest to it */
    void askForEnergy() {
        if (!session.hasData()) return;
        GenericDialog gd = new GenericDialog(PLUGIN_NAME+" Go to Energy");
        gd.addNumericField("Energy", session.getCurrentEnergy(), 2, 8, "eV");
        gd.showDialog();
        if (gd.wasCanceled()) return;
        session.setEnergy(gd.getNextNumber());
    }

    /* ---------------- mouse & keyboard ---------------- */

    /** Plots the live curve of the pixel under the cursor */
    public void mouseMoved(MouseEvent e) {
        try {
            ImageCanvas canvas = imp == null ? null : imp.getCanvas();
            if (canvas == null) return;
            int x = canvas.offScreenX(e.getX());
            int y = canvas.offScreenY(e.getY());
            double[] curve = session.hoverCurve(y, x);
            if (curve != null)
                showCurves(curve);
        } catch (Exception ex) {
            IJ.handleException(ex);
        }
    }

    /** Click selects a pixel, ALT-click an integration window */
    public void mousePressed(MouseEvent e) {
        try {
            ImageCanvas canvas = imp == null ? null : imp.getCanvas();
            if (canvas == null || !session.hasData()) return;
            int x = canvas.offScreenX(e.getX());
            int y = canvas.offScreenY(e.getY());
            LeemSelections.Selection selection = e.isAltDown() ?
                    session.selectWindow(y, x) : session.selectPoint(y, x);
            if (selection == null) return;
            addMarker(selection);
            showCurves(session.hoverCurve(y, x));
        } catch (Exception ex) {
            IJ.handleException(ex);
        }
    }

    public void keyPressed(KeyEvent e) {
        try {
            int keyCode = e.getKeyCode();
            char keyChar = e.getKeyChar();
            int oldSlice = session.getSlice();
            if (keyCode == KeyEvent.VK_RIGHT || keyCode == KeyEvent.VK_UP || keyChar == '>')
                session.nextSlice();
            else if (keyCode == KeyEvent.VK_LEFT || keyCode == KeyEvent.VK_DOWN || keyChar == '<')
                session.previousSlice();
            else if (keyChar == 'e')
                exportCurves();
            else if (keyChar == 'g')
                askForEnergy();
            else if (keyChar == 'c')
                session.clearSelections();
            else if (keyChar == 's') {
                LeemParams.showParamsDialog();
                session.applyParams();
            } else {
                ImageJ ij = IJ.getInstance();
                if (ij != null) ij.keyPressed(e);
                return;
            }
            e.consume();
            if (session.getSlice() != oldSlice)
                showFrame();
        } catch (Exception ex) {
            IJ.handleException(ex);
        }
    }

    public void keyReleased(KeyEvent e) {}
    public void keyTyped(KeyEvent e) {}
    public void mouseClicked(MouseEvent e) {}
    public void mouseReleased(MouseEvent e) {}
    public void mouseEntered(MouseEvent e) {}
    public void mouseExited(MouseEvent e) {}
    public void mouseDragged(MouseEvent e) {}

    /* ---------------- ImageListener ---------------- */

    public void imageOpened(ImagePlus imp) {}
    public void imageUpdated(ImagePlus imp) {}

    /** When the frame window is closed, waits for pending exports and disconnects */
    public void imageClosed(ImagePlus imp) {
        if (imp != this.imp) return;
        ImagePlus.removeImageListener(this);
        session.removeListener(this);
        session.getSelections().removeListener(this);
        this.imp = null;
        try {
            if (!session.waitForExport())
                log.error("Not all I(V) curves could be written");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LeemParams.saveToPrefs();
    }

    static String getHelpText() {
        return "<html><h1>"+PLUGIN_NAME+"</h1>"+
            "<p>Loads one frame per energy from the files in the directory (sorted by name) "+
            "and shows the I(V) curves.</p>"+
            "<p><b>Raw frames</b> have a header of any length, followed by width*height samples. "+
            "<b>Image files</b> are opened by ImageJ (e.g. tif, png).</p>"+
            "<p>Mouse over the image: smoothed I(V) curve of the pixel.<br>"+
            "Click: select the pixel (LEEM). ALT-click: select the integration window around it (LEED).<br>"+
            "Arrow keys: change the energy.<br>"+
            "'e': export the curves of the selections as text files (energy, tab, intensity).<br>"+
            "'g': go to the frame nearest to a given energy.<br>"+
            "'c': clear all selections. 's': parameters dialog.</p>"+
            "<p>Smoothing windows must be even and longer than 3 points.</p></html>";
    }
}
