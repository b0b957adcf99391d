import ij.*;
import ij.util.Tools;
import ij.gui.GenericDialog;
import ij.plugin.frame.Recorder;


/**
 * The numeric and String parameters are kept as static variables in this class.
 * These are the settings that a LEEM I(V) session consumes: where and how to read
 * the frames, the energy axis, smoothing and the LEED integration window.
 *
 * Parameters are kept in the ImageJ IJ_Prefs.txt file.
 * One Prefs key for all numbers, one Prefs key each for the Strings.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemParams {
    static final int CURRENTVERSION = 1;            // in case of renumbering existing items, increase the version number!
    /** Number of numeric parameters */
    public static final int N_PARAM = 12;           //must be increased when adding numeric parameters
    // KEYS of the individual numeric parameters
    public static final int PARAMVERSION=0,         //version of LeemParams
            MODE=1,                                 //0 = raw frames with header, 1 = image files
            FRAME_HEIGHT=2,                         //raw mode: rows per frame
            FRAME_WIDTH=3,                          //raw mode: columns per frame
            BIT_DEPTH=4,                            //raw mode: bits per sample, 8, 16 or 32
            LITTLE_ENDIAN=5,                        //raw mode: byte order, 1 = little-endian (Intel)
            START_ENERGY=6,                         //energy of the first frame (eV)
            ENERGY_STEP=7,                          //energy increment between frames (eV)
            SMOOTH_WINDOW_LEN=8,                    //smoothing window length (points), even, >3
            SMOOTH_WINDOW_TYPE=9,                   //index in LeemSmoother.WindowType, 0 = flat
            LEED_BOX_HALFWIDTH=10,                  //half-width of the LEED integration window (pixels)
            SMOOTH_OUTPUT=11;                       //whether exported and selection curves are smoothed

    /** Values of the MODE parameter */
    public static final int MODE_RAW = 0, MODE_IMAGE = 1;

    /** Number of String parameters */
    public static final int N_STR_PARAM = 3;
    // KEYS of the individual String parameters
    public static final int SOURCE_PATH=0, FILE_EXTENSION=1, SAVE_DIRECTORY=2;

    //names of parameters for macros
    static final String[] NUMERIC_PARAM_NAMES = new String[] {
            "PARAM_VERSION",                        // PARAMVERSION
            "mode",                                 // MODE
            "frameHeight",                          // FRAME_HEIGHT
            "frameWidth",                           // FRAME_WIDTH
            "bitDepth",                             // BIT_DEPTH
            "littleEndian",                         // LITTLE_ENDIAN
            "startEnergy",                          // START_ENERGY
            "energyStep",                           // ENERGY_STEP
            "smoothWindowLength",                   // SMOOTH_WINDOW_LEN
            "smoothWindowType",                     // SMOOTH_WINDOW_TYPE
            "leedBoxHalfwidth",                     // LEED_BOX_HALFWIDTH
            "smoothOutput"                          // SMOOTH_OUTPUT
            };

    //short help for numeric parameters
    static final String[] NUMERIC_PARAM_HELP = new String[] {
            "Version of parameter list (for compatibility check)",          // PARAMVERSION
            "Input type, 0=raw frames with header, 1=image files",          // MODE
            "Raw frames: height (rows)",                                    // FRAME_HEIGHT
            "Raw frames: width (columns)",                                  // FRAME_WIDTH
            "Raw frames: bits per sample (8, 16, 32)",                      // BIT_DEPTH
            "Raw frames: 1 for little-endian (Intel) byte order, 0 for big-endian", // LITTLE_ENDIAN
            "Energy of the first frame (eV)",                               // START_ENERGY
            "Energy step between frames (eV)",                              // ENERGY_STEP
            "Length of the smoothing window (points)",                      // SMOOTH_WINDOW_LEN
            "Smoothing window, 0=flat, 1=hanning, 2=hamming, 3=bartlett, 4=blackman", // SMOOTH_WINDOW_TYPE
            "Half-width of the LEED integration window (pixels)",           // LEED_BOX_HALFWIDTH
            "Whether to smooth selection curves and exported curves (1=true)" // SMOOTH_OUTPUT
            };

    // DEFAULT VALUES
    static final double[] DEFAULT_NUM_VALUES = new double[] {
            CURRENTVERSION,                         // PARAMVERSION
            MODE_RAW,                               // MODE
            600,                                    // FRAME_HEIGHT
            592,                                    // FRAME_WIDTH
            16,                                     // BIT_DEPTH
            1,                                      // LITTLE_ENDIAN
            -9.9,                                   // START_ENERGY
            0.1,                                    // ENERGY_STEP
            10,                                     // SMOOTH_WINDOW_LEN
            0,                                      // SMOOTH_WINDOW_TYPE
            20,                                     // LEED_BOX_HALFWIDTH
            0                                       // SMOOTH_OUTPUT
            };

    static final String[] defaultStrs = new String[] {
            "",                                     //SOURCE_PATH
            ".dat",                                 //FILE_EXTENSION
            ""                                      //SAVE_DIRECTORY
            };

    // keys for ImageJ Prefs (file IJ_Prefs.txt)
    public static final String PREFS_KEY = "leem.iv";
    static final String PREFS_KEY_NUM = PREFS_KEY+"_n";   //key in Prefs file for the String with all numbers
    static final String PREFS_KEY_STR = PREFS_KEY+"_s";   //key prefix in Prefs file for the Strings, gets "leem.iv_s0", "leem.iv_s1" etc.

    // parameters are stored here
    static double[] params = new double[N_PARAM];
    static String[] strParams = new String[N_STR_PARAM];
    static boolean initialized;

    /** When called the first time, reads the parameters from the ImageJ Prefs; uses the defaults if not in the Prefs.
     *  If not done till then, will be called with the first get or set operation. */
    public static synchronized void initialize() {
        if (initialized) return;
        System.arraycopy(DEFAULT_NUM_VALUES, 0, params, 0, DEFAULT_NUM_VALUES.length);
        String numStr = Prefs.get(PREFS_KEY_NUM, (String)null);
        if (numStr == null || !readNumParamFromString(numStr, params)) {
            reset();    //no prefs yet or a version that does not fit
            return;
        }
        for (int i=0; i<N_STR_PARAM; i++)
            strParams[i] = Prefs.get(PREFS_KEY_STR+i, defaultStrs[i]);
        initialized = true;
    }

    /** Saves the parameters in the Prefs */
    public static synchronized void saveToPrefs() {
        if (!initialized) initialize();
        Prefs.set(PREFS_KEY_NUM, getNumbersLine());
        for (int i=0; i<N_STR_PARAM; i++)
            if (strParams[i] != null)
                Prefs.set(PREFS_KEY_STR+i, strParams[i]);
    }

    /** Returns a String with all numeric parameters in one line */
    static String getNumbersLine() {
        StringBuilder sb = new StringBuilder(N_PARAM*8);
        for (int i=0; i<N_PARAM; i++) {
            sb.append(LeemUtils.d2s(params[i]));
            if (i < N_PARAM-1)
                sb.append(',');
        }
        return sb.toString();
    }

    /** Resets all parameters to the defaults */
    public static synchronized void reset() {
        System.arraycopy(DEFAULT_NUM_VALUES, 0, params, 0, DEFAULT_NUM_VALUES.length);
        System.arraycopy(defaultStrs, 0, strParams, 0, defaultStrs.length);
        initialized = true;
        saveToPrefs();
    }

    /** Returns the numeric parameter for the given key */
    public static synchronized double get(int key) {
        if (!initialized) initialize();
        return params[key];
    }

    /** Returns the numeric parameter for the given key, rounded to an integer */
    public static int getInt(int key) {
        return (int)Math.round(get(key));
    }

    /** Returns the parameter for the given key as boolean. Values != 0 are considered true. */
    public static boolean getBoolean(int key) {
        return get(key) != 0;
    }

    /** Returns the default numeric parameter for the given key */
    public static double getDefaultValue(int key) {
        return DEFAULT_NUM_VALUES[key];
    }

    /** Returns the String parameter for the given key */
    public static synchronized String getString(int key) {
        if (!initialized) initialize();
        return strParams[key];
    }

    /** Sets the numeric parameter for the given key */
    public static synchronized void set(int key, double value) {
        if (!initialized) initialize();
        if (key == PARAMVERSION) return;
        params[key] = value;
        Prefs.set(PREFS_KEY_NUM, getNumbersLine());
        recordParameter(key, value);
    }

    /** Sets the numeric parameter for the given key
     *  Boolean true and false are written as 1 and 0, respectively. */
    public static void set(int key, boolean b) {
        set(key, b ? 1 : 0);
    }

    /** Sets the numeric parameter for the given macro parameter name. Returns null if ok, error message if failed */
    public static synchronized String setValue(String name, double value) {
        if (!initialized) initialize();
        int key = -1;
        for (int i=0; i<NUMERIC_PARAM_NAMES.length; i++)
            if (NUMERIC_PARAM_NAMES[i].equals(name))
                key = i;
        if (key <= PARAMVERSION)
            return "ERROR: no parameter '"+name+"'";
        params[key] = value;
        return null;
    }

    /** Sets the String parameter for the given key */
    public static synchronized void setString(int key, String str) {
        if (!initialized) initialize();
        strParams[key] = str;
        Prefs.set(PREFS_KEY_STR+key, strParams[key]);
    }

    /** Returns all parameters as String array of lines as they are in the ImageJ Prefs file */
    public static synchronized String[] getParameterLines() {
        if (!initialized) initialize();
        String[] out = new String[N_STR_PARAM+1];
        out[0] = PREFS_KEY_NUM+"="+getNumbersLine();
        for (int i=0; i<N_STR_PARAM; i++)
            out[i+1] = (PREFS_KEY_STR+i)+"="+ (strParams[i] == null ? "" : strParams[i]);
        return out;
    }

    /** Macro-records a numeric parameter if recording is on */
    public static void recordParameter(int key, double value) {
        if (Recorder.record && key != PARAMVERSION)
            Recorder.recordString("call('LEEM_IV_Explorer.setValue', '"+NUMERIC_PARAM_NAMES[key]+"', '"+
                    LeemUtils.d2s(value)+"');\n");
    }

    /** Dialog for all numeric parameters except the version */
    public static void showParamsDialog() {
        if (!initialized) initialize();
        GenericDialog gd = new GenericDialog("LEEM I(V) Parameters");
        for (int i=1; i<N_PARAM; i++)
            gd.addNumericField(NUMERIC_PARAM_NAMES[i], params[i], 3, 8, "");
        gd.addMessage("Parameters:\n"+getHelpText());
        gd.showDialog();
        if (gd.wasCanceled()) return;
        for (int i=1; i<N_PARAM; i++) {
            double value = gd.getNextNumber();
            if (!Double.isNaN(value))
                set(i, value);
        }
    }

    static String getHelpText() {
        StringBuilder sb = new StringBuilder();
        for (int i=1; i<N_PARAM; i++) {
            sb.append(NUMERIC_PARAM_NAMES[i]);
            sb.append(": ");
            sb.append(NUMERIC_PARAM_HELP[i]);
            sb.append('\n');
        }
        return sb.toString();
    }

    /** Reads the numbers from the Prefs String. Returns false if the version does not fit */
    private static boolean readNumParamFromString(String numStr, double[] output) {
        String[] parts = Tools.split(numStr, ",");
        for (int i=0; i<Math.min(parts.length, N_PARAM); i++) {
            double v = Tools.parseDouble(parts[i]);
            if (i == PARAMVERSION) {
                if ((int)v != CURRENTVERSION)
                    return false;
            } else if (!Double.isNaN(v))
                output[i] = v;
        }
        return true;
    }
}
