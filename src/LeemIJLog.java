import ij.IJ;
import java.util.ArrayList;

/**
 *  Writes the messages of a session to the ImageJ 'Log' window.
 *  Also remembers the lines, so they can be saved together with the I(V) curves.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemIJLog implements LeemLog {
    private final String prefix;
    private final ArrayList<String> logLines = new ArrayList<String>();
    private long lastBeepTimeMillis;

    /** Creates a log sink; the prefix (e.g. the plugin name) is written before each line */
    public LeemIJLog(String prefix) {
        this.prefix = prefix == null || prefix.length() == 0 ? "" : prefix + ": ";
    }

    public void log(String text) {
        String line = prefix + text;
        synchronized(logLines) {
            logLines.add(line);
        }
        IJ.log(line);
    }

    /** Shows an error message in the 'Log' window, puts the Log window to the foreground
     *  and beeps (not more often than every 2 seconds) */
    public void error(String text) {
        String line = prefix + "ERROR: " + text;
        synchronized(logLines) {
            logLines.add(line);
        }
        IJ.log(line);
        if (IJ.getInstance() == null) return;  //headless or no ImageJ window
        IJ.selectWindow("Log");
        long time = System.currentTimeMillis();
        if (time - lastBeepTimeMillis > 2000)
            IJ.beep();
        lastBeepTimeMillis = time;
    }

    /** Returns the lines logged so far */
    public String[] getLogLines() {
        synchronized(logLines) {
            return logLines.toArray(new String[0]);
        }
    }
}
