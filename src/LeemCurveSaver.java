import ij.IJ;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;


/**
 *  Saves I(V) curves as tab-delimited text files, one file per curve, each file
 *  written in a thread of its own. File 'idx' of an export is <directory>/<baseName><idx>.txt
 *  with one line per energy: energy, tab, intensity.
 *  Optionally, the log of the session is written to <directory>/<baseName>_log.txt.
 *  A new export is refused while any file of the previous export is still being written.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemCurveSaver {
    static final String CURVE_EXTENSION = ".txt";
    static final String LOG_SUFFIX = "_log.txt";
    private final LeemLog log;
    private final ArrayList<Thread> threads = new ArrayList<Thread>();   //threads of the latest export
    private final AtomicInteger nFailed = new AtomicInteger();

    public LeemCurveSaver(LeemLog log) {
        this.log = log;
    }

    /** Starts writing the curves, one thread per file. The energies are the x axis of all curves.
     *  Returns false (and writes nothing) if the previous export has not finished yet
     *  or the directory does not exist. */
    public boolean save(File directory, String baseName, double[] energies, List<double[]> curves) {
        return save(directory, baseName, energies, curves, null);
    }

    /** Starts writing the curves and, if 'logLines' is not null, the log file.
     *  Returns false (and writes nothing) if the previous export has not finished yet
     *  or the directory does not exist. */
    public synchronized boolean save(File directory, String baseName, final double[] energies, List<double[]> curves,
            final String[] logLines) {
        if (isBusy()) {
            log.error("Previous export has not finished writing; nothing saved");
            return false;
        }
        if (directory == null || !directory.isDirectory()) {
            log.error("Cannot save I(V) curves, no such directory: "+directory);
            return false;
        }
        threads.clear();
        nFailed.set(0);
        final int energyDigits = LeemUtils.getEnergyDigits(energies);
        for (int idx=0; idx<curves.size(); idx++) {
            final double[] curve = curves.get(idx);
            if (curve.length != energies.length)
                throw new IllegalArgumentException("Curve #"+idx+" has "+curve.length+" points, energy axis "+energies.length);
            final File file = getFile(directory, baseName, idx);
            Thread thread = new Thread(new Runnable() {
                    final public void run() {
                        if (saveCurveFile(file, energies, curve, energyDigits))
                            log.log("Saved "+file.getPath());
                        else
                            nFailed.incrementAndGet();
                    }
                }, "LeemCurveSaver_"+idx);
            threads.add(thread);
        }
        if (logLines != null) {
            final File logFile = getLogFile(directory, baseName);
            threads.add(new Thread(new Runnable() {
                    final public void run() {
                        if (saveLogFile(logFile, logLines))
                            log.log("Saved "+logFile.getPath());
                        else
                            nFailed.incrementAndGet();
                    }
                }, "LeemCurveSaver_log"));
        }
        for (Thread thread : threads)
            thread.start();
        return true;
    }

    /** Returns whether a file of the latest export is still being written */
    public synchronized boolean isBusy() {
        for (Thread thread : threads)
            if (thread.isAlive())
                return true;
        return false;
    }

    /** Waits until all files of the latest export are written.
     *  Returns false if writing any of them has failed. */
    public boolean waitForCompletion() throws InterruptedException {
        Thread[] toWait;
        synchronized(this) {
            toWait = threads.toArray(new Thread[0]);
        }
        for (Thread thread : toWait)
            thread.join();
        return nFailed.get() == 0;
    }

    /** Returns the output file for curve number 'idx' */
    public static File getFile(File directory, String baseName, int idx) {
        return new File(directory, baseName+idx+CURVE_EXTENSION);
    }

    /** Returns the log file of an export */
    public static File getLogFile(File directory, String baseName) {
        return new File(directory, baseName+LOG_SUFFIX);
    }

    /** Writes one curve; returns false on error (which is logged) */
    boolean saveCurveFile(File file, double[] energies, double[] curve, int energyDigits) {
        PrintWriter pw = null;
        try {
            FileOutputStream fos = new FileOutputStream(file);
            BufferedOutputStream bos = new BufferedOutputStream(fos);
            pw = new PrintWriter(bos);
            for (int i=0; i<energies.length; i++) {
                pw.print(IJ.d2s(energies[i], energyDigits));
                pw.print('\t');
                pw.println((float)curve[i]);
            }
            pw.close();
            if (pw.checkError())
                throw new IOException("write error");
            return true;
        } catch (Exception e) {
            log.error("Error writing file "+file.getPath()+": "+e);
            if (pw != null)
                pw.close();
            return false;
        }
    }

    /** Writes the log lines; returns false on error (which is logged) */
    boolean saveLogFile(File file, String[] logLines) {
        PrintWriter pw = null;
        try {
            FileOutputStream fos = new FileOutputStream(file);
            BufferedOutputStream bos = new BufferedOutputStream(fos);
            pw = new PrintWriter(bos);
            for (String line : logLines)
                pw.println(line);
            pw.close();
            if (pw.checkError())
                throw new IOException("write error");
            return true;
        } catch (Exception e) {
            log.error("Error writing file "+file.getPath()+": "+e);
            if (pw != null)
                pw.close();
            return false;
        }
    }
}
