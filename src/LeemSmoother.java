/**
 *  Smooths an I(V) curve (one spectrum) by convolution with a normalized window.
 *
 *  The data are extended at both ends by their mirror image (without repeating
 *  the end points), convolved with the window (only where the window fully
 *  overlaps the extended data), and cut to the original length.
 *  The window length must be even and larger than 3; odd lengths are
 *  increased by one. With an even window, the result is shifted by
 *  half a point towards lower indices.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemSmoother {
    /** Window length of the live (mouse hover) curve */
    public static final int DEFAULT_WINDOW_LEN = 10;
    /** Window type of the live (mouse hover) curve */
    public static final WindowType DEFAULT_WINDOW_TYPE = WindowType.FLAT;
    /** Window lengths up to this value are not accepted */
    public static final int MAX_INVALID_WINDOW_LEN = 3;

    /** The window (kernel) shapes */
    public enum WindowType {
        FLAT, HANNING, HAMMING, BARTLETT, BLACKMAN;

        /** Returns the window type for a name like 'flat' or 'Hanning' */
        public static WindowType fromName(String name) {
            if (name != null)
                for (WindowType type : values())
                    if (type.name().equalsIgnoreCase(name.trim()))
                        return type;
            throw new LeemSmoothException(LeemSmoothException.Reason.INVALID_WINDOW_TYPE,
                    "Invalid window type '"+name+"'; must be one of flat, hanning, hamming, bartlett, blackman");
        }

        /** Returns the window type with the given index (as in LeemParams) */
        public static WindowType fromIndex(int index) {
            if (index < 0 || index >= values().length)
                throw new LeemSmoothException(LeemSmoothException.Reason.INVALID_WINDOW_TYPE,
                        "Invalid window type #"+index);
            return values()[index];
        }

        /** Returns the window of length n (not normalized) */
        public double[] makeWindow(int n) {
            double[] w = new double[n];
            double m = n - 1;
            for (int i=0; i<n; i++) {
                double phase = 2*Math.PI*i/m;
                switch (this) {
                    case FLAT:
                        w[i] = 1;
                        break;
                    case HANNING:
                        w[i] = 0.5 - 0.5*Math.cos(phase);
                        break;
                    case HAMMING:
                        w[i] = 0.54 - 0.46*Math.cos(phase);
                        break;
                    case BARTLETT:
                        w[i] = i <= 0.5*m ? 2.0*i/m : 2.0 - 2.0*i/m;
                        break;
                    case BLACKMAN:
                        w[i] = 0.42 - 0.5*Math.cos(phase) + 0.08*Math.cos(2*phase);
                        break;
                }
            }
            return w;
        }

        public String toString() {
            return name().toLowerCase();
        }
    }

    private final WindowType windowType;
    private final int windowLen;
    private final double[] kernel;

    /** Creates a smoother. An odd window length is increased by one; this is reported to the log (if not null).
     *  @throws LeemSmoothException if the (increased) window length is 3 or less */
    public LeemSmoother(WindowType windowType, int windowLen, LeemLog log) {
        if (windowType == null)
            throw new LeemSmoothException(LeemSmoothException.Reason.INVALID_WINDOW_TYPE, "No window type");
        if (windowLen % 2 != 0) {
            windowLen++;
            if (log != null)
                log.log("Smoothing window length is odd, using next higher length: "+windowLen);
        }
        if (windowLen <= MAX_INVALID_WINDOW_LEN)
            throw new LeemSmoothException(LeemSmoothException.Reason.WINDOW_TOO_SMALL,
                    "Smoothing window length "+windowLen+" too small, must be at least "+(MAX_INVALID_WINDOW_LEN+1));
        this.windowType = windowType;
        this.windowLen = windowLen;
        kernel = windowType.makeWindow(windowLen);
        double sum = 0;
        for (double k : kernel)
            sum += k;
        for (int i=0; i<windowLen; i++)
            kernel[i] *= 1./sum;    //normalize the kernel to sum = 1
    }

    /** Creates a smoother for a window type given by its name, e.g. 'flat' */
    public LeemSmoother(String windowTypeName, int windowLen, LeemLog log) {
        this(WindowType.fromName(windowTypeName), windowLen, log);
    }

    /** Smoothes the data with the given window; returns the result in a new array */
    public static double[] smooth(double[] data, int windowLen, WindowType windowType, LeemLog log) {
        return new LeemSmoother(windowType, windowLen, log).smooth(data);
    }

    public WindowType getWindowType() {
        return windowType;
    }

    /** Returns the window length actually used (even) */
    public int getWindowLength() {
        return windowLen;
    }

    /** Returns the smoothed data in a new array of the same length.
     *  @throws LeemSmoothException if the data are shorter than the window */
    public double[] smooth(double[] data) {
        int n = data.length;
        if (n < windowLen)
            throw new LeemSmoothException(LeemSmoothException.Reason.SEQUENCE_TOO_SHORT,
                    "Cannot smooth "+n+" points with a window of "+windowLen);
        int nPad = windowLen - 1;
        double[] extended = new double[n + 2*nPad];
        for (int i=0; i<nPad; i++) {
            extended[i] = data[nPad - i];               //data[nPad] ... data[1]
            extended[nPad + n + i] = data[n - 2 - i];   //data[n-2] ... data[n-nPad-1]
        }
        System.arraycopy(data, 0, extended, nPad, n);
        // convolution, only where the kernel fully overlaps; of its n+windowLen-1 points
        // we skip windowLen/2-1 at the start and windowLen/2 at the end
        int offset = windowLen/2 - 1;
        double[] out = new double[n];
        for (int i=0; i<n; i++) {
            int last = i + offset + windowLen - 1;      //kernel[0] is multiplied with this point
            double sum = 0;
            for (int k=0; k<windowLen; k++)
                sum += kernel[k]*extended[last - k];
            out[i] = sum;
        }
        return out;
    }

    public String toString() {
        return windowType+" window, length "+windowLen;
    }
}
