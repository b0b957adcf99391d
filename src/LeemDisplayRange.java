import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;


/**
 *  Maps the samples of a frame to 8 bits for display.
 *  The input frame is not modified; the output is a new ByteProcessor.
 *  Values below 'lower' become 0, values at or above 'upper' become 255,
 *  values in between are mapped linearly onto 0-255.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemDisplayRange {
    /** Exclusive upper limit of the range for 'lower' */
    public static final int MAX_LOWER = 65535;
    /** Exclusive upper limit of the range for 'upper' */
    public static final int MAX_UPPER = 65536;

    /** Maps with the full range of the image data (minimum to maximum, rounded to integers) */
    public static ByteProcessor map(ImageProcessor ip) {
        return map(ip, Double.NaN, Double.NaN);
    }

    /** Maps the image data to 8 bits. 'lower' and 'upper' may be NaN,
     *  then the minimum or maximum of the data is used, respectively.
     *  @throws LeemRangeException if the limits are invalid */
    public static ByteProcessor map(ImageProcessor ip, double lower, double upper) {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            double[] minMax = getMinMax(ip);
            if (Double.isNaN(lower))
                lower = Math.max(0, Math.min(Math.floor(minMax[0]), MAX_LOWER - 1));
            if (Double.isNaN(upper)) {
                upper = Math.min(Math.ceil(minMax[1]), MAX_UPPER - 1);
                if (upper <= lower) upper = lower + 1;     //flat image
            }
        }
        checkRange(lower, upper);
        int width = ip.getWidth(), height = ip.getHeight();
        int nPixels = width*height;
        byte[] out = new byte[nPixels];
        int bitDepth = ip.getBitDepth();
        if (bitDepth == 8 || bitDepth == 16) {
            int[] table = makeTable(lower, upper, bitDepth == 8 ? 256 : 65536);
            for (int i=0; i<nPixels; i++)
                out[i] = (byte)table[ip.get(i)];
        } else if (bitDepth == 32) {
            for (int i=0; i<nPixels; i++)
                out[i] = (byte)mapValue(ip.getf(i), lower, upper);
        } else
            throw new IllegalArgumentException("Cannot map "+bitDepth+"-bit images");
        return new ByteProcessor(width, height, out);
    }

    /** Returns the lookup table for sample values 0 ... domainSize-1 */
    public static int[] makeTable(double lower, double upper, int domainSize) {
        checkRange(lower, upper);
        int[] table = new int[domainSize];
        for (int v=0; v<domainSize; v++)
            table[v] = mapValue(v, lower, upper);
        return table;
    }

    /** Maps a single value; the range must have been checked before */
    static int mapValue(double v, double lower, double upper) {
        if (!(v >= lower)) return 0;       //also NaN
        if (v >= upper) return 255;
        int out = (int)((v - lower)*(255.0/(upper - lower)));
        return out > 255 ? 255 : out;
    }

    /** @throws LeemRangeException unless 0 <= lower < 65535, 0 <= upper < 65536, lower < upper */
    public static void checkRange(double lower, double upper) {
        if (!(lower >= 0 && lower < MAX_LOWER && upper >= 0 && upper < MAX_UPPER && lower < upper))
            throw new LeemRangeException(lower, upper);
    }

    /** Returns minimum and maximum of the image data, for 32-bit data ignoring NaNs */
    static double[] getMinMax(ImageProcessor ip) {
        double min = Double.MAX_VALUE, max = -Double.MAX_VALUE;
        int nPixels = ip.getPixelCount();
        boolean isFloat = ip instanceof FloatProcessor;
        for (int i=0; i<nPixels; i++) {
            double v = isFloat ? ip.getf(i) : ip.get(i);
            if (v < min) min = v;
            if (v > max) max = v;
        }
        return new double[] {min, max};
    }
}
