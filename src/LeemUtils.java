import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;


/**
 *  This class contains various static utility methods
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemUtils {

    /** Returns whether the file name ends with the given extension, ignoring case.
     *  The extension may be given with or without the leading dot.
     *  A null or empty extension matches all names. */
    public static boolean hasExtension(String filename, String extension) {
        if (extension == null) return true;
        extension = extension.trim();
        if (extension.length() == 0) return true;
        if (extension.charAt(0) != '.')
            extension = '.' + extension;
        return filename.toLowerCase(Locale.US).endsWith(extension.toLowerCase(Locale.US));
    }

    /** Rounds to the given number of decimals, starting from the exact binary value
     *  of the double; exact ties are rounded to the even neighbor. */
    public static double round(double x, int decimals) {
        if (Double.isNaN(x) || Double.isInfinite(x)) return x;
        return new BigDecimal(x).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }

    /** Formats a parameter or energy for the Prefs, macros and titles:
     *  whole numbers without decimals, others with the accuracy of 32-bit floats */
    public static String d2s(double x) {
        float f = (float)x;
        if (f == Math.rint(f) && Math.abs(f) < 1e9)
            return Long.toString((long)f);
        return Float.toString(f);
    }

    /** Returns the number of digits after the decimal point needed to write the energies,
     *  at most 2 (the energy axis is rounded to 2 decimals) */
    public static int getEnergyDigits(double[] energies) {
        if (energies == null) return 0;
        for (int digits=0; digits<2; digits++) {
            boolean ok = true;
            double factor = Math.pow(10, digits);
            for (double e : energies)
                if (Math.abs(e*factor - Math.round(e*factor)) > 1e-6) {
                    ok = false;
                    break;
                }
            if (ok) return digits;
        }
        return 2;
    }
}
