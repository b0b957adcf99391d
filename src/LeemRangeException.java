/**
 *  Thrown for an invalid display range (lower and upper limit for mapping to 8 bits).
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemRangeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;
    private final double lower, upper;

    public LeemRangeException(double lower, double upper) {
        super("Invalid display range "+lower+"-"+upper+
                "; need 0 <= lower < upper < 65536 and lower < 65535");
        this.lower = lower;
        this.upper = upper;
    }

    public double getLower() {return lower;}
    public double getUpper() {return upper;}
}
