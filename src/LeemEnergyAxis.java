/**
 *  The energies of the stack slices.
 *  The axis is built step by step, rounding each value to 2 decimals before
 *  adding the next step; so rounding errors accumulate the same way as in
 *  an energy counter advanced for each frame.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemEnergyAxis {
    /** Number of decimals of the energy values */
    public static final int DECIMALS = 2;
    /** Nonzero steps smaller than this would not increase the rounded energy */
    public static final double MIN_STEP = 0.5*Math.pow(10, -DECIMALS);

    /** Returns 'n' energies starting at 'startEnergy' */
    public static double[] build(double startEnergy, double step, int n) {
        if (n < 0)
            throw new IllegalArgumentException("Negative number of energies: "+n);
        if (step != 0 && Math.abs(step) < MIN_STEP)
            throw new IllegalArgumentException("Energy step "+step+" too small, must be at least "+MIN_STEP);
        double[] energies = new double[n];
        if (n == 0) return energies;
        energies[0] = startEnergy;
        for (int i=1; i<n; i++)
            energies[i] = LeemUtils.round(energies[i-1] + step, DECIMALS);
        return energies;
    }

    /** Returns the energy axis for a load request and a given number of frames */
    public static double[] build(LeemLoadRequest request, int n) {
        return build(request.getStartEnergy(), request.getEnergyStep(), n);
    }

    /** Returns the index of the slice with the energy nearest to the given one,
     *  or -1 if the energy is outside by more than half a step */
    public static int indexOf(double[] energies, double energy) {
        if (energies == null || energies.length == 0 || Double.isNaN(energy)) return -1;
        int nearest = 0;
        for (int i=1; i<energies.length; i++)
            if (Math.abs(energy - energies[i]) < Math.abs(energy - energies[nearest]))
                nearest = i;
        double halfStep = energies.length > 1 ? 0.5*Math.abs(energies[1] - energies[0]) : 0;
        return Math.abs(energy - energies[nearest]) <= halfStep + 1e-9 ? nearest : -1;
    }
}
