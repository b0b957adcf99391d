import ij.ImageStack;


/**
 *  A loaded stack of frames (the volume) together with its energy axis.
 *  Slice k+1 of the ImageStack is the frame at energies[k].
 *  Published as a whole after a successful load and never modified thereafter.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemStack {
    private final ImageStack volume;
    private final double[] energies;
    private final LeemLoadRequest request;

    public LeemStack(ImageStack volume, double[] energies, LeemLoadRequest request) {
        if (volume == null || volume.getSize() == 0)
            throw new IllegalArgumentException("Empty stack");
        if (energies == null || energies.length != volume.getSize())
            throw new IllegalArgumentException("Energy axis length "+(energies == null ? 0 : energies.length)+
                    " does not match stack size "+volume.getSize());
        this.volume = volume;
        this.energies = energies.clone();
        this.request = request;
    }

    /** Returns the volume. Callers must not modify it. */
    public ImageStack getVolume() {return volume;}
    public int getHeight() {return volume.getHeight();}
    public int getWidth() {return volume.getWidth();}
    public int getDepth() {return volume.getSize();}
    /** Bits per sample: 8, 16 or 32 */
    public int getBitDepth() {return volume.getBitDepth();}
    /** The request that produced this stack, or null if not known */
    public LeemLoadRequest getRequest() {return request;}

    /** Returns a copy of the energy axis */
    public double[] getEnergies() {
        return energies.clone();
    }

    public double getEnergy(int index) {
        return energies[index];
    }

    /** Returns whether (row, col) is a pixel of the frames */
    public boolean contains(int row, int col) {
        return row >= 0 && row < getHeight() && col >= 0 && col < getWidth();
    }

    /** Returns the raw intensities of one pixel for all slices */
    public double[] getSpectrum(int row, int col) {
        if (!contains(row, col))
            throw new IllegalArgumentException("Pixel (row="+row+", col="+col+") outside of "+
                    getWidth()+"x"+getHeight()+" image");
        int depth = getDepth();
        double[] spectrum = new double[depth];
        for (int k=0; k<depth; k++)
            spectrum[k] = volume.getVoxel(col, row, k);
        return spectrum;
    }

    public String toString() {
        return getWidth()+"x"+getHeight()+"x"+getDepth()+", "+getBitDepth()+"-bit, E="+
                LeemUtils.d2s(energies[0])+"-"+LeemUtils.d2s(energies[energies.length-1])+" eV";
    }
}
