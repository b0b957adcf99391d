import ij.ImageStack;


/**
 *  Integrates the intensity of a LEED spot: for each stack slice, sums all pixels of a
 *  square window with 2*halfWidth+1 pixels side length around the center pixel.
 *  Windows extending beyond the image are rejected, not clipped.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemIntegrator {

    /** Returns the integrated intensity for each slice of the stack.
     *  @throws LeemWindowException if the window is not fully inside the image or the halfWidth is negative */
    public static double[] integrate(ImageStack volume, int centerRow, int centerCol, int halfWidth) {
        checkWindow(volume.getHeight(), volume.getWidth(), centerRow, centerCol, halfWidth);
        int depth = volume.getSize();
        int width = volume.getWidth();
        double[] sums = new double[depth];
        for (int k=0; k<depth; k++) {
            Object pixels = volume.getPixels(k+1);
            double sum = 0;
            for (int y=centerRow-halfWidth; y<=centerRow+halfWidth; y++) {
                int p0 = y*width + centerCol - halfWidth;
                int p1 = y*width + centerCol + halfWidth;
                if (pixels instanceof short[]) {
                    short[] sPixels = (short[])pixels;
                    for (int p=p0; p<=p1; p++)
                        sum += sPixels[p]&0xffff;
                } else if (pixels instanceof byte[]) {
                    byte[] bPixels = (byte[])pixels;
                    for (int p=p0; p<=p1; p++)
                        sum += bPixels[p]&0xff;
                } else if (pixels instanceof float[]) {
                    float[] fPixels = (float[])pixels;
                    for (int p=p0; p<=p1; p++)
                        sum += fPixels[p];
                } else
                    throw new IllegalArgumentException("Unsupported image type for integration");
            }
            sums[k] = sum;
        }
        return sums;
    }

    /** Returns the integrated intensity of a window in a loaded stack */
    public static double[] integrate(LeemStack stack, int centerRow, int centerCol, int halfWidth) {
        return integrate(stack.getVolume(), centerRow, centerCol, halfWidth);
    }

    /** Returns whether a window with the given center and halfWidth fits into an image of the given size */
    public static boolean isInside(int height, int width, int centerRow, int centerCol, int halfWidth) {
        return halfWidth >= 0 &&
                centerRow - halfWidth >= 0 && centerRow + halfWidth < height &&
                centerCol - halfWidth >= 0 && centerCol + halfWidth < width;
    }

    /** @throws LeemWindowException if the window does not fit into the image */
    public static void checkWindow(int height, int width, int centerRow, int centerCol, int halfWidth) {
        if (!isInside(height, width, centerRow, centerCol, halfWidth))
            throw new LeemWindowException(centerRow, centerCol, halfWidth, height, width);
    }
}
