import java.io.File;


/**
 *  Describes where and how to read a stack of frames, and the energies of the frames.
 *  RAW: frame files with an opaque header followed by height*width samples.
 *  IMAGE: image files readable by ImageJ, selected by the file extension.
 *  Instances are immutable.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemLoadRequest {
    public enum Mode {RAW, IMAGE}

    private final Mode mode;
    private final File directory;
    private final int height, width, bitDepth;
    private final boolean littleEndian;
    private final String extension;
    private final double startEnergy, energyStep;

    private LeemLoadRequest(Mode mode, File directory, int height, int width, int bitDepth, boolean littleEndian,
            String extension, double startEnergy, double energyStep) {
        if (directory == null)
            throw new IllegalArgumentException("No source directory");
        if (Double.isNaN(startEnergy) || Double.isNaN(energyStep))
            throw new IllegalArgumentException("Start energy and energy step must be numbers");
        this.mode = mode;
        this.directory = directory;
        this.height = height;
        this.width = width;
        this.bitDepth = bitDepth;
        this.littleEndian = littleEndian;
        this.extension = extension == null ? "" : extension.trim();
        this.startEnergy = startEnergy;
        this.energyStep = energyStep;
    }

    /** Request for raw frames; 'extension' selects the files (e.g. ".dat"), empty or null for all files */
    public static LeemLoadRequest raw(File directory, int height, int width, int bitDepth, boolean littleEndian,
            String extension, double startEnergy, double energyStep) {
        if (height < 1 || width < 1)
            throw new IllegalArgumentException("Invalid frame size: "+width+"x"+height);
        if (bitDepth != 8 && bitDepth != 16 && bitDepth != 32)
            throw new IllegalArgumentException("Unsupported bit depth: "+bitDepth+" (must be 8, 16 or 32)");
        return new LeemLoadRequest(Mode.RAW, directory, height, width, bitDepth, littleEndian,
                extension, startEnergy, energyStep);
    }

    /** Request for image files with the given extension (e.g. "tif", ".png") */
    public static LeemLoadRequest image(File directory, String extension, double startEnergy, double energyStep) {
        if (extension == null || extension.trim().length() == 0)
            throw new IllegalArgumentException("No file extension for image files");
        return new LeemLoadRequest(Mode.IMAGE, directory, 0, 0, 0, true,
                extension, startEnergy, energyStep);
    }

    /** Creates a request from the current LeemParams */
    public static LeemLoadRequest fromParams() {
        File directory = new File(LeemParams.getString(LeemParams.SOURCE_PATH));
        String extension = LeemParams.getString(LeemParams.FILE_EXTENSION);
        double startEnergy = LeemParams.get(LeemParams.START_ENERGY);
        double energyStep = LeemParams.get(LeemParams.ENERGY_STEP);
        if (LeemParams.getInt(LeemParams.MODE) == LeemParams.MODE_IMAGE)
            return image(directory, extension, startEnergy, energyStep);
        else
            return raw(directory, LeemParams.getInt(LeemParams.FRAME_HEIGHT), LeemParams.getInt(LeemParams.FRAME_WIDTH),
                    LeemParams.getInt(LeemParams.BIT_DEPTH), LeemParams.getBoolean(LeemParams.LITTLE_ENDIAN),
                    extension, startEnergy, energyStep);
    }

    public Mode getMode() {return mode;}
    public File getDirectory() {return directory;}
    /** Raw mode only: rows per frame */
    public int getHeight() {return height;}
    /** Raw mode only: columns per frame */
    public int getWidth() {return width;}
    /** Raw mode only: bits per sample */
    public int getBitDepth() {return bitDepth;}
    public boolean isLittleEndian() {return littleEndian;}
    public String getExtension() {return extension;}
    public double getStartEnergy() {return startEnergy;}
    public double getEnergyStep() {return energyStep;}

    /** Raw mode only: bytes of the image data in each file */
    public long getPayloadLength() {
        return (long)height*width*(bitDepth/8);
    }

    public String toString() {
        if (mode == Mode.RAW)
            return "RAW "+directory+" "+width+"x"+height+", "+bitDepth+" bit, "+
                    (littleEndian ? "little" : "big")+"-endian, E0="+startEnergy+" dE="+energyStep;
        else
            return "IMAGE "+directory+" *"+extension+", E0="+startEnergy+" dE="+energyStep;
    }
}
