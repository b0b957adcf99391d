import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileInfo;
import ij.io.FileOpener;
import ij.process.ImageProcessor;
import java.io.File;
import java.io.FileFilter;
import java.util.Arrays;
import java.util.Comparator;


/**
 *  Reads a directory of frame files, one file per energy, into one ImageStack (the volume).
 *
 *  RAW mode: each file contains an opaque header of any length, followed by the
 *  height*width samples of the frame (row by row). The header length is given by the
 *  file size minus the size of the image data, so the samples are read from the end
 *  of the file.
 *  IMAGE mode: each file with the given extension is opened by ImageJ as one frame;
 *  the sample type (8, 16 or 32 bits) is kept, RGB images are converted to 8-bit gray.
 *
 *  The frames are stacked in ascending sequence of the file names.
 *  Any error aborts the whole operation; then no stack is created.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemFrameIngestor {
    private final LeemLog log;

    public LeemFrameIngestor(LeemLog log) {
        this.log = log;
    }

    /** Reads the frames and creates the stack with the energy axis */
    public LeemStack load(LeemLoadRequest request) throws LeemIngestException {
        ImageStack volume = read(request);
        double[] energies = LeemEnergyAxis.build(request, volume.getSize());
        return new LeemStack(volume, energies, request);
    }

    /** Reads the frames as specified by the request and returns them as ImageStack */
    public ImageStack read(LeemLoadRequest request) throws LeemIngestException {
        File[] files = listFrameFiles(request.getDirectory(), request.getExtension());
        long t0 = System.currentTimeMillis();
        ImageStack stack = null;
        try {
            for (int i=0; i<files.length; i++) {
                IJ.showProgress(i, files.length);
                ImageProcessor ip = request.getMode() == LeemLoadRequest.Mode.RAW ?
                        readRawFrame(files[i], request) : readImageFrame(files[i]);
                if (stack == null)
                    stack = new ImageStack(ip.getWidth(), ip.getHeight());
                else
                    checkShape(stack, ip, files[i]);
                stack.addSlice(files[i].getName(), ip);
            }
        } finally {
            IJ.showProgress(1.0);
        }
        if (log != null)
            log.log("Read "+files.length+" frames "+stack.getWidth()+"x"+stack.getHeight()+
                    " ("+stack.getBitDepth()+"-bit) from "+request.getDirectory()+" in "+
                    IJ.d2s((System.currentTimeMillis()-t0)*0.001, 2)+" s");
        return stack;
    }

    /** Returns the regular, non-hidden files in the directory with the given extension,
     *  sorted by name (an empty extension selects all files) */
    public static File[] listFrameFiles(File directory, final String extension) throws LeemIngestException {
        if (directory == null || !directory.isDirectory())
            throw new LeemIngestException(LeemIngestException.Reason.PATH_NOT_FOUND, directory,
                    "No such directory: "+directory);
        File[] files = directory.listFiles(new FileFilter() {
                public boolean accept(File file) {
                    String name = file.getName();
                    return file.isFile() && !name.startsWith(".") && LeemUtils.hasExtension(name, extension);
                }
            });
        if (files == null)
            throw new LeemIngestException(LeemIngestException.Reason.PATH_NOT_FOUND, directory,
                    "Cannot list directory "+directory);
        if (files.length == 0)
            throw new LeemIngestException(LeemIngestException.Reason.NO_FRAMES, directory,
                    "No "+(extension.length() > 0 ? "'"+extension+"' " : "")+"files in "+directory);
        Arrays.sort(files, new Comparator<File>() {
                public int compare(File f1, File f2) {
                    return f1.getName().compareTo(f2.getName());
                }
            });
        return files;
    }

    /** Reads the image data at the end of a raw file with the ImageJ raw file reader */
    ImageProcessor readRawFrame(File file, LeemLoadRequest request) throws LeemIngestException {
        long payloadLength = request.getPayloadLength();
        long headerLength = file.length() - payloadLength;
        if (headerLength < 0)
            throw new LeemIngestException(LeemIngestException.Reason.MALFORMED_FRAME, file,
                    "File "+file.getName()+" has "+file.length()+" bytes, less than one frame ("+payloadLength+" bytes)");
        FileInfo fi = new FileInfo();
        fi.fileName = file.getName();
        fi.directory = file.getAbsoluteFile().getParent();
        if (!(fi.directory.endsWith("/") || fi.directory.endsWith("\\")))
            fi.directory += File.separator;
        fi.fileFormat = FileInfo.RAW;
        fi.fileType = getFileType(request.getBitDepth());
        fi.width = request.getWidth();
        fi.height = request.getHeight();
        fi.nImages = 1;
        fi.intelByteOrder = request.isLittleEndian();
        fi.longOffset = headerLength;
        ImagePlus imp = null;
        try {
            imp = (new FileOpener(fi)).openImage();
        } catch (Exception e) {
            throw new LeemIngestException(LeemIngestException.Reason.MALFORMED_FRAME, file,
                    "Cannot read "+file.getName()+": "+e, e);
        }
        if (imp == null || imp.getProcessor() == null)
            throw new LeemIngestException(LeemIngestException.Reason.MALFORMED_FRAME, file,
                    "Cannot read "+file.getName()+" as raw frame");
        return imp.getProcessor();
    }

    /** Opens an image file with ImageJ. RGB is converted to 8-bit intensity. */
    ImageProcessor readImageFrame(File file) throws LeemIngestException {
        ImagePlus imp = null;
        try {
            imp = IJ.openImage(file.getPath());
        } catch (Exception e) {
            throw new LeemIngestException(LeemIngestException.Reason.MALFORMED_FRAME, file,
                    "Cannot open "+file.getName()+": "+e, e);
        }
        if (imp == null || imp.getProcessor() == null)
            throw new LeemIngestException(LeemIngestException.Reason.MALFORMED_FRAME, file,
                    "Cannot open "+file.getName()+" as image");
        if (imp.getStackSize() > 1)
            throw new LeemIngestException(LeemIngestException.Reason.MALFORMED_FRAME, file,
                    "File "+file.getName()+" contains "+imp.getStackSize()+" images, one expected");
        ImageProcessor ip = imp.getProcessor();
        if (ip.getBitDepth() == 24)
            ip = ip.convertToByte(false);
        return ip;
    }

    /** All frames must have the size and sample type of the first one */
    private static void checkShape(ImageStack stack, ImageProcessor ip, File file) throws LeemIngestException {
        if (ip.getWidth() != stack.getWidth() || ip.getHeight() != stack.getHeight())
            throw new LeemIngestException(LeemIngestException.Reason.SHAPE_MISMATCH, file,
                    "Frame "+file.getName()+" has "+ip.getWidth()+"x"+ip.getHeight()+" pixels, previous frames "+
                    stack.getWidth()+"x"+stack.getHeight());
        if (ip.getBitDepth() != stack.getBitDepth())
            throw new LeemIngestException(LeemIngestException.Reason.SHAPE_MISMATCH, file,
                    "Frame "+file.getName()+" is "+ip.getBitDepth()+"-bit, previous frames "+stack.getBitDepth()+"-bit");
    }

    /** Returns the ImageJ FileInfo type for raw unsigned samples with the given number of bits */
    static int getFileType(int bitDepth) {
        switch (bitDepth) {
            case 8:  return FileInfo.GRAY8;
            case 16: return FileInfo.GRAY16_UNSIGNED;
            case 32: return FileInfo.GRAY32_UNSIGNED;
            default: throw new IllegalArgumentException("Unsupported bit depth: "+bitDepth);
        }
    }
}
