import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.util.Random;

/**
 * Writes frame files and creates stacks with known pixel values for tests.
 * Unless stated otherwise, the sample at (row, col) of frame k has the value k*100 + row*10 + col.
 */
public class LeemTestFrames {

    public static int value(final int row,
                            final int col,
                            final int k) {
        return k * 100 + row * 10 + col;
    }

    /**
     * Writes raw frames named frame_000.dat, frame_001.dat, ...
     * each with a header of random length and content.
     */
    public static void writeRawFrames(final File directory,
                                      final int nFrames,
                                      final int height,
                                      final int width,
                                      final int bitDepth,
                                      final boolean littleEndian) throws IOException {
        final Random random = new Random(42);
        for (int k = 0; k < nFrames; k++) {
            final byte[] header = new byte[random.nextInt(500)];
            random.nextBytes(header);
            writeRawFrame(new File(directory, String.format("frame_%03d.dat", k)),
                          header, height, width, bitDepth, littleEndian, k * 100);
        }
    }

    /**
     * Writes one raw frame; the sample at (row, col) is offset + row*10 + col.
     */
    public static void writeRawFrame(final File file,
                                     final byte[] header,
                                     final int height,
                                     final int width,
                                     final int bitDepth,
                                     final boolean littleEndian,
                                     final int offset) throws IOException {
        final int bytesPerSample = bitDepth / 8;
        final ByteBuffer buffer = ByteBuffer.allocate(header.length + height * width * bytesPerSample);
        buffer.order(littleEndian ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
        buffer.put(header);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                final int v = offset + row * 10 + col;
                switch (bitDepth) {
                    case 8:
                        buffer.put((byte) v);
                        break;
                    case 16:
                        buffer.putShort((short) v);
                        break;
                    default:
                        buffer.putInt(v);
                }
            }
        }
        writeBytes(file, buffer.array());
    }

    public static void writeBytes(final File file,
                                  final byte[] bytes) throws IOException {
        try (final OutputStream out = new FileOutputStream(file)) {
            out.write(bytes);
        }
    }

    /**
     * Writes a 16-bit tiff file with the standard test values for frame k.
     */
    public static void writeTiff(final File file,
                                 final int height,
                                 final int width,
                                 final int k) throws IOException {
        final ImageProcessor ip = makeProcessor(height, width, k);
        if (! new FileSaver(new ImagePlus(file.getName(), ip)).saveAsTiff(file.getPath())) {
            throw new IOException("failed to write " + file);
        }
    }

    public static ShortProcessor makeProcessor(final int height,
                                               final int width,
                                               final int k) {
        final ShortProcessor ip = new ShortProcessor(width, height);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                ip.set(col, row, value(row, col, k));
            }
        }
        return ip;
    }

    /**
     * Creates a 16-bit stack with the standard test values and the energy axis -9.9, -9.8, ...
     */
    public static LeemStack makeStack(final int height,
                                      final int width,
                                      final int depth) {
        final ImageStack volume = new ImageStack(width, height);
        for (int k = 0; k < depth; k++) {
            volume.addSlice("frame " + k, makeProcessor(height, width, k));
        }
        return new LeemStack(volume, LeemEnergyAxis.build(-9.9, 0.1, depth), null);
    }

    public static File createTempDirectory(final String prefix) throws IOException {
        return Files.createTempDirectory(prefix).toFile();
    }

    public static void deleteRecursive(final File file) {
        if (file == null || ! file.exists()) {
            return;
        }
        final File[] children = file.listFiles();
        if (children != null) {
            for (final File child : children) {
                deleteRecursive(child);
            }
        }
        if (! file.delete()) {
            file.deleteOnExit();
        }
    }
}
