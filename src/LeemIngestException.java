import java.io.File;
import java.io.IOException;

/**
 *  Thrown when a stack of frames cannot be read. Any such error aborts
 *  the whole ingestion; no partial stack is produced.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemIngestException extends IOException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** The source directory does not exist or is not a directory */
        PATH_NOT_FOUND,
        /** No file in the directory matches */
        NO_FRAMES,
        /** A file is smaller than one frame or cannot be decoded */
        MALFORMED_FRAME,
        /** Image files with different size or sample type */
        SHAPE_MISMATCH
    }

    private final Reason reason;
    private final File file;

    public LeemIngestException(Reason reason, File file, String message) {
        super(message);
        this.reason = reason;
        this.file = file;
    }

    public LeemIngestException(Reason reason, File file, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.file = file;
    }

    public Reason getReason() {
        return reason;
    }

    /** Returns the offending file or directory, or null if none */
    public File getFile() {
        return file;
    }
}
