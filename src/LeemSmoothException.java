/**
 *  Thrown when a spectrum cannot be smoothed with the given window.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemSmoothException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Reason {INVALID_WINDOW_TYPE, WINDOW_TOO_SMALL, SEQUENCE_TOO_SHORT}

    private final Reason reason;

    public LeemSmoothException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
