/**
 *  Thrown when an integration window does not fit into the image.
 *  Windows are rejected, never clipped.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemWindowException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;
    private final int row, col, halfWidth;

    public LeemWindowException(int row, int col, int halfWidth, int height, int width) {
        super("Integration window at (row="+row+", col="+col+") with half-width "+halfWidth+
                " exceeds the image of "+width+"x"+height+" pixels");
        this.row = row;
        this.col = col;
        this.halfWidth = halfWidth;
    }

    public int getRow() {return row;}
    public int getCol() {return col;}
    public int getHalfWidth() {return halfWidth;}
}
