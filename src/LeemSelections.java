import java.awt.Color;
import java.util.ArrayList;
import java.util.List;


/**
 *  The pixels (LEEM) or integration windows (LEED) selected by the user, in the
 *  sequence of selection. Each selection gets the next color of the palette.
 *  When there are more selections than colors, all previous selections are
 *  removed (and the listeners are told to remove their markers) and numbering
 *  starts again with the first color.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemSelections {
    /** Value of 'halfWidth' for selections of a single pixel */
    public static final int NO_WINDOW = -1;

    /** Colors for the curves and markers of the selections */
    public static final Color[] PALETTE = new Color[] {
            new Color(0.4f, 0.76078f, 0.64705f),
            new Color(0.98823f, 0.55294f, 0.38431f),
            new Color(0.55294f, 0.62745f, 0.79607f),
            new Color(0.90588f, 0.54117f, 0.76470f),
            new Color(0.65098f, 0.84705f, 0.32941f),
            new Color(1.0f, 0.85098f, 0.18431f),
            new Color(0.89804f, 0.76862f, 0.58039f),
            new Color(0.70196f, 0.70196f, 0.70196f),
            new Color(0.4f, 0.76078f, 0.64705f),
            new Color(0.98823f, 0.55294f, 0.38431f)
    };

    /** One selected pixel or window */
    public static class Selection {
        private final int row, col, halfWidth, colorIndex;

        Selection(int row, int col, int halfWidth, int colorIndex) {
            this.row = row;
            this.col = col;
            this.halfWidth = halfWidth;
            this.colorIndex = colorIndex;
        }

        public int getRow() {return row;}
        public int getCol() {return col;}
        /** Half-width of the integration window, or NO_WINDOW for a single pixel */
        public int getHalfWidth() {return halfWidth;}
        public boolean isWindow() {return halfWidth != NO_WINDOW;}
        public int getColorIndex() {return colorIndex;}
        public Color getColor() {return PALETTE[colorIndex];}

        public String toString() {
            return "(row="+row+", col="+col+(isWindow() ? ", halfwidth="+halfWidth : "")+") color #"+colorIndex;
        }
    }

    /** Notified when all selections are removed, so that the markers can be removed */
    public interface Listener {
        void selectionsCleared();
    }

    private final ArrayList<Selection> selections = new ArrayList<Selection>();
    private final ArrayList<Listener> listeners = new ArrayList<Listener>();
    private int nClicks;

    public synchronized void addListener(Listener listener) {
        listeners.add(listener);
    }

    public synchronized void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    /** Adds a single-pixel selection; see add(LeemStack, int, int, int) */
    public Selection add(LeemStack stack, int row, int col) {
        return add(stack, row, col, NO_WINDOW);
    }

    /** Adds a selection and returns it. If the palette is used up, clears all previous selections first.
     *  @throws IllegalArgumentException if the pixel is outside the stack
     *  @throws LeemWindowException if the window does not fit into the stack */
    public Selection add(LeemStack stack, int row, int col, int halfWidth) {
        if (!stack.contains(row, col))
            throw new IllegalArgumentException("Selection (row="+row+", col="+col+") outside of "+
                    stack.getWidth()+"x"+stack.getHeight()+" image");
        if (halfWidth != NO_WINDOW)
            LeemIntegrator.checkWindow(stack.getHeight(), stack.getWidth(), row, col, halfWidth);
        boolean cleared = false;
        Selection selection;
        synchronized(this) {
            nClicks++;
            if (nClicks > PALETTE.length) {
                nClicks = 1;
                selections.clear();
                cleared = true;
            }
            selection = new Selection(row, col, halfWidth, nClicks - 1);
            selections.add(selection);
        }
        if (cleared)
            notifyCleared();
        return selection;
    }

    /** Removes all selections and restarts with the first color */
    public void clear() {
        synchronized(this) {
            selections.clear();
            nClicks = 0;
        }
        notifyCleared();
    }

    /** Returns the selections in the sequence they were added */
    public synchronized List<Selection> getSelections() {
        return new ArrayList<Selection>(selections);
    }

    public synchronized int size() {
        return selections.size();
    }

    public synchronized boolean isEmpty() {
        return selections.isEmpty();
    }

    private void notifyCleared() {
        Listener[] toNotify;
        synchronized(this) {
            toNotify = listeners.toArray(new Listener[0]);
        }
        for (Listener listener : toNotify)
            listener.selectionsCleared();
    }
}
