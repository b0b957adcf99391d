/**
 *  Receives the result of loading a stack in the background.
 *  Exactly one of the two methods is called per load, and only if the listener
 *  is still attached when the load finishes. The calls come from the loading
 *  thread; implementations must not wait for other threads using the coordinator.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public interface LeemLoadListener {
    /** The stack was read completely */
    void stackReady(LeemStack stack);

    /** Loading failed; 'error' is usually a LeemIngestException */
    void loadFailed(LeemLoadRequest request, Exception error);
}
