/**
 *  Loads stacks in a separate thread, so the interactive session is not blocked.
 *
 *  The result of a load is delivered to the listener given with the request,
 *  exactly once, and only if no other load has been submitted in the meanwhile:
 *  submitting a new load detaches the listener of the previous one. A superseded
 *  load is not interrupted; it runs to its end, but its result is discarded.
 *  The stack is delivered only when complete.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class LeemLoadCoordinator {
    static final String THREAD_NAME = "LEEM_IV_Explorer_load";
    private final LeemFrameIngestor ingestor;
    private final LeemLog log;
    private LeemLoadListener subscriber;    //null if none attached
    private Thread loadThread;              //the thread of the latest load
    private int generation;                 //counts the loads; only the latest one may deliver

    public LeemLoadCoordinator(LeemFrameIngestor ingestor, LeemLog log) {
        this.ingestor = ingestor;
        this.log = log;
    }

    /** Starts loading in a separate thread. Any previous listener is detached first,
     *  so it will receive no result of a load still running. */
    public synchronized void submit(final LeemLoadRequest request, LeemLoadListener listener) {
        if (request == null || listener == null)
            throw new IllegalArgumentException("Load request and listener required");
        if (subscriber != null && log != null)
            log.log("Previous load superseded; its result will be discarded");
        subscriber = null;
        final int thisGeneration = ++generation;
        subscriber = listener;
        loadThread = new Thread(new Runnable() {
                final public void run() {
                    runLoad(request, thisGeneration);
                }
            }, THREAD_NAME+"_"+thisGeneration);
        loadThread.setDaemon(true);
        loadThread.start();
    }

    /** Detaches the listener of the current load (if any); its result will be discarded */
    public synchronized void detach() {
        subscriber = null;
        generation++;
    }

    /** Returns whether a load is running whose result will be delivered */
    public synchronized boolean isLoading() {
        return subscriber != null;
    }

    /** Waits until the thread of the latest load has finished, at most 'timeoutMillis' (0 for no limit).
     *  Returns whether it has finished. */
    public boolean waitForLoad(long timeoutMillis) throws InterruptedException {
        Thread thread;
        synchronized(this) {
            thread = loadThread;
        }
        if (thread == null) return true;
        thread.join(timeoutMillis);
        return !thread.isAlive();
    }

    /** Runs in the loading thread */
    void runLoad(LeemLoadRequest request, int thisGeneration) {
        LeemStack stack = null;
        Exception error = null;
        try {
            stack = ingestor.load(request);
        } catch (Exception e) {
            error = e;
        }
        synchronized(this) {
            if (thisGeneration != generation || subscriber == null) {
                if (log != null)
                    log.log("Discarded result of superseded load: "+request.getDirectory());
                return;
            }
            LeemLoadListener listener = subscriber;
            subscriber = null;      //deliver only once
            if (error == null)
                listener.stackReady(stack);
            else
                listener.loadFailed(request, error);
        }
    }
}
