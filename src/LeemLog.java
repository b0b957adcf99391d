/**
 *  Sink for the messages of a LEEM I(V) session.
 *  Components receive the sink of their session; there is no global log.
 */

/** This code is part of the LEEM I(V) Explorer package for LEEM and LEED I(V) analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public interface LeemLog {
    /** Reports progress or other information */
    void log(String text);

    /** Reports a failure of a request that was skipped */
    void error(String text);

    /** Returns the lines logged so far in this session, for the log file of an export */
    String[] getLogLines();
}
