package org.nowstart.tradecore.data.type;

import java.util.Locale;

/**
 * Why an open position was closed by the stop-loss layer.
 */
public enum ExitReason {
    STOP_LOSS,
    TRAILING_STOP;

    /**
     * Returns the hyphenated label used in trade audit output, for example {@code stop-loss}.
     *
     * @return lower-case label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
