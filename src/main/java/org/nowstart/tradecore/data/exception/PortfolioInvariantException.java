package org.nowstart.tradecore.data.exception;

/**
 * Raised when a ledger update leaves the portfolio in an impossible state. Always a programming error.
 */
public class PortfolioInvariantException extends TradingEngineException {

    public static final String CODE = "portfolio_invariant";

    public PortfolioInvariantException(String message) {
        super(CODE, message);
    }
}
