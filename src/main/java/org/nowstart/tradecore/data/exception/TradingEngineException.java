package org.nowstart.tradecore.data.exception;

import lombok.Getter;

@Getter
public class TradingEngineException extends RuntimeException {

    private final String code;

    public TradingEngineException(String code, String message) {
        super(message);
        this.code = code;
    }

}
