package org.nowstart.pitwall.data.exception;

import org.springframework.http.HttpStatus;

public class NoLegalStrategyException extends StrategyEngineException {

    public NoLegalStrategyException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "no_legal_strategy", message);
    }
}
