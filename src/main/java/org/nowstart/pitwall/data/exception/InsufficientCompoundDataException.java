package org.nowstart.pitwall.data.exception;

import org.springframework.http.HttpStatus;

public class InsufficientCompoundDataException extends StrategyEngineException {

    public InsufficientCompoundDataException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_compound_data", message);
    }
}
