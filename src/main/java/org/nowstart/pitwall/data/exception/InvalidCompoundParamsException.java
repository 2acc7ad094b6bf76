package org.nowstart.pitwall.data.exception;

import org.springframework.http.HttpStatus;

public class InvalidCompoundParamsException extends StrategyEngineException {

    public InvalidCompoundParamsException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_compound_params", message);
    }
}
