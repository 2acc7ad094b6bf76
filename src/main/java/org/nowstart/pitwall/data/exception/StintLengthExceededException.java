package org.nowstart.pitwall.data.exception;

import org.springframework.http.HttpStatus;

public class StintLengthExceededException extends StrategyEngineException {

    public StintLengthExceededException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "stint_length_exceeded", message);
    }
}
