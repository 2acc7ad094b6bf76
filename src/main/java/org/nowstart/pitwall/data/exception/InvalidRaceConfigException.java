package org.nowstart.pitwall.data.exception;

import org.springframework.http.HttpStatus;

public class InvalidRaceConfigException extends StrategyEngineException {

    public InvalidRaceConfigException(String message) {
        super(HttpStatus.BAD_REQUEST, "config_error", message);
    }
}
