package org.nowstart.pitwall.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public abstract class StrategyEngineException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected StrategyEngineException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
