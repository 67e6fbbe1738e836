package io.github.samzhu.keygate.exception;

/**
 * 請求內容未通過 Bean Validation
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
