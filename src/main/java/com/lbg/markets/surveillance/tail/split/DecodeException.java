package com.lbg.markets.surveillance.tail.split;

/**
 * A record's bytes could not be decoded with the configured encoding.
 */
public class DecodeException extends Exception {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
