package com.lbg.markets.surveillance.tail.domain;

/**
 * Invalid input, splitter or encoding configuration. Fatal at startup, never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
