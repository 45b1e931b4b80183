package com.lbg.markets.surveillance.tail.util;

public class AttributeResolutionException extends Exception {

    public AttributeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
