package com.kingpin.pins;

/**
 * Thrown when a JSON document matches none of the supported place export formats.
 */
public class UnrecognizedFormatException extends Exception {
    public UnrecognizedFormatException(String message) {
        super(message);
    }
}
