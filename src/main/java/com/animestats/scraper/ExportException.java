package com.animestats.scraper;

/**
 * A persistence sink could not store a run's output.
 */
public class ExportException extends Exception {
    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
