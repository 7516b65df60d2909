package com.animestats.scraper;

/**
 * Unrecoverable configuration problem detected before any network activity.
 * The only error in the collector that terminates the process.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
