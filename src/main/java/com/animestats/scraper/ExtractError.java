package com.animestats.scraper;

/**
 * Extraction failure. {@link Kind#MISSING_IDENTITY} drops the whole record;
 * {@link Kind#MALFORMED_FIELD} is only ever reported for diagnostics since the
 * affected field degrades to null and the record continues.
 *
 * @param kind    failure category
 * @param field   logical field name involved
 * @param message human readable detail
 */
public record ExtractError(Kind kind, String field, String message) {

    public enum Kind { MISSING_IDENTITY, MALFORMED_FIELD }

    public static ExtractError missingIdentity(String message) {
        return new ExtractError(Kind.MISSING_IDENTITY, "id", message);
    }

    public static ExtractError malformedField(String field, String message) {
        return new ExtractError(Kind.MALFORMED_FIELD, field, message);
    }
}
