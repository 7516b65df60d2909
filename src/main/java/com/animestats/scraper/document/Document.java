package com.animestats.scraper.document;

/**
 * A parsed page. Implemented by an adapter per markup library and page version.
 */
public interface Document extends Node {
    /**
     * @return the URL the document was loaded from
     */
    String location();
}
