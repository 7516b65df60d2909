package com.animestats.scraper.document;

import java.util.List;
import java.util.Optional;

/**
 * A selectable element of a parsed page.
 */
public interface Node {
    /**
     * Whitespace-normalized text of this element and its descendants.
     * @return text, empty when there is none
     */
    String text();

    /**
     * Text directly owned by this element, excluding children.
     * @return own text, empty when there is none
     */
    String ownText();

    /**
     * @param name attribute name
     * @return attribute value, empty when absent
     */
    String attr(String name);

    /**
     * @param name attribute holding a possibly relative URL
     * @return absolute URL resolved against the page location, empty when absent
     */
    String absUrl(String name);

    /**
     * Descendants matching the field, in document order.
     * @param field logical element
     * @return matches, empty when none
     */
    List<Node> select(Field field);

    /**
     * @param field logical element
     * @return the first descendant matching the field
     */
    Optional<Node> selectFirst(Field field);
}
