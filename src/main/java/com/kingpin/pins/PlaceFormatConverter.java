package com.kingpin.pins;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One supported place export shape.
 * <p>
 * {@link #accepts(JsonNode)} performs the full structural validation of a document without throwing;
 * {@link #convert(JsonNode, String)} is only called on documents it accepted.
 */
public interface PlaceFormatConverter {
    /**
     * @return short name of the format, used in log messages
     */
    String formatName();

    /**
     * Checks whether the document has this format's shape, including the types of every field the converter reads.
     * @param root parsed JSON document
     * @return true if {@link #convert(JsonNode, String)} can handle the document
     */
    boolean accepts(JsonNode root);

    /**
     * Converts an accepted document into pins.
     * @param root parsed JSON document previously accepted by {@link #accepts(JsonNode)}
     * @param listName list the pins belong to
     * @return pins in document order
     */
    List<Pin> convert(JsonNode root, String listName);
}
