package com.kingpin.pins;

import java.util.List;
import java.util.Optional;

/**
 * Interface for the Postgres pin store.
 */
public interface PostgresServiceInterface {
    /**
     * Creates the pins table if it doesn't already exist.
     */
    void createTables();

    /**
     * Inserts pins, skipping pins whose url is already stored.
     * @param pins pins to insert
     * @return number of rows inserted, or -1 if the insert failed
     */
    int insertPins(List<Pin> pins);

    /**
     * @param url pin url
     * @return true if a pin with this url is stored
     */
    boolean exists(String url);

    /**
     * Finds the first pin whose name starts with the given prefix.
     * @param namePrefix name or beginning of a name
     * @return the pin, or empty if none matches
     */
    Optional<Pin> findByName(String namePrefix);

    /**
     * @param listPrefix list name prefix, or null for all pins
     * @return matching pins in insertion order
     */
    List<Pin> findByList(String listPrefix);

    /**
     * @return distinct list names of stored pins
     */
    List<String> listNames();

    /**
     * Deletes pins by exact name.
     * @param name pin name
     * @return number of rows deleted, or -1 on failure
     */
    int deleteByName(String name);
}
