package com.kingpin.pins;

import java.nio.file.Path;
import java.util.List;

/**
 * Interface for loading export files into a pin snapshot.
 */
public interface LoadServiceInterface {
    /**
     * Loads the given files in order. A failing file is reported as a warning and never aborts the load.
     * @param files data files to read
     * @return snapshot with all pins, one list per file and the collected warnings
     */
    PinCollection load(List<Path> files);
}
