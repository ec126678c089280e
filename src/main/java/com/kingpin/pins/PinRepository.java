package com.kingpin.pins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current pin snapshot and replaces it wholesale on reload.
 * <p>
 * Loading happens outside the reference; the finished snapshot is swapped in with a new version number.
 * A {@link QueryService} obtained before a reload keeps answering from the snapshot it was created with.
 */
public class PinRepository {
    private static final Logger logger = LoggerFactory.getLogger(PinRepository.class);

    private final LoadServiceInterface loadService;
    private final StringSimilarity similarity;
    private final AtomicReference<PinCollection> current = new AtomicReference<>(PinCollection.empty());

    public PinRepository(LoadServiceInterface loadService) {
        this(loadService, new GestaltSimilarity());
    }

    public PinRepository(LoadServiceInterface loadService, StringSimilarity similarity) {
        this.loadService = Objects.requireNonNull(loadService, "loadService");
        this.similarity = Objects.requireNonNull(similarity, "similarity");
    }

    /**
     * Loads the files into a fresh snapshot and publishes it.
     * @param files data files to load
     * @return the published snapshot
     */
    public PinCollection reload(List<Path> files) {
        PinCollection loaded = loadService.load(files);
        PinCollection published = current.updateAndGet(previous -> loaded.withVersion(previous.version() + 1));
        if (published.isEmpty()) {
            logger.warn("Load of {} files produced no pins; {} problems reported", files.size(), published.warnings().size());
        }
        logger.info("Published pin snapshot v{} ({} pins, {} lists)", published.version(), published.pins().size(), published.lists().size());
        return published;
    }

    /**
     * @return the current snapshot
     */
    public PinCollection snapshot() {
        return current.get();
    }

    /**
     * @return a query service bound to the current snapshot
     */
    public QueryService query() {
        return new QueryService(current.get(), similarity);
    }
}
