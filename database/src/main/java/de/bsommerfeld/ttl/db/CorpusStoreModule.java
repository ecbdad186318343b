package de.bsommerfeld.ttl.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.ttl.core.config.StoreConfig;
import de.bsommerfeld.ttl.core.config.StoreMode;
import de.bsommerfeld.ttl.core.util.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Guice module wiring the corpus store.
 */
public class CorpusStoreModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CorpusStoreModule.class);

    private final Path configFile;
    private final StoreMode mode;

    /**
     * Uses {@code store.json} in the platform data directory and the mode
     * from {@link StoreMode#get()}.
     */
    public CorpusStoreModule() {
        this(StoragePaths.defaultConfigFile(), StoreMode.get());
    }

    public CorpusStoreModule(Path configFile, StoreMode mode) {
        this.configFile = configFile;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        StoreConfig config;
        try {
            config = StoreConfig.load(configFile);
        } catch (IOException e) {
            // Config is vital, fail fast
            throw new RuntimeException("Failed to load store configuration from " + configFile, e);
        }
        bind(StoreConfig.class).toInstance(config);

        LOG.info("Store mode initialized: {}", mode);
        if (mode.isPersistent()) {
            bind(CorpusStore.class).to(SqlCorpusStore.class);
        } else {
            bind(CorpusStore.class).to(InMemoryCorpusStore.class);
        }
    }
}
