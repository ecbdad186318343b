package de.bsommerfeld.ttl.db;

import de.bsommerfeld.ttl.core.config.StoreConfig;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * Runs the store contract against a real SQLite file in a temporary
 * directory.
 */
class SqlCorpusStoreContractTest extends CorpusStoreContractTest {

    @TempDir
    Path tempDir;

    @Override
    protected CorpusStore createStore() {
        return new SqlCorpusStore(StoreConfig.forFile(tempDir.resolve("corpus.db")));
    }
}
