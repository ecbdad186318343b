package de.bsommerfeld.ttl.db;

import com.google.common.collect.Iterables;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.ttl.core.config.StoreConfig;
import de.bsommerfeld.ttl.core.domain.SentenceDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Streams a large sequence of sentence drafts into a document, committing
 * every {@code import-batch-size} sentences as one
 * {@link CorpusStore#saveSentences} call.
 *
 * <p>
 * Each chunk is atomic on its own. A failing chunk aborts the import and its
 * exception propagates; chunks committed before it stay in the store.
 * Callers that need all-or-nothing across the whole input call
 * {@link CorpusStore#saveSentences} directly.
 */
@Singleton
public class ChunkedImporter {

    private static final Logger LOG = LoggerFactory.getLogger(ChunkedImporter.class);

    private final CorpusStore store;
    private final int batchSize;

    @Inject
    public ChunkedImporter(CorpusStore store, StoreConfig config) {
        this(store, config.getImportBatchSize());
    }

    ChunkedImporter(CorpusStore store, int batchSize) {
        checkArgument(batchSize > 0, "import batch size must be positive: %s", batchSize);
        this.store = store;
        this.batchSize = batchSize;
    }

    public ImportSummary importSentences(long docId, Iterable<SentenceDraft> drafts) {
        int sentences = 0;
        int chunks = 0;
        for (List<SentenceDraft> chunk : Iterables.partition(drafts, batchSize)) {
            store.saveSentences(docId, chunk);
            sentences += chunk.size();
            chunks++;
            LOG.debug("[DB] Committed chunk {} ({} sentences so far)", chunks, sentences);
        }
        LOG.info("[DB] Imported {} sentences in {} chunks.", sentences, chunks);
        return new ImportSummary(sentences, chunks);
    }

    /**
     * @param sentences sentences committed
     * @param chunks    transactions used
     */
    public record ImportSummary(int sentences, int chunks) {
    }
}
