package edu.cmu.cs.lti.arcstandard.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import edu.cmu.cs.lti.arcstandard.datastructs.Arc;
import edu.cmu.cs.lti.arcstandard.datastructs.Sentence;

/**
 * Splits the sentences into contiguous chunks and runs an independent {@link MinibatchParser}
 * loop on each chunk in its own thread. The model is shared by all workers, so its
 * {@code predict} must be safe to call concurrently; wrap it in a {@link SynchronizedParserModel}
 * otherwise.
 */
public class ParallelMinibatchParser {

    private static final Logger log = Logger.getLogger(ParallelMinibatchParser.class);

    private final int numThreads;

    public ParallelMinibatchParser(int numThreads) {
        Preconditions.checkArgument(numThreads > 0, "need at least one thread, got %s", numThreads);
        this.numThreads = numThreads;
    }

    public List<List<Arc>> parse(List<Sentence> sentences, final ParserModel model,
            final int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batch size must be positive, got %s", batchSize);
        if (sentences.isEmpty()) {
            return new ArrayList<List<Arc>>();
        }
        int chunkSize = (sentences.size() + numThreads - 1) / numThreads;
        List<List<Sentence>> chunks = Lists.partition(sentences, chunkSize);
        log.info("Parsing " + sentences.size() + " sentences in " + chunks.size()
                + " chunks of at most " + chunkSize);

        final Collection<Callable<List<List<Arc>>>> tasks = new ArrayList<>();
        for (final List<Sentence> chunk : chunks) {
            tasks.add(new Callable<List<List<Arc>>>() {
                @Override
                public List<List<Arc>> call() throws Exception {
                    return MinibatchParser.minibatchParse(chunk, model, batchSize);
                }
            });
        }

        final ExecutorService executor = Executors.newFixedThreadPool(chunks.size());
        try {
            List<List<Arc>> arcs = new ArrayList<>(sentences.size());
            for (final Future<List<List<Arc>>> result : executor.invokeAll(tasks)) {
                arcs.addAll(result.get());
            }
            return arcs;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while parsing", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Parsing worker failed", e.getCause());
        } finally {
            executor.shutdown();
        }
    }
}
