package com.regesh.table;

import com.regesh.model.InsertOutcome;
import com.regesh.model.PersistSummary;
import com.regesh.model.TableEntity;
import com.regesh.pipeline.CancellationToken;
import com.regesh.pipeline.PipelineSetupException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes entities to a table one insert at a time.
 *
 * <p>A failed insert is logged with its row key, counted, and does not stop the inserts
 * after it.  There is no batching, no transaction and no retry: a run in which some
 * inserts failed is a partial success, reported through the {@link PersistSummary}.</p>
 *
 * <p>The table is created once, by {@link #prepareTable()} during setup; {@link #persist}
 * assumes it exists and reports a missing table as failed inserts.</p>
 *
 * <p>With {@code parallelism > 1} inserts run on a fixed worker pool; the counters are
 * atomic so the summary is exact in every mode.</p>
 */
@Slf4j
public class TablePersister {

    private final TableStore store;
    private final int parallelism;

    public TablePersister(TableStore store, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        }
        this.store = store;
        this.parallelism = parallelism;
    }

    public TablePersister(TableStore store) {
        this(store, 1);
    }

    /**
     * Creates the backing table if it is absent.
     *
     * @throws PipelineSetupException if the table cannot be created or the store is unreachable
     */
    public void prepareTable() {
        try {
            store.ensureTable();
        } catch (Exception e) {
            log.error("Failed to create table {}: {}", store.getTableName(), e.getMessage());
            throw new PipelineSetupException(PipelineSetupException.STAGE_TABLE,
                    "Failed to create table " + store.getTableName(), e);
        }
    }

    /**
     * Inserts every entity, running to completion.
     */
    public PersistSummary persist(List<TableEntity> entities) {
        return persist(entities, CancellationToken.NONE);
    }

    /**
     * Inserts every entity.  Inserts not yet started when {@code cancellation} fires are
     * counted as failed.
     *
     * @return counts with {@code inserted + failed == entities.size()}
     */
    public PersistSummary persist(List<TableEntity> entities, CancellationToken cancellation) {
        log.info("Inserting {} entities into table: {}", entities.size(), store.getTableName());

        AtomicInteger inserted = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        if (parallelism == 1 || entities.size() <= 1) {
            for (TableEntity entity : entities) {
                count(insert(entity, cancellation), inserted, failed);
            }
        } else {
            insertConcurrently(entities, cancellation, inserted, failed);
        }

        PersistSummary summary = new PersistSummary(inserted.get(), failed.get());
        log.info("Table insertion complete: successful={}, failed={}",
                summary.getInserted(), summary.getFailed());
        if (summary.getFailed() > 0) {
            log.warn("{} records failed to insert", summary.getFailed());
        }
        return summary;
    }

    private void insertConcurrently(List<TableEntity> entities, CancellationToken cancellation,
                                    AtomicInteger inserted, AtomicInteger failed) {
        int workers = Math.min(parallelism, entities.size());
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "regesh-insert-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        // Cancelled when the calling thread is interrupted; pending inserts then fail fast
        CancellationToken stop = new CancellationToken();
        boolean interrupted = false;
        try {
            List<Future<?>> futures = new ArrayList<>(entities.size());
            for (TableEntity entity : entities) {
                futures.add(pool.submit(() ->
                        count(insert(entity, cancellation.isCancelled() || stop.isCancelled()),
                                inserted, failed)));
            }
            for (Future<?> future : futures) {
                while (true) {
                    try {
                        future.get();
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                        stop.cancel();
                    } catch (ExecutionException e) {
                        throw new IllegalStateException("Insert worker aborted", e.getCause());
                    }
                }
            }
        } finally {
            pool.shutdown();
            if (interrupted) {
                log.warn("Interrupted while inserting; inserts not yet started were counted as failed");
                Thread.currentThread().interrupt();
            }
        }
    }

    private InsertOutcome insert(TableEntity entity, CancellationToken cancellation) {
        return insert(entity, cancellation.isCancelled());
    }

    private InsertOutcome insert(TableEntity entity, boolean cancelled) {
        String rowKey = entity.getRowKey();
        if (cancelled) {
            return InsertOutcome.failed(rowKey, CancellationToken.CANCELLED_MESSAGE);
        }
        try {
            store.insert(entity);
            return InsertOutcome.inserted(rowKey);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Failed to insert record {}: {}", rowKey, e.getMessage());
            return InsertOutcome.failed(rowKey, e.getMessage());
        }
    }

    private static void count(InsertOutcome outcome, AtomicInteger inserted, AtomicInteger failed) {
        if (outcome.isSuccess()) {
            inserted.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
    }
}
