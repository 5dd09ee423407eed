package com.regesh.table;

import com.regesh.model.PersistSummary;
import com.regesh.model.TableEntity;
import com.regesh.pipeline.CancellationToken;
import com.regesh.pipeline.PipelineSetupException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TablePersisterTest {

    @Mock
    private TableStore store;

    private static TableEntity entity(int index) {
        return TableEntity.builder()
                .partitionKey("2025-06-02")
                .rowKey(String.format("%06d_abcdef01", index))
                .predictedSentiment("positive")
                .build();
    }

    private static List<TableEntity> entities(int n) {
        return IntStream.range(0, n).mapToObj(TablePersisterTest::entity).collect(Collectors.toList());
    }

    @Test
    void failedInsertIsCountedAndLaterInsertsStillRun() throws Exception {
        doAnswer(invocation -> {
            TableEntity entity = invocation.getArgument(0);
            if (entity.getRowKey().startsWith("000001_")) {
                throw new IOException("throttled");
            }
            return null;
        }).when(store).insert(any());

        PersistSummary summary = new TablePersister(store).persist(entities(3));

        assertThat(summary.getInserted()).isEqualTo(2);
        assertThat(summary.getFailed()).isEqualTo(1);
        verify(store, times(3)).insert(any());
    }

    @Test
    void emptyInputTouchesNothing() throws Exception {
        PersistSummary summary = new TablePersister(store).persist(List.of());

        assertThat(summary).isEqualTo(PersistSummary.EMPTY);
        verify(store, never()).ensureTable();
        verify(store, never()).insert(any());
    }

    @Test
    void persistDoesNotCreateTheTableAgain() throws Exception {
        TablePersister persister = new TablePersister(store);
        persister.prepareTable();

        PersistSummary summary = persister.persist(entities(2));

        assertThat(summary.getInserted()).isEqualTo(2);
        verify(store, times(1)).ensureTable();
    }

    @Test
    void tableLostAfterSetupIsCountedNotThrown() throws Exception {
        doThrow(new IOException("table not found")).when(store).insert(any());

        PersistSummary summary = new TablePersister(store).persist(entities(3));

        assertThat(summary.getInserted()).isZero();
        assertThat(summary.getFailed()).isEqualTo(3);
        verify(store, never()).ensureTable();
    }

    @Test
    void tableCreationFailureIsFatalAndNothingIsInserted() throws Exception {
        when(store.getTableName()).thenReturn("SentimentResults");
        doThrow(new IOException("authentication failed")).when(store).ensureTable();

        assertThatThrownBy(() -> new TablePersister(store).prepareTable())
                .isInstanceOf(PipelineSetupException.class)
                .hasMessageContaining("authentication failed")
                .satisfies(e -> assertThat(((PipelineSetupException) e).getStage())
                        .isEqualTo(PipelineSetupException.STAGE_TABLE));
        verify(store, never()).insert(any());
    }

    @Test
    void cancelledRunCountsRemainingInsertsAsFailed() throws Exception {
        CancellationToken token = new CancellationToken();

        TablePersister persister = new TablePersister(store);
        token.cancel();
        PersistSummary summary = persister.persist(entities(4), token);

        assertThat(summary.getInserted()).isZero();
        assertThat(summary.getFailed()).isEqualTo(4);
        verify(store, never()).insert(any());
    }

    @Test
    void concurrentInsertsKeepExactCounts() {
        InMemoryTableStore memory = new InMemoryTableStore("SentimentResults");
        memory.ensureTable();
        List<TableEntity> batch = entities(200);
        // Duplicate keys fail on insert
        batch.add(entity(3));
        batch.add(entity(7));

        PersistSummary summary = new TablePersister(memory, 8).persist(batch);

        assertThat(summary.getInserted()).isEqualTo(200);
        assertThat(summary.getFailed()).isEqualTo(2);
        assertThat(summary.getTotal()).isEqualTo(202);
        assertThat(memory.size()).isEqualTo(200);
    }
}
