package com.regesh.inference;

import com.regesh.model.ClassificationResult;
import com.regesh.model.LabelScore;
import com.regesh.pipeline.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchInferenceEngineTest {

    private static final TextPreprocessor PREPROCESSOR = new TextPreprocessor(512, 2);

    /** Echoes each text back as the label, so the output order can be checked. */
    private static final Classifier ECHO = texts -> texts.stream()
            .map(text -> List.of(new LabelScore(text, 1.0)))
            .collect(Collectors.toList());

    private static List<String> texts(int n) {
        return IntStream.range(0, n).mapToObj(i -> "t" + i).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("length and order")
    class LengthAndOrder {

        @Test
        void returnsOneResultPerTextInInputOrder() {
            BatchInferenceEngine engine = new BatchInferenceEngine(ECHO, PREPROCESSOR);

            for (int n : new int[]{0, 1, 5, 16, 17, 33}) {
                for (int batchSize : new int[]{1, 3, 16, 50}) {
                    List<String> input = texts(n);
                    List<ClassificationResult> results = engine.classify(input, batchSize);

                    assertThat(results).hasSize(n);
                    assertThat(results).extracting(ClassificationResult::getPredictedLabel)
                            .containsExactlyElementsOf(input);
                }
            }
        }

        @Test
        void concurrentBatchesKeepInputOrder() {
            AtomicInteger calls = new AtomicInteger();
            Classifier slowFirst = texts -> {
                // Early batches finish last
                if (calls.getAndIncrement() < 2) {
                    Thread.sleep(50);
                }
                return ECHO.classify(texts);
            };
            BatchInferenceEngine engine = new BatchInferenceEngine(slowFirst, PREPROCESSOR, 4);

            List<String> input = texts(40);
            List<ClassificationResult> results = engine.classify(input, 4);

            assertThat(results).extracting(ClassificationResult::getPredictedLabel)
                    .containsExactlyElementsOf(input);
            assertThat(calls).hasValue(10);
        }

        @Test
        void keepsOriginalTextButClassifiesPreprocessedText() {
            List<List<String>> seen = new ArrayList<>();
            Classifier recording = texts -> {
                seen.add(List.copyOf(texts));
                return ECHO.classify(texts);
            };
            BatchInferenceEngine engine = new BatchInferenceEngine(recording, PREPROCESSOR);

            List<ClassificationResult> results = engine.classify(List.of("  padded  "), 16);

            assertThat(seen).containsExactly(List.of("padded"));
            assertThat(results.get(0).getText()).isEqualTo("  padded  ");
        }
    }

    @Nested
    @DisplayName("batch failure isolation")
    @ExtendWith(MockitoExtension.class)
    class FailureIsolation {

        @Mock
        private Classifier classifier;

        @Test
        void failedBatchYieldsSentinelForEachOfItsTexts() throws Exception {
            List<LabelScore> positive = List.of(new LabelScore("positive", 0.9), new LabelScore("negative", 0.1));
            when(classifier.classify(anyList()))
                    .thenReturn(List.of(positive, positive))
                    .thenThrow(new IllegalStateException("inference timeout"))
                    .thenReturn(List.of(positive));

            BatchInferenceEngine engine = new BatchInferenceEngine(classifier, PREPROCESSOR);
            List<ClassificationResult> results = engine.classify(texts(5), 2);

            assertThat(results).hasSize(5);
            assertThat(results).extracting(ClassificationResult::getPredictedLabel)
                    .containsExactly("positive", "positive", "ERROR", "ERROR", "positive");
            assertThat(results.subList(2, 4)).allSatisfy(r -> {
                assertThat(r.getConfidence()).isZero();
                assertThat(r.getScores()).isEmpty();
                assertThat(r.getErrorMessage()).isEqualTo("inference timeout");
            });
            assertThat(results.get(2).getText()).isEqualTo("t2");
            verify(classifier, times(3)).classify(anyList());
        }

        @Test
        void responseOfWrongLengthFailsTheBatch() throws Exception {
            when(classifier.classify(anyList()))
                    .thenReturn(List.of(List.of(new LabelScore("positive", 1.0))));

            BatchInferenceEngine engine = new BatchInferenceEngine(classifier, PREPROCESSOR);
            List<ClassificationResult> results = engine.classify(texts(3), 3);

            assertThat(results).hasSize(3).allMatch(ClassificationResult::isError);
        }

        @Test
        void emptyScoreListFailsTheBatch() throws Exception {
            when(classifier.classify(anyList())).thenReturn(List.of(List.of()));

            BatchInferenceEngine engine = new BatchInferenceEngine(classifier, PREPROCESSOR);

            assertThat(engine.classify(texts(1), 1)).singleElement()
                    .satisfies(r -> assertThat(r.isError()).isTrue());
        }

        @Test
        void cancelledRunSkipsRemainingBatches() throws Exception {
            CancellationToken token = new CancellationToken();
            when(classifier.classify(anyList())).thenAnswer(invocation -> {
                token.cancel();
                return ECHO.classify(invocation.getArgument(0));
            });

            BatchInferenceEngine engine = new BatchInferenceEngine(classifier, PREPROCESSOR);
            List<ClassificationResult> results = engine.classify(texts(6), 2, token);

            assertThat(results).hasSize(6);
            assertThat(results.subList(0, 2)).noneMatch(ClassificationResult::isError);
            assertThat(results.subList(2, 6)).allSatisfy(r ->
                    assertThat(r.getErrorMessage()).isEqualTo(CancellationToken.CANCELLED_MESSAGE));
            verify(classifier, times(1)).classify(anyList());
        }

        @Test
        void emptyInputNeverCallsClassifier() throws Exception {
            BatchInferenceEngine engine = new BatchInferenceEngine(classifier, PREPROCESSOR);

            assertThat(engine.classify(List.of(), 16)).isEmpty();
            verify(classifier, never()).classify(anyList());
        }
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        BatchInferenceEngine engine = new BatchInferenceEngine(ECHO, PREPROCESSOR);

        assertThatThrownBy(() -> engine.classify(texts(3), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveParallelism() {
        assertThatThrownBy(() -> new BatchInferenceEngine(ECHO, PREPROCESSOR, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
