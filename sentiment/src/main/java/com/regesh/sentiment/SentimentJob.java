package com.regesh.sentiment;

import com.regesh.pipeline.PipelineOrchestrator;
import com.regesh.pipeline.PipelineReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the sentiment classification job.
 *
 * <p>Usage:
 * <pre>
 *   java -jar regesh-sentiment.jar --storage-account=myaccount [--input-data=sentiment_data.json]
 *       [--table-name=SentimentResults] [--container-name=data] [--model-name=...]
 *       [--batch-size=16] [--text-field=text]
 * </pre>
 *
 * <p>Defaults come from {@code application.yaml}.  A setup failure propagates out of
 * {@link #run} and the process exits non-zero; a run with failed batches or inserts still
 * completes and prints its summary.</p>
 */
@Slf4j
@SpringBootApplication(scanBasePackages = "com.regesh")
public class SentimentJob implements ApplicationRunner {

    private final PipelineOrchestrator orchestrator;
    private final SummaryReportFormatter formatter = new SummaryReportFormatter();

    public SentimentJob(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Starting sentiment analysis pipeline");

        PipelineReport report = orchestrator.run();
        formatter.format(report).forEach(log::info);

        if (report.isFullySuccessful()) {
            log.info("Pipeline completed successfully. Results stored in table: {}", report.getTableName());
        } else {
            log.warn("Pipeline completed with {} classification errors and {} failed inserts. Results stored in table: {}",
                    report.getClassificationErrors(), report.getFailed(), report.getTableName());
        }
    }

    public static void main(String[] args) {
        SpringApplication.run(SentimentJob.class, args);
    }
}
