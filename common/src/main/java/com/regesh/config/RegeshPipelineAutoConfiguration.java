package com.regesh.config;

import com.regesh.inference.Classifier;
import com.regesh.inference.ClassifierFactory;
import com.regesh.pipeline.PipelineOrchestrator;
import com.regesh.source.LocalBlobRecordSource;
import com.regesh.source.RecordSource;
import com.regesh.table.TableStore;
import com.regesh.table.TableStoreFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring configuration that wires the pipeline beans.
 *
 * <p>Discovered via component-scanning from the job's {@code @SpringBootApplication}
 * (which scans {@code com.regesh.*}).  The configuration is validated before the classifier
 * or the table store is created, so a missing setting fails the context instead of a
 * half-started run.</p>
 */
@Configuration
@EnableConfigurationProperties(PipelineConfig.class)
public class RegeshPipelineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordSource recordSource(PipelineConfig config) {
        return new LocalBlobRecordSource(Path.of(config.getInput().getBlobRoot()));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Classifier classifier(PipelineConfig config) {
        config.validate();
        return ClassifierFactory.create(config.getInference());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public TableStore tableStore(PipelineConfig config) {
        config.validate();
        return TableStoreFactory.create(config);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineConfig config,
                                                     RecordSource recordSource,
                                                     Classifier classifier,
                                                     TableStore tableStore,
                                                     Clock clock) {
        return new PipelineOrchestrator(config, recordSource, classifier, tableStore, clock);
    }
}
