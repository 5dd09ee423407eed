package com.regesh.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.regesh.inference.HttpClassifier;
import com.regesh.pipeline.PipelineSetupException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.io.InputStream;

/**
 * Top-level pipeline configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * from {@code application.yaml} under the {@code regesh.*} prefix.  Outside a Spring
 * context {@link #loadFromClasspath(String)} reads the same layout from a YAML resource.</p>
 *
 * <p>The configuration is built once at process start and handed to each component's
 * constructor; nothing reads it through a global.</p>
 */
@Data
@ConfigurationProperties(prefix = "regesh")
public class PipelineConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String HTTP_CLASSIFIER = HttpClassifier.class.getName();

    private InputConfig input = new InputConfig();
    private InferenceConfig inference = new InferenceConfig();
    private TableConfig table = new TableConfig();
    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, PipelineConfig.class);
        }
    }

    // ── Validation ───────────────────────────────────────────────────────

    /**
     * Checks the values a run cannot start without.
     *
     * @throws PipelineSetupException at stage {@code configuration} for the first problem found
     */
    public void validate() {
        if (isBlank(table.getStorageAccount())) {
            throw invalid("storage account is required (--storage-account)");
        }
        if (isBlank(table.getTableName())) {
            throw invalid("table name must not be blank (--table-name)");
        }
        if (inference.getBatchSize() < 1) {
            throw invalid("batch size must be positive, got " + inference.getBatchSize());
        }
        if (HTTP_CLASSIFIER.equals(inference.getClassName()) && isBlank(inference.getApiUrl())) {
            throw invalid("inference API URL is required for " + HTTP_CLASSIFIER + " (INFERENCE_API_URL)");
        }
        if (inference.getParallelism() < 1) {
            throw invalid("inference parallelism must be positive, got " + inference.getParallelism());
        }
        if (inference.getModelMaxLength() <= inference.getReservedTokens()) {
            throw invalid("model max length (" + inference.getModelMaxLength()
                    + ") must exceed reserved tokens (" + inference.getReservedTokens() + ")");
        }
        if (table.getInsertParallelism() < 1) {
            throw invalid("insert parallelism must be positive, got " + table.getInsertParallelism());
        }
        if (table.getMaxFieldLength() < 1) {
            throw invalid("max field length must be positive, got " + table.getMaxFieldLength());
        }
        if (table.getBackend() == StoreBackend.ELASTICSEARCH
                && (elasticsearch.getHosts() == null || elasticsearch.getHosts().isEmpty())) {
            throw invalid("at least one Elasticsearch host is required for the ELASTICSEARCH backend");
        }
        if (table.getBackend() == StoreBackend.ELASTICSEARCH && elasticsearch.getScanBatchSize() < 1) {
            throw invalid("scan batch size must be positive, got " + elasticsearch.getScanBatchSize());
        }
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public String getModelName() {
        return inference.getModelName();
    }

    public int getBatchSize() {
        return inference.getBatchSize();
    }

    public String getTextField() {
        return input.getTextField();
    }

    public String getTableName() {
        return table.getTableName();
    }

    public String getStorageAccount() {
        return table.getStorageAccount();
    }

    private static PipelineSetupException invalid(String message) {
        return new PipelineSetupException(PipelineSetupException.STAGE_CONFIGURATION, message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
