package com.regesh.table;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.regesh.config.ElasticsearchConfig;
import com.regesh.model.TableEntity;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Table store backed by an Elasticsearch index.
 *
 * <p>A table {@code (storageAccount, tableName)} lives in the index
 * {@code <storageaccount>-<tablename>} (lower-cased).  Each entity is one document whose
 * id is {@code PartitionKey|RowKey}; inserts use the {@code create} operation, so writing
 * an id that already exists fails instead of overwriting.</p>
 *
 * <p>Responsible for:
 * <ul>
 *   <li>Creating the index with an explicit mapping when it does not exist yet</li>
 *   <li>Inserting single entities</li>
 *   <li>Scanning the whole index with {@code search_after}, sorted by partition then row key</li>
 * </ul>
 */
@Slf4j
public class ElasticsearchTableStore implements TableStore {

    private static final String ALREADY_EXISTS = "resource_already_exists_exception";

    private final ElasticsearchClient client;
    private final RestClient restClient;
    private final String tableName;
    private final String index;
    private final int scanBatchSize;

    public ElasticsearchTableStore(ElasticsearchConfig config, String storageAccount, String tableName) {
        HttpHost[] hosts = config.getHosts().stream()
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
            builder.setHttpClientConfigCallback(hcb ->
                    hcb.setDefaultCredentialsProvider(credentialsProvider));
        }

        this.restClient = builder.build();
        RestClientTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper());
        this.client = new ElasticsearchClient(transport);
        this.tableName = tableName;
        this.index = indexName(storageAccount, tableName);
        this.scanBatchSize = config.getScanBatchSize();

        log.info("Table store: account={} table={} → index {} on {}",
                storageAccount, tableName, index, config.getHosts());
    }

    ElasticsearchTableStore(ElasticsearchClient client, String index, String tableName, int scanBatchSize) {
        this.client = client;
        this.restClient = null;
        this.tableName = tableName;
        this.index = index;
        this.scanBatchSize = scanBatchSize;
    }

    /**
     * Index that holds the given table.
     */
    public static String indexName(String storageAccount, String tableName) {
        return (storageAccount + "-" + tableName).toLowerCase(Locale.ROOT);
    }

    /**
     * Document id of an entity: unique as long as the row key is unique within its partition.
     */
    public static String documentId(TableEntity entity) {
        return entity.getPartitionKey() + "|" + entity.getRowKey();
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    public String getIndex() {
        return index;
    }

    @Override
    public void ensureTable() throws IOException {
        try {
            client.indices().create(c -> c
                    .index(index)
                    .mappings(m -> m
                            .properties(TableEntity.PARTITION_KEY, p -> p.keyword(k -> k))
                            .properties(TableEntity.ROW_KEY, p -> p.keyword(k -> k))
                            .properties(TableEntity.ORIGINAL_ID, p -> p.keyword(k -> k))
                            .properties(TableEntity.TEXT, p -> p.text(t -> t))
                            .properties(TableEntity.CATEGORY, p -> p.keyword(k -> k))
                            .properties(TableEntity.SOURCE, p -> p.keyword(k -> k))
                            .properties(TableEntity.PREDICTED_SENTIMENT, p -> p.keyword(k -> k))
                            .properties(TableEntity.CONFIDENCE, p -> p.double_(d -> d))
                            .properties(TableEntity.ALL_SCORES_JSON, p -> p.text(t -> t.index(false)))
                            .properties(TableEntity.MODEL_USED, p -> p.keyword(k -> k))
                            .properties(TableEntity.PROCESSED_AT, p -> p.keyword(k -> k))
                            .properties(TableEntity.RECORD_ID, p -> p.integer(i -> i))
                            .properties(TableEntity.INSERTED_AT, p -> p.keyword(k -> k))
                            .properties(TableEntity.BATCH_ID, p -> p.keyword(k -> k))));
            log.info("Created table: {} (index {})", tableName, index);
        } catch (ElasticsearchException e) {
            if (e.error() != null && ALREADY_EXISTS.equals(e.error().type())) {
                log.info("Table already exists: {} (index {})", tableName, index);
                return;
            }
            throw e;
        }
    }

    @Override
    public void insert(TableEntity entity) throws IOException {
        Map<String, Object> document = entity.toProperties();
        client.create(c -> c
                .index(index)
                .id(documentId(entity))
                .document(document));
    }

    /**
     * Reads every document of the index, one {@code search_after} page at a time.
     *
     * <p>The index is refreshed first so that entities inserted just before the scan are
     * visible to it.</p>
     */
    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Stream<TableEntity> scan() throws IOException {
        client.indices().refresh(r -> r.index(index));

        List<TableEntity> entities = new ArrayList<>();
        List<FieldValue> searchAfter = null;

        while (true) {
            SearchRequest.Builder searchBuilder = new SearchRequest.Builder()
                    .index(index)
                    .size(scanBatchSize)
                    .sort(s -> s.field(f -> f.field(TableEntity.PARTITION_KEY).order(SortOrder.Asc)))
                    .sort(s -> s.field(f -> f.field(TableEntity.ROW_KEY).order(SortOrder.Asc)));
            if (searchAfter != null) {
                searchBuilder.searchAfter(searchAfter);
            }

            SearchResponse<Map> response = client.search(searchBuilder.build(), Map.class);
            List<Hit<Map>> hits = response.hits().hits();

            for (Hit<Map> hit : hits) {
                if (hit.source() != null) {
                    entities.add(TableEntity.fromProperties(hit.source()));
                }
            }

            // A short page is the last one
            if (hits.size() < scanBatchSize) {
                break;
            }
            searchAfter = hits.get(hits.size() - 1).sort();
        }

        log.info("Scanned {} entities from table {}", entities.size(), tableName);
        return entities.stream();
    }

    @Override
    public void close() throws IOException {
        if (restClient != null) {
            restClient.close();
        }
    }
}
