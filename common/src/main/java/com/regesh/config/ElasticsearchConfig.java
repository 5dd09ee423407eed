package com.regesh.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Elasticsearch cluster connection configuration.
 */
@Data
@NoArgsConstructor
public class ElasticsearchConfig {

    private List<String> hosts;
    private String username;
    private String password;
    private int connectTimeoutMs = 5000;
    private int socketTimeoutMs = 30000;

    /** Page size used when scanning a whole table. */
    private int scanBatchSize = 1000;
}
