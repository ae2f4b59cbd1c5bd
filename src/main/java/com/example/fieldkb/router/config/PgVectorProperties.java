package com.example.fieldkb.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Connection settings of the pgvector table holding knowledge base items. */
@Data
@ConfigurationProperties(prefix = "router.pgvector")
public class PgVectorProperties {
    private String host = "localhost";
    private int port = 5432;
    private String database = "postgres";
    private String user = "postgres";
    private String password;
    private String table = "kb_items";
    /** 384 for the local all-MiniLM-L6-v2 model, 1536 for text-embedding-3-small. */
    private int dimension = 384;
}
