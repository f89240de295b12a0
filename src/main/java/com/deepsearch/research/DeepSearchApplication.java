package com.deepsearch.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DeepSearch Research Service
 *
 * - Query expansion and web search (DuckDuckGo HTML endpoint) with page scraping
 * - Per-source analysis and report writing with a local Ollama model
 * - Sessions, sources, reports and embeddings stored in PostgreSQL + pgvector
 */
@SpringBootApplication
public class DeepSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeepSearchApplication.class, args);
    }
}
