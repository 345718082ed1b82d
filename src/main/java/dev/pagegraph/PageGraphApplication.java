package dev.pagegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PageGraph turns a bursty stream of "page visited" events into a knowledge base.
 *
 * <p>Architecture overview:
 * <pre>
 * Capture client → IngestController → IngestionService (normalize, fingerprint)
 *   → VisitEventStore (append + dedup decision) → DispatchQueue (bounded)
 *   → WorkerOrchestrator → VisitPipeline [fetch → summarize → embed → link]
 *   → KnowledgeStore (documents, summaries, embeddings, concept graph) → QueryFacade
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Write-ahead: an accepted event is durable before it is queued, so a full queue
 *       costs the caller an acknowledgement, never the event</li>
 *   <li>Visit state machine persisted after every stage, so a restart resumes from the
 *       last completed stage</li>
 *   <li>Capabilities behind fixed interfaces: a local or remote model is a configuration switch</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PageGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(PageGraphApplication.class, args);
    }
}
