package ch.so.arp.assistant;

import org.springframework.boot.context.properties.ConfigurationProperties;

import ch.so.arp.assistant.plan.FailurePolicy;

/**
 * Tunables of the planning and retrieval pipeline.
 */
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    private final Chunking chunking = new Chunking();

    private final Retrieval retrieval = new Retrieval();

    private final Plan plan = new Plan();

    /**
     * Timeout of the chat event stream in milliseconds, 0 disables it.
     */
    private long streamTimeoutMillis;

    public Chunking getChunking() {
        return chunking;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Plan getPlan() {
        return plan;
    }

    public long getStreamTimeoutMillis() {
        return streamTimeoutMillis;
    }

    public void setStreamTimeoutMillis(long streamTimeoutMillis) {
        this.streamTimeoutMillis = streamTimeoutMillis;
    }

    public static class Chunking {

        private int size = 1000;

        private int overlap = 200;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Retrieval {

        /**
         * Number of chunks handed to the knowledge capability.
         */
        private int topK = 3;

        /**
         * Dimensions of the deterministic embeddings used when no model is wired.
         */
        private int embeddingDimensions = 384;

        /**
         * Threads embedding chunks in parallel during ingest.
         */
        private int ingestThreads = 4;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getEmbeddingDimensions() {
            return embeddingDimensions;
        }

        public void setEmbeddingDimensions(int embeddingDimensions) {
            this.embeddingDimensions = embeddingDimensions;
        }

        public int getIngestThreads() {
            return ingestThreads;
        }

        public void setIngestThreads(int ingestThreads) {
            this.ingestThreads = ingestThreads;
        }
    }

    public static class Plan {

        private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;

        public FailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }
    }
}
