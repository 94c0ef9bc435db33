package com.example.renderflow_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures batch polling and the two thread pools: one running whole batches, one running the items of
 * a batch.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int pollBatchSize = 2;
    private int maxConcurrentBatches = 2;

    private Pool batch = new Pool(2, 20);
    private Pool item = new Pool(8, 200);

    public int getPollBatchSize() {
        return pollBatchSize;
    }

    public void setPollBatchSize(int pollBatchSize) {
        this.pollBatchSize = pollBatchSize;
    }

    public int getMaxConcurrentBatches() {
        return maxConcurrentBatches;
    }

    public void setMaxConcurrentBatches(int maxConcurrentBatches) {
        this.maxConcurrentBatches = maxConcurrentBatches;
    }

    public Pool getBatch() {
        return batch;
    }

    public void setBatch(Pool batch) {
        this.batch = batch;
    }

    public Pool getItem() {
        return item;
    }

    public void setItem(Pool item) {
        this.item = item;
    }

    public static class Pool {
        private int threads = 1;
        private int queueCapacity = 50;

        public Pool() {
        }

        public Pool(int threads, int queueCapacity) {
            this.threads = threads;
            this.queueCapacity = queueCapacity;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
