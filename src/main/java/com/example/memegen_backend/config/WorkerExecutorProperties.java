package com.example.memegen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures the render pool (blocking image composition) and the tracking pool
 * (detached fire-and-forget tasks).
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private Pool render = new Pool(4, 100);
    private Pool tracking = new Pool(1, 500);

    public Pool getRender() {
        return render;
    }

    public void setRender(Pool render) {
        this.render = render;
    }

    public Pool getTracking() {
        return tracking;
    }

    public void setTracking(Pool tracking) {
        this.tracking = tracking;
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
