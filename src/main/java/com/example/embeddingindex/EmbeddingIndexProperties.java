package com.example.embeddingindex;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Grouped settings under {@code embeddingindex.*}. HNSW tuning lives in the
 * {@code hnsw.*} properties read by {@link HnswVectorIndex}.
 */
@ConfigurationProperties(prefix = "embeddingindex")
public class EmbeddingIndexProperties {

    private final Storage storage = new Storage();
    private final Snapshot snapshot = new Snapshot();
    private final Gate gate = new Gate();
    private final Upload upload = new Upload();

    public Storage getStorage() { return storage; }
    public Snapshot getSnapshot() { return snapshot; }
    public Gate getGate() { return gate; }
    public Upload getUpload() { return upload; }

    public static class Storage {

        /** {@code local} or {@code s3}. */
        private String type = "local";

        /** Root directory of the local object storage. */
        private String localRoot = "./data/objects";

        private final S3 s3 = new S3();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getLocalRoot() { return localRoot; }
        public void setLocalRoot(String localRoot) { this.localRoot = localRoot; }
        public S3 getS3() { return s3; }
    }

    public static class S3 {

        /** Endpoint override, e.g. {@code https://<account>.r2.cloudflarestorage.com}. */
        private String endpoint;
        private String region = "auto";
        private String bucket;

        /** Static credentials; when unset the SDK default provider chain is used. */
        private String accessKeyId;
        private String secretAccessKey;
        private boolean pathStyle = true;

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }
        public String getAccessKeyId() { return accessKeyId; }
        public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }
        public String getSecretAccessKey() { return secretAccessKey; }
        public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }
        public boolean isPathStyle() { return pathStyle; }
        public void setPathStyle(boolean pathStyle) { this.pathStyle = pathStyle; }
    }

    public static class Snapshot {

        /** Back up to and restore from object storage. */
        private boolean remoteEnabled = false;

        /** Raised to {@link SnapshotScheduler#MIN_INTERVAL} when smaller. */
        private Duration interval = Duration.ofMinutes(10);

        private String key = "snapshots/embedding-index.sql.gz";

        public boolean isRemoteEnabled() { return remoteEnabled; }
        public void setRemoteEnabled(boolean remoteEnabled) { this.remoteEnabled = remoteEnabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }
    }

    public static class Gate {

        private String embeddingResource = "embedding";
        private int embeddingMaxConcurrency = 1;

        /** Wait limit for an embedding slot; unset means wait indefinitely. */
        private Duration acquireTimeout;

        public String getEmbeddingResource() { return embeddingResource; }
        public void setEmbeddingResource(String embeddingResource) { this.embeddingResource = embeddingResource; }
        public int getEmbeddingMaxConcurrency() { return embeddingMaxConcurrency; }
        public void setEmbeddingMaxConcurrency(int embeddingMaxConcurrency) { this.embeddingMaxConcurrency = embeddingMaxConcurrency; }
        public Duration getAcquireTimeout() { return acquireTimeout; }
        public void setAcquireTimeout(Duration acquireTimeout) { this.acquireTimeout = acquireTimeout; }
    }

    public static class Upload {

        private long maxBytes = 20L * 1024 * 1024;
        private Duration presignTtl = Duration.ofHours(24);

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }
        public Duration getPresignTtl() { return presignTtl; }
        public void setPresignTtl(Duration presignTtl) { this.presignTtl = presignTtl; }
    }
}
