package com.williamcallahan.baptismdesk.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Storage storage = new Storage();
    private Inference inference = new Inference();
    private Certificate certificate = new Certificate();
    private Queues queues = new Queues();
    private Snapshot snapshot = new Snapshot();

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Inference getInference() {
        return inference;
    }

    public void setInference(Inference inference) {
        this.inference = inference;
    }

    public Certificate getCertificate() {
        return certificate;
    }

    public void setCertificate(Certificate certificate) {
        this.certificate = certificate;
    }

    public Queues getQueues() {
        return queues;
    }

    public void setQueues(Queues queues) {
        this.queues = queues;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * Object store connection. {@code type=memory} swaps in a process-local store.
     */
    public static class Storage {
        private String type = "s3";
        private String bucket = "baptism-desk";
        private String region = "us-east-1";
        private String endpoint;
        private boolean pathStyleAccess = false;
        private String accessKeyId;
        private String secretAccessKey;
        private Duration presignTtl = Duration.ofMinutes(10);

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public boolean isPathStyleAccess() { return pathStyleAccess; }
        public void setPathStyleAccess(boolean pathStyleAccess) { this.pathStyleAccess = pathStyleAccess; }

        public String getAccessKeyId() { return accessKeyId; }
        public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

        public String getSecretAccessKey() { return secretAccessKey; }
        public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

        public Duration getPresignTtl() { return presignTtl; }
        public void setPresignTtl(Duration presignTtl) { this.presignTtl = presignTtl; }
    }

    public static class Inference {
        private String defaultUrl = "http://localhost:8000";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);

        public String getDefaultUrl() { return defaultUrl; }
        public void setDefaultUrl(String defaultUrl) { this.defaultUrl = defaultUrl; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    /**
     * Scratch area and helper processes used to render certificates.
     */
    public static class Certificate {
        private String workDir = System.getProperty("java.io.tmpdir") + "/baptism-desk/certificates";
        private String pythonCommand = "python3";
        private String sofficeCommand = "soffice";
        private Duration renderTimeout = Duration.ofSeconds(120);
        private Duration convertTimeout = Duration.ofSeconds(120);
        private Duration combineTimeout = Duration.ofMinutes(5);

        public String getWorkDir() { return workDir; }
        public void setWorkDir(String workDir) { this.workDir = workDir; }

        public String getPythonCommand() { return pythonCommand; }
        public void setPythonCommand(String pythonCommand) { this.pythonCommand = pythonCommand; }

        public String getSofficeCommand() { return sofficeCommand; }
        public void setSofficeCommand(String sofficeCommand) { this.sofficeCommand = sofficeCommand; }

        public Duration getRenderTimeout() { return renderTimeout; }
        public void setRenderTimeout(Duration renderTimeout) { this.renderTimeout = renderTimeout; }

        public Duration getConvertTimeout() { return convertTimeout; }
        public void setConvertTimeout(Duration convertTimeout) { this.convertTimeout = convertTimeout; }

        public Duration getCombineTimeout() { return combineTimeout; }
        public void setCombineTimeout(Duration combineTimeout) { this.combineTimeout = combineTimeout; }
    }

    public static class Queues {
        private Queue upload = new Queue(3);
        private Queue extraction = new Queue(2);
        private Queue certificate = new Queue(3);

        public Queue getUpload() { return upload; }
        public void setUpload(Queue upload) { this.upload = upload; }

        public Queue getExtraction() { return extraction; }
        public void setExtraction(Queue extraction) { this.extraction = extraction; }

        public Queue getCertificate() { return certificate; }
        public void setCertificate(Queue certificate) { this.certificate = certificate; }
    }

    /**
     * Limits for one admission controller. A {@code maxBacklog} of 0 leaves the backlog unbounded.
     */
    public static class Queue {
        private int capacity;
        private int maxBacklog = 0;

        public Queue() {
            this(1);
        }

        public Queue(int capacity) {
            this.capacity = capacity;
        }

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public int getMaxBacklog() { return maxBacklog; }
        public void setMaxBacklog(int maxBacklog) { this.maxBacklog = maxBacklog; }
    }

    public static class Snapshot {
        private boolean loadOnStartup = true;

        public boolean isLoadOnStartup() { return loadOnStartup; }
        public void setLoadOnStartup(boolean loadOnStartup) { this.loadOnStartup = loadOnStartup; }
    }
}
