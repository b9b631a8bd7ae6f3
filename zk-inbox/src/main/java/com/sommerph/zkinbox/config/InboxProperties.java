package com.sommerph.zkinbox.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "inbox")
public class InboxProperties {

    private EpochProperties epoch = new EpochProperties();
    private ProofProperties proof = new ProofProperties();
    private GroupProperties group = new GroupProperties();
    private EncryptionProperties encryption = new EncryptionProperties();
    private NullifierProperties nullifier = new NullifierProperties();

    @Data
    public static class EpochProperties {
        private long durationSeconds = 86400;
        private long retentionEpochs = 2;
        private long clockSkewSeconds = 30;
    }

    @Data
    public static class ProofProperties {
        private String protocol = "groth16";
        private String curve = "bn254";
        private boolean enforceGroupRoot = true;
    }

    @Data
    public static class GroupProperties {
        private int rootHistory = 16;
    }

    @Data
    public static class EncryptionProperties {
        private String hkdfInfo = "zk-inbox/report/v1";
    }

    @Data
    public static class NullifierProperties {
        private RegistryProperties registry = new RegistryProperties();
        private StorageProperties storage = new StorageProperties();

        @Data
        public static class RegistryProperties {
            private String type = "memory";
        }

        @Data
        public static class StorageProperties {
            private String path = "./data/nullifiers";
        }
    }

}
