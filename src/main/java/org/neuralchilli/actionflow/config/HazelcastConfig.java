package org.neuralchilli.actionflow.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.actionflow.domain.Event;
import org.neuralchilli.actionflow.serializer.EventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures and produces the embedded Hazelcast instance backing the state store and event bus.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "hazelcast.cluster-name", defaultValue = "actionflow-dev")
    String clusterName;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(buildConfig(clusterName));

        log.info("Hazelcast instance created successfully");
        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            log.info("Shutting down Hazelcast instance");
            instance.getLifecycleService().shutdown();
        }
    }

    /**
     * Build an isolated embedded member configuration with custom serializers registered.
     */
    public static Config buildConfig(String clusterName) {
        Config config = new Config();
        config.setClusterName(clusterName);

        // Disable network join for embedded instance
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        SerializationConfig serializationConfig = config.getSerializationConfig();
        serializationConfig.setEnableCompression(false);
        serializationConfig.setEnableSharedObject(false);
        registerCustomSerializers(serializationConfig);

        return config;
    }

    private static void registerCustomSerializers(SerializationConfig serializationConfig) {
        // Event serializer (TYPE_ID: 1001)
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(Event.class)
                .setImplementation(new EventSerializer()));
        log.debug("Registered EventSerializer (TYPE_ID: {})", EventSerializer.TYPE_ID);
    }
}
