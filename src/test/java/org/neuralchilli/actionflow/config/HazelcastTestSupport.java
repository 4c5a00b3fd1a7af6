package org.neuralchilli.actionflow.config;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;

import java.util.UUID;

/**
 * Isolated embedded Hazelcast members for tests that need a real broker.
 */
public final class HazelcastTestSupport {

    private HazelcastTestSupport() {
    }

    public static HazelcastInstance newInstance(String name) {
        Config config = HazelcastConfig.buildConfig("test-" + name + "-" + UUID.randomUUID());

        // Fast operation timeout for tests
        config.setProperty("hazelcast.operation.call.timeout.millis", "5000");
        config.getMapConfig("*").setBackupCount(0).setAsyncBackupCount(0);
        config.getMetricsConfig().setEnabled(false);

        return Hazelcast.newHazelcastInstance(config);
    }

    public static void shutdown(HazelcastInstance instance) {
        if (instance != null && instance.getLifecycleService().isRunning()) {
            instance.shutdown();
        }
    }
}
