package io.triggers.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the trigger framework.
 *
 * <pre>
 * triggers.instances.manual.auto-start=true
 * triggers.instances.github_webhook.options.port=8001
 * triggers.metrics.name-prefix=ops.triggers
 * </pre>
 *
 * @see TriggerAutoConfiguration
 */
@ConfigurationProperties(prefix = "triggers")
public class TriggerProperties {

    /**
     * Trigger instances to create at startup, keyed by trigger type name.
     */
    private final Map<String, Instance> instances = new LinkedHashMap<>();

    private final Metrics metrics = new Metrics();

    public Map<String, Instance> getInstances() {
        return instances;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Instance {
        /**
         * Whether to create this instance.
         */
        private boolean enabled = true;

        /**
         * Whether to start the instance once its handlers are attached.
         */
        private boolean autoStart = true;

        /**
         * Opaque options passed to the trigger's factory.
         */
        private Map<String, Object> options = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Map<String, Object> getOptions() {
            return options;
        }

        public void setOptions(Map<String, Object> options) {
            this.options = options;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "triggers";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
