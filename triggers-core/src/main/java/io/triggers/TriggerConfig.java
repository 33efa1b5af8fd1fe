package io.triggers;

import io.triggers.dispatch.DispatchInterceptor;
import io.triggers.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Construction-time configuration handed to a trigger.
 *
 * <p>Carries the name the trigger is created under, its opaque startup {@code options},
 * and the framework collaborators ({@link MetricsExporter}, {@link DispatchInterceptor}s)
 * that observe its dispatches. The options map is copied and never mutated afterwards.
 *
 * @see io.triggers.registry.TriggerFactory
 */
public final class TriggerConfig {

    private final String name;
    private final Map<String, Object> options;
    private final MetricsExporter metrics;
    private final List<DispatchInterceptor> interceptors;

    private TriggerConfig(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        this.options = builder.options == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Creates a configuration with no options and no collaborators.
     *
     * @param name the trigger name
     * @return a new configuration
     */
    public static TriggerConfig named(String name) {
        return builder(name).build();
    }

    public String name() {
        return name;
    }

    public Map<String, Object> options() {
        return options;
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    public List<DispatchInterceptor> interceptors() {
        return interceptors;
    }

    /**
     * Builder for {@link TriggerConfig}.
     */
    public static final class Builder {
        private final String name;
        private Map<String, ?> options;
        private MetricsExporter metrics;
        private final List<DispatchInterceptor> interceptors = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Sets the startup options. Copied at build time.
         *
         * <p>Optional. Defaults to an empty map.
         *
         * @param options variant-specific options
         * @return this builder
         */
        public Builder options(Map<String, ?> options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder interceptor(DispatchInterceptor interceptor) {
            this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public Builder interceptors(List<DispatchInterceptor> interceptors) {
            interceptors.forEach(this::interceptor);
            return this;
        }

        public TriggerConfig build() {
            return new TriggerConfig(this);
        }
    }
}
