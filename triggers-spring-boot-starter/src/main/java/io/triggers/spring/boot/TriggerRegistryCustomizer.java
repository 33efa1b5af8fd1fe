package io.triggers.spring.boot;

import io.triggers.registry.DefaultTriggerRegistry;

/**
 * Callback for registering additional trigger types on the auto-configured registry.
 *
 * <pre>{@code
 * @Bean
 * TriggerRegistryCustomizer cronTriggers() {
 *   return registry -> registry.register("cron", CronTrigger::new);
 * }
 * }</pre>
 */
@FunctionalInterface
public interface TriggerRegistryCustomizer {

    void customize(DefaultTriggerRegistry registry);
}
