/**
 * Spring Boot auto-configuration for the trigger framework.
 *
 * @see io.triggers.spring.boot.TriggerAutoConfiguration
 * @see io.triggers.spring.boot.TriggerHandler
 */
package io.triggers.spring.boot;
