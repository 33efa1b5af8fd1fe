/**
 * The always-available manual trigger for programmatic and test invocation.
 */
package io.triggers.manual;
