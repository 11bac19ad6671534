package org.javai.springai.escalation.heal;

/**
 * Tells the host to reload its configuration without restarting or reconnecting.
 */
@FunctionalInterface
public interface HotReloadSignal {

	void reload(String reason);
}
