package org.springaicommunity.github.audit;

/**
 * Blocks the calling thread. Injected wherever the client waits, so tests can observe
 * waits without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper SYSTEM = Thread::sleep;

	void sleep(long millis) throws InterruptedException;

}
