package com.signalserver.registry;

import com.signalserver.protocol.SignalingMessage;

/**
 * Routing handle for one connected client. The session table only keeps this handle;
 * the underlying channel belongs to its handler.
 * <p>
 * {@link #send} and {@link #close} hand work off to the channel's outbound queue and
 * never block on network I/O, so they are safe to call while a session entry is locked.
 */
public interface Participant {

	String getId();

	/**
	 * Queue a message for delivery. Messages are delivered in call order; anything queued
	 * after {@link #close} is dropped.
	 */
	void send(SignalingMessage message);

	/**
	 * Close the channel once everything queued before this call has been written. Idempotent.
	 */
	void close();

	boolean isOpen();

}
