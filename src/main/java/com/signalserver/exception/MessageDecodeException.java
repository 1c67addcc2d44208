package com.signalserver.exception;

/**
 * Thrown when an inbound frame is not a well-formed signaling envelope.
 */
public class MessageDecodeException extends Exception {

	public MessageDecodeException(String message) {
		super(message);
	}

}
