package com.signalserver.protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Unsigned 128-bit identifier two clients agree on out-of-band to be paired together.
 * Written on the wire as 16 big-endian bytes.
 */
@Getter
@EqualsAndHashCode
public final class SessionId {

	public static final int BYTES = 16;

	private static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

	private final long high;
	private final long low;

	private SessionId(long high, long low) {
		this.high = high;
		this.low = low;
	}

	public static SessionId of(long high, long low) {
		return new SessionId(high, low);
	}

	/**
	 * Session id whose upper 64 bits are zero; {@code value} is taken as unsigned.
	 */
	public static SessionId of(long value) {
		return new SessionId(0L, value);
	}

	public static SessionId read(ByteBuffer buffer) {
		long high = buffer.getLong();
		long low = buffer.getLong();
		return new SessionId(high, low);
	}

	/**
	 * Parse decimal or {@code 0x}-prefixed hexadecimal text.
	 */
	public static SessionId parse(String text) {
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("Session ID is required");
		}
		String trimmed = text.trim();
		BigInteger value;
		try {
			if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
				value = new BigInteger(trimmed.substring(2), 16);
			} else {
				value = new BigInteger(trimmed);
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid session ID: " + text);
		}
		if (value.signum() < 0 || value.compareTo(MAX_VALUE) > 0) {
			throw new IllegalArgumentException("Session ID out of 128-bit range: " + text);
		}
		return new SessionId(value.shiftRight(64).longValue(), value.longValue());
	}

	public void writeTo(ByteBuffer buffer) {
		buffer.putLong(high);
		buffer.putLong(low);
	}

	public BigInteger toBigInteger() {
		byte[] bytes = ByteBuffer.allocate(BYTES).putLong(high).putLong(low).array();
		return new BigInteger(1, bytes);
	}

	@Override
	public String toString() {
		return String.format("0x%016x%016x", high, low);
	}

}
