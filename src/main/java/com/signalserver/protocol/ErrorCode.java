package com.signalserver.protocol;

/**
 * Failure categories reported to clients inside {@link SignalingMessage.Error} frames.
 * Wire codes are stable; never renumber.
 */
public enum ErrorCode {

	PROTOCOL_VIOLATION(0x01),
	DECODE_ERROR(0x02),
	SESSION_FULL(0x03),
	UNKNOWN_SESSION(0x04),
	NOT_A_PARTICIPANT(0x05),
	NO_COUNTERPART(0x06),
	SESSION_CLOSING(0x07),
	COUNTERPART_LEFT(0x08),
	SESSION_EXPIRED(0x09),
	CLIENT_ERROR(0x0A);

	private final int code;

	ErrorCode(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}

	/**
	 * @return the matching constant, or {@code null} for an unassigned code
	 */
	public static ErrorCode fromCode(int code) {
		for (ErrorCode value : values()) {
			if (value.code == code) {
				return value;
			}
		}
		return null;
	}

}
