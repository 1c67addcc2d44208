package com.signalserver.exception;

import com.signalserver.protocol.ErrorCode;

/**
 * A rejected session operation. The code is reported back to the requesting client only.
 */
public class SignalingException extends RuntimeException {

	private final ErrorCode errorCode;

	public SignalingException(ErrorCode errorCode, String message) {
		super(message);
		this.errorCode = errorCode;
	}

	public ErrorCode getErrorCode() {
		return errorCode;
	}

}
