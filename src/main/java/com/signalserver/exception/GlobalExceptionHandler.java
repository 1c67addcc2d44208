package com.signalserver.exception;

import com.signalserver.dto.ErrorResponse;
import com.signalserver.protocol.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps failures of the inspection endpoints to an {@link ErrorResponse} body. Signaling
 * failures keep their protocol error code so HTTP callers see the same vocabulary as clients.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

	@ExceptionHandler(SignalingException.class)
	public ResponseEntity<ErrorResponse> handleSignalingException(SignalingException ex) {
		HttpStatus status = statusOf(ex.getErrorCode());
		log.warn("Session request rejected with {} ({}): {}", ex.getErrorCode(), status.value(), ex.getMessage());
		return ResponseEntity.status(status).body(ErrorResponse.builder()
				.error(ex.getErrorCode().name())
				.message(ex.getMessage())
				.build());
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
		log.warn("Bad session request: {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.builder()
				.error("INVALID_ARGUMENT")
				.message(ex.getMessage())
				.build());
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
		log.error("Unexpected error serving session request", ex);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
				.error("INTERNAL_ERROR")
				.message("Internal server error")
				.build());
	}

	static HttpStatus statusOf(ErrorCode code) {
		switch (code) {
			case UNKNOWN_SESSION:
				return HttpStatus.NOT_FOUND;
			case SESSION_FULL:
			case SESSION_CLOSING:
				return HttpStatus.CONFLICT;
			case NOT_A_PARTICIPANT:
				return HttpStatus.FORBIDDEN;
			default:
				return HttpStatus.BAD_REQUEST;
		}
	}

}
