package com.signalserver.handler;

import com.signalserver.exception.MessageDecodeException;
import com.signalserver.exception.SignalingException;
import com.signalserver.metrics.SignalingMetricsTracker;
import com.signalserver.protocol.ErrorCode;
import com.signalserver.protocol.SessionId;
import com.signalserver.protocol.SignalingCodec;
import com.signalserver.protocol.SignalingMessage;
import com.signalserver.service.Registration;
import com.signalserver.service.SessionSupervisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;

import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Protocol state of one client connection: expects {@code SessionJoin} first, then hands
 * negotiation traffic to the {@link SessionSupervisor}.
 * <p>
 * Inbound frames for one connection arrive sequentially, so {@link #sessionId} and
 * {@link #decodeErrors} are only written from that thread.
 */
@Slf4j
public class SignalingChannel {

	private final WebSocketParticipant participant;
	private final SessionSupervisor supervisor;
	private final SignalingCodec codec;
	private final SignalingMetricsTracker metrics;
	private final int decodeErrorTolerance;

	private volatile SessionId sessionId;
	private int decodeErrors;
	private final AtomicBoolean left = new AtomicBoolean(false);

	public SignalingChannel(WebSocketParticipant participant, SessionSupervisor supervisor, SignalingCodec codec,
			SignalingMetricsTracker metrics, int decodeErrorTolerance) {
		this.participant = participant;
		this.supervisor = supervisor;
		this.codec = codec;
		this.metrics = metrics;
		this.decodeErrorTolerance = decodeErrorTolerance;
	}

	public WebSocketParticipant getParticipant() {
		return participant;
	}

	public Optional<SessionId> getSessionId() {
		return Optional.ofNullable(sessionId);
	}

	public void onFrame(ByteBuffer frame) {
		SignalingMessage message;
		try {
			message = codec.decode(frame);
		} catch (MessageDecodeException e) {
			onDecodeError(e);
			return;
		}
		log.debug("Message received from {}: {}", participant.getId(), message);

		if (sessionId == null) {
			onUnregisteredMessage(message);
			return;
		}

		switch (message.getType()) {
			case OFFER:
			case ANSWER:
			case CANDIDATE:
				relay(message);
				break;
			case CONNECTION_ESTABLISHED:
				try {
					supervisor.reportEstablished(sessionId, participant);
				} catch (SignalingException e) {
					reportFailure(e);
				}
				break;
			case ERROR:
				forwardClientError((SignalingMessage.Error) message);
				break;
			case SESSION_JOIN:
				protocolViolation("Already joined session " + sessionId);
				break;
			default:
				protocolViolation("Clients may not send " + message.getType());
				break;
		}
	}

	public void onTextFrame() {
		protocolViolation("Text frames are not part of the signaling protocol");
	}

	/**
	 * Channel is gone (client close, transport error or server close). Unregisters at most once
	 * here; a close that races a join in progress is unregistered by the joining thread instead.
	 */
	public void onClosed(CloseStatus status) {
		if (!left.compareAndSet(false, true)) {
			return;
		}
		participant.close(status);
		SessionId joined = sessionId;
		if (joined != null) {
			supervisor.participantLeft(joined, participant);
		}
		log.info("Signaling channel {} closed ({}), session {}", participant.getId(), status, joined);
	}

	private void onUnregisteredMessage(SignalingMessage message) {
		if (message.getType() != SignalingMessage.Type.SESSION_JOIN) {
			protocolViolation("First message must be SessionJoin, got " + message.getType());
			return;
		}
		SessionId requested = ((SignalingMessage.SessionJoin) message).getSessionId();
		try {
			Registration registration = supervisor.register(requested, participant);
			sessionId = requested;
			log.info("Channel {} joined session {} ({})", participant.getId(), requested, registration.getStatus());
			// the outbound drain may have closed the socket while registration was in progress,
			// in which case onClosed saw no session id and left the unregistering to us
			if (left.get()) {
				log.info("Channel {} closed while joining session {}, unregistering", participant.getId(), requested);
				supervisor.participantLeft(requested, participant);
			}
		} catch (SignalingException e) {
			if (e.getErrorCode() == ErrorCode.PROTOCOL_VIOLATION) {
				protocolViolation(e.getMessage());
			} else {
				reportFailure(e);
			}
		}
	}

	private void relay(SignalingMessage message) {
		try {
			supervisor.relay(sessionId, participant, message);
		} catch (SignalingException e) {
			reportFailure(e);
		}
	}

	private void forwardClientError(SignalingMessage.Error error) {
		log.warn("Client {} in session {} reported {}: {}", participant.getId(), sessionId, error.getCode(), error.getReason());
		try {
			supervisor.relay(sessionId, participant, new SignalingMessage.Error(ErrorCode.CLIENT_ERROR, error.getReason()));
		} catch (SignalingException e) {
			log.debug("Client error from {} not forwarded: {}", participant.getId(), e.getMessage());
		}
	}

	private void onDecodeError(MessageDecodeException e) {
		metrics.recordDecodeError();
		if (sessionId == null) {
			protocolViolation("Undecodable first message: " + e.getMessage());
			return;
		}
		decodeErrors++;
		log.warn("Decode error {} of {} tolerated on channel {}: {}",
				decodeErrors, decodeErrorTolerance, participant.getId(), e.getMessage());
		sendError(ErrorCode.DECODE_ERROR, e.getMessage());
		if (decodeErrors > decodeErrorTolerance) {
			protocolViolation("Too many malformed messages");
		}
	}

	private void reportFailure(SignalingException e) {
		log.warn("Channel {} request failed with {}: {}", participant.getId(), e.getErrorCode(), e.getMessage());
		sendError(e.getErrorCode(), e.getMessage());
	}

	private void protocolViolation(String reason) {
		log.warn("Protocol violation on channel {}: {}", participant.getId(), reason);
		sendError(ErrorCode.PROTOCOL_VIOLATION, reason);
		participant.close(CloseStatus.PROTOCOL_ERROR);
	}

	private void sendError(ErrorCode code, String reason) {
		metrics.recordErrorReported(code);
		participant.send(new SignalingMessage.Error(code, reason));
	}

}
