package com.signalserver.handler;

import com.signalserver.config.SignalingProperties;
import com.signalserver.metrics.SignalingMetricsTracker;
import com.signalserver.protocol.SignalingCodec;
import com.signalserver.service.SessionSupervisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.BinaryWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * Endpoint for the persistent signaling connection. One {@link SignalingChannel} is created per
 * connection and kept in the session attributes.
 */
@Component
@Slf4j
public class SignalingWebSocketHandler extends BinaryWebSocketHandler {

	static final String CHANNEL_ATTRIBUTE = "signaling.channel";

	private final SessionSupervisor supervisor;
	private final SignalingCodec codec;
	private final SignalingMetricsTracker metrics;
	private final SignalingProperties properties;
	private final TaskExecutor outboundExecutor;

	public SignalingWebSocketHandler(SessionSupervisor supervisor, SignalingCodec codec,
			SignalingMetricsTracker metrics, SignalingProperties properties,
			@Qualifier("signalingOutboundExecutor") TaskExecutor outboundExecutor) {
		this.supervisor = supervisor;
		this.codec = codec;
		this.metrics = metrics;
		this.properties = properties;
		this.outboundExecutor = outboundExecutor;
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession session) {
		WebSocketSession guarded = new ConcurrentWebSocketSessionDecorator(session,
				(int) properties.getSendTimeLimit().toMillis(),
				properties.getSendBufferSizeLimit());
		WebSocketParticipant participant = new WebSocketParticipant(guarded, codec, outboundExecutor);
		SignalingChannel channel = new SignalingChannel(participant, supervisor, codec, metrics,
				properties.getDecodeErrorTolerance());
		session.getAttributes().put(CHANNEL_ATTRIBUTE, channel);
		metrics.recordConnectionOpened();
		log.info("Signaling channel connected: {} from {}", session.getId(), session.getRemoteAddress());
	}

	@Override
	protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
		SignalingChannel channel = channel(session);
		if (channel != null) {
			channel.onFrame(message.getPayload());
		}
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		SignalingChannel channel = channel(session);
		if (channel != null) {
			channel.onTextFrame();
		}
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		log.warn("Transport error on signaling channel {}: {}", session.getId(), exception.getMessage());
		SignalingChannel channel = channel(session);
		if (channel != null) {
			channel.onClosed(CloseStatus.SERVER_ERROR);
		}
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		SignalingChannel channel = channel(session);
		if (channel != null) {
			channel.onClosed(status);
		}
	}

	private static SignalingChannel channel(WebSocketSession session) {
		SignalingChannel channel = (SignalingChannel) session.getAttributes().get(CHANNEL_ATTRIBUTE);
		if (channel == null) {
			log.error("No signaling channel attached to WebSocket session {}", session.getId());
		}
		return channel;
	}

}
