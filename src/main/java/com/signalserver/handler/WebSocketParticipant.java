package com.signalserver.handler;

import com.signalserver.protocol.SignalingCodec;
import com.signalserver.protocol.SignalingMessage;
import com.signalserver.registry.Participant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Participant} backed by a WebSocket connection.
 * <p>
 * Outbound messages go into a FIFO queue drained by at most one task at a time on the shared
 * outbound executor, so callers never block on the socket and per-channel order is kept.
 * A close request is applied after the messages queued before it have been written.
 */
@Slf4j
public class WebSocketParticipant implements Participant {

	private final WebSocketSession session;
	private final SignalingCodec codec;
	private final Executor outboundExecutor;

	private final Queue<SignalingMessage> outbound = new ConcurrentLinkedQueue<>();
	private final AtomicBoolean draining = new AtomicBoolean(false);
	private final AtomicBoolean closeRequested = new AtomicBoolean(false);
	private final AtomicBoolean transportClosed = new AtomicBoolean(false);
	private volatile CloseStatus closeStatus = CloseStatus.NORMAL;

	public WebSocketParticipant(WebSocketSession session, SignalingCodec codec, Executor outboundExecutor) {
		this.session = session;
		this.codec = codec;
		this.outboundExecutor = outboundExecutor;
	}

	@Override
	public String getId() {
		return session.getId();
	}

	@Override
	public void send(SignalingMessage message) {
		if (closeRequested.get()) {
			log.debug("Dropping {} for {}: channel is closing", message, getId());
			return;
		}
		outbound.add(message);
		scheduleDrain();
	}

	@Override
	public void close() {
		close(CloseStatus.NORMAL);
	}

	public void close(CloseStatus status) {
		if (closeRequested.compareAndSet(false, true)) {
			closeStatus = status;
			scheduleDrain();
		}
	}

	@Override
	public boolean isOpen() {
		return !closeRequested.get() && session.isOpen();
	}

	private void scheduleDrain() {
		if (!draining.compareAndSet(false, true)) {
			return;
		}
		try {
			outboundExecutor.execute(this::drain);
		} catch (RejectedExecutionException e) {
			draining.set(false);
			log.warn("Outbound executor rejected drain for {}: {}", getId(), e.getMessage());
		}
	}

	private void drain() {
		try {
			SignalingMessage message;
			while ((message = outbound.poll()) != null) {
				write(message);
			}
			if (closeRequested.get()) {
				closeTransport();
			}
		} finally {
			draining.set(false);
		}
		// a producer may have enqueued after the last poll but before the flag was cleared
		if (!transportClosed.get() && (!outbound.isEmpty() || closeRequested.get())) {
			scheduleDrain();
		}
	}

	private void write(SignalingMessage message) {
		if (!session.isOpen()) {
			log.debug("Dropping {} for {}: socket already closed", message, getId());
			return;
		}
		try {
			session.sendMessage(new BinaryMessage(codec.encode(message)));
		} catch (IOException | RuntimeException e) {
			log.warn("Send to {} failed ({}), closing channel", getId(), e.getMessage());
			outbound.clear();
			closeRequested.set(true);
			closeStatus = CloseStatus.SERVER_ERROR;
		}
	}

	private void closeTransport() {
		if (!transportClosed.compareAndSet(false, true)) {
			return;
		}
		outbound.clear();
		try {
			if (session.isOpen()) {
				session.close(closeStatus);
			}
		} catch (IOException e) {
			log.warn("Error closing channel {}: {}", getId(), e.getMessage());
		}
	}

	@Override
	public String toString() {
		return "WebSocketParticipant(" + getId() + ")";
	}

}
