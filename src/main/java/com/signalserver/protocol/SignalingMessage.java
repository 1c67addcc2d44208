package com.signalserver.protocol;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Arrays;
import java.util.Objects;

/**
 * Closed set of frames exchanged on the signaling channel.
 * The constructor is private, so the nested variants below are the only subclasses.
 */
public abstract class SignalingMessage {

	public enum Type {
		SESSION_JOIN(0x01, true, false),
		SESSION_WAITING(0x02, false, true),
		SESSION_READY(0x03, false, true),
		OFFER(0x10, true, false),
		ANSWER(0x11, true, false),
		CANDIDATE(0x12, true, false),
		CONNECTION_ESTABLISHED(0x20, true, false),
		SESSION_CLOSED(0x21, false, true),
		ERROR(0x7F, true, true);

		private final int tag;
		private final boolean sentByClient;
		private final boolean sentByServer;

		Type(int tag, boolean sentByClient, boolean sentByServer) {
			this.tag = tag;
			this.sentByClient = sentByClient;
			this.sentByServer = sentByServer;
		}

		public int getTag() {
			return tag;
		}

		public boolean isSentByClient() {
			return sentByClient;
		}

		public boolean isSentByServer() {
			return sentByServer;
		}

		public static Type fromTag(int tag) {
			for (Type type : values()) {
				if (type.tag == tag) {
					return type;
				}
			}
			return null;
		}
	}

	private SignalingMessage() {
	}

	public abstract Type getType();

	/**
	 * First frame of every client connection.
	 */
	@Value
	@EqualsAndHashCode(callSuper = false)
	public static class SessionJoin extends SignalingMessage {
		SessionId sessionId;

		@Override
		public Type getType() {
			return Type.SESSION_JOIN;
		}
	}

	/**
	 * Registration accepted, no counterpart yet.
	 */
	@Value
	@EqualsAndHashCode(callSuper = false)
	public static class SessionWaiting extends SignalingMessage {
		SessionId sessionId;

		@Override
		public Type getType() {
			return Type.SESSION_WAITING;
		}
	}

	/**
	 * Both participants are registered; sent to each of them.
	 */
	@Value
	@EqualsAndHashCode(callSuper = false)
	public static class SessionReady extends SignalingMessage {
		SessionId sessionId;

		@Override
		public Type getType() {
			return Type.SESSION_READY;
		}
	}

	/**
	 * Close instruction; the server closes the socket right after sending it.
	 */
	@Value
	@EqualsAndHashCode(callSuper = false)
	public static class SessionClosed extends SignalingMessage {
		SessionId sessionId;

		@Override
		public Type getType() {
			return Type.SESSION_CLOSED;
		}
	}

	/**
	 * Opaque negotiation blob passed to the counterpart untouched.
	 */
	public abstract static class Negotiation extends SignalingMessage {
		private final byte[] payload;

		private Negotiation(byte[] payload) {
			this.payload = Objects.requireNonNull(payload, "payload");
		}

		public byte[] getPayload() {
			return payload;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (o == null || getClass() != o.getClass()) {
				return false;
			}
			return Arrays.equals(payload, ((Negotiation) o).payload);
		}

		@Override
		public int hashCode() {
			return 31 * getType().hashCode() + Arrays.hashCode(payload);
		}

		@Override
		public String toString() {
			return getClass().getSimpleName() + "(" + payload.length + " bytes)";
		}
	}

	public static final class Offer extends Negotiation {
		public Offer(byte[] payload) {
			super(payload);
		}

		@Override
		public Type getType() {
			return Type.OFFER;
		}
	}

	public static final class Answer extends Negotiation {
		public Answer(byte[] payload) {
			super(payload);
		}

		@Override
		public Type getType() {
			return Type.ANSWER;
		}
	}

	public static final class Candidate extends Negotiation {
		public Candidate(byte[] payload) {
			super(payload);
		}

		@Override
		public Type getType() {
			return Type.CANDIDATE;
		}
	}

	/**
	 * The sender's direct link is up.
	 */
	public static final class ConnectionEstablished extends SignalingMessage {
		public static final ConnectionEstablished INSTANCE = new ConnectionEstablished();

		private ConnectionEstablished() {
		}

		@Override
		public Type getType() {
			return Type.CONNECTION_ESTABLISHED;
		}

		@Override
		public String toString() {
			return "ConnectionEstablished";
		}
	}

	@Value
	@EqualsAndHashCode(callSuper = false)
	public static class Error extends SignalingMessage {
		ErrorCode code;
		String reason;

		@Override
		public Type getType() {
			return Type.ERROR;
		}
	}

}
