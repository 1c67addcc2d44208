package com.signalserver.protocol;

import com.signalserver.exception.MessageDecodeException;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Binary envelope for {@link SignalingMessage}.
 *
 * <pre>
 * tag(1) | body
 *   SessionJoin / SessionWaiting / SessionReady / SessionClosed : sessionId(16)
 *   Offer / Answer / Candidate                                  : len(4) payload(len)
 *   ConnectionEstablished                                       : (empty)
 *   Error                                                       : code(1) len(2) utf8(len)
 * </pre>
 *
 * All integers are big-endian. Stateless and thread-safe.
 */
public class SignalingCodec {

	public static final int DEFAULT_MAX_PAYLOAD_BYTES = 512 * 1024;

	private static final int TAG_LEN = 1;
	private static final int PAYLOAD_LEN_FIELD = 4;
	private static final int REASON_LEN_FIELD = 2;
	private static final int MAX_REASON_BYTES = 0xFFFF;

	private final int maxPayloadBytes;

	public SignalingCodec() {
		this(DEFAULT_MAX_PAYLOAD_BYTES);
	}

	public SignalingCodec(int maxPayloadBytes) {
		if (maxPayloadBytes < 0) {
			throw new IllegalArgumentException("maxPayloadBytes must not be negative");
		}
		this.maxPayloadBytes = maxPayloadBytes;
	}

	public int getMaxPayloadBytes() {
		return maxPayloadBytes;
	}

	/**
	 * Largest frame {@link #encode} can produce.
	 */
	public int getMaxFrameBytes() {
		return Math.max(TAG_LEN + PAYLOAD_LEN_FIELD + maxPayloadBytes,
				TAG_LEN + 1 + REASON_LEN_FIELD + MAX_REASON_BYTES);
	}

	public byte[] encode(SignalingMessage message) {
		SignalingMessage.Type type = message.getType();
		ByteBuffer buffer;
		switch (type) {
			case SESSION_JOIN:
				buffer = sessionFrame(type, ((SignalingMessage.SessionJoin) message).getSessionId());
				break;
			case SESSION_WAITING:
				buffer = sessionFrame(type, ((SignalingMessage.SessionWaiting) message).getSessionId());
				break;
			case SESSION_READY:
				buffer = sessionFrame(type, ((SignalingMessage.SessionReady) message).getSessionId());
				break;
			case SESSION_CLOSED:
				buffer = sessionFrame(type, ((SignalingMessage.SessionClosed) message).getSessionId());
				break;
			case OFFER:
			case ANSWER:
			case CANDIDATE:
				byte[] payload = ((SignalingMessage.Negotiation) message).getPayload();
				if (payload.length > maxPayloadBytes) {
					throw new IllegalArgumentException(
							"Payload of " + payload.length + " bytes exceeds limit of " + maxPayloadBytes);
				}
				buffer = ByteBuffer.allocate(TAG_LEN + PAYLOAD_LEN_FIELD + payload.length);
				buffer.put((byte) type.getTag());
				buffer.putInt(payload.length);
				buffer.put(payload);
				break;
			case CONNECTION_ESTABLISHED:
				buffer = ByteBuffer.allocate(TAG_LEN);
				buffer.put((byte) type.getTag());
				break;
			case ERROR:
				SignalingMessage.Error error = (SignalingMessage.Error) message;
				String reason = error.getReason() != null ? error.getReason() : "";
				byte[] reasonBytes = reason.getBytes(StandardCharsets.UTF_8);
				if (reasonBytes.length > MAX_REASON_BYTES) {
					throw new IllegalArgumentException("Error reason exceeds " + MAX_REASON_BYTES + " bytes");
				}
				buffer = ByteBuffer.allocate(TAG_LEN + 1 + REASON_LEN_FIELD + reasonBytes.length);
				buffer.put((byte) type.getTag());
				buffer.put((byte) error.getCode().getCode());
				buffer.putShort((short) reasonBytes.length);
				buffer.put(reasonBytes);
				break;
			default:
				throw new IllegalStateException("Unhandled message type: " + type);
		}
		return buffer.array();
	}

	public SignalingMessage decode(byte[] frame) throws MessageDecodeException {
		return decode(ByteBuffer.wrap(frame));
	}

	/**
	 * Decode exactly one envelope. The buffer's position is left untouched.
	 */
	public SignalingMessage decode(ByteBuffer frame) throws MessageDecodeException {
		ByteBuffer buffer = frame.duplicate();
		if (!buffer.hasRemaining()) {
			throw new MessageDecodeException("Empty frame");
		}
		int tag = buffer.get() & 0xFF;
		SignalingMessage.Type type = SignalingMessage.Type.fromTag(tag);
		if (type == null) {
			throw new MessageDecodeException(String.format("Unknown message tag 0x%02x", tag));
		}

		SignalingMessage message;
		switch (type) {
			case SESSION_JOIN:
				message = new SignalingMessage.SessionJoin(readSessionId(buffer, type));
				break;
			case SESSION_WAITING:
				message = new SignalingMessage.SessionWaiting(readSessionId(buffer, type));
				break;
			case SESSION_READY:
				message = new SignalingMessage.SessionReady(readSessionId(buffer, type));
				break;
			case SESSION_CLOSED:
				message = new SignalingMessage.SessionClosed(readSessionId(buffer, type));
				break;
			case OFFER:
				message = new SignalingMessage.Offer(readPayload(buffer, type));
				break;
			case ANSWER:
				message = new SignalingMessage.Answer(readPayload(buffer, type));
				break;
			case CANDIDATE:
				message = new SignalingMessage.Candidate(readPayload(buffer, type));
				break;
			case CONNECTION_ESTABLISHED:
				message = SignalingMessage.ConnectionEstablished.INSTANCE;
				break;
			case ERROR:
				message = readError(buffer);
				break;
			default:
				throw new IllegalStateException("Unhandled message type: " + type);
		}

		if (buffer.hasRemaining()) {
			throw new MessageDecodeException(buffer.remaining() + " trailing bytes after " + type);
		}
		return message;
	}

	private static ByteBuffer sessionFrame(SignalingMessage.Type type, SessionId sessionId) {
		ByteBuffer buffer = ByteBuffer.allocate(TAG_LEN + SessionId.BYTES);
		buffer.put((byte) type.getTag());
		sessionId.writeTo(buffer);
		return buffer;
	}

	private static SessionId readSessionId(ByteBuffer buffer, SignalingMessage.Type type) throws MessageDecodeException {
		require(buffer, SessionId.BYTES, type);
		return SessionId.read(buffer);
	}

	private byte[] readPayload(ByteBuffer buffer, SignalingMessage.Type type) throws MessageDecodeException {
		require(buffer, PAYLOAD_LEN_FIELD, type);
		long length = buffer.getInt() & 0xFFFFFFFFL;
		if (length > maxPayloadBytes) {
			throw new MessageDecodeException(
					type + " payload of " + length + " bytes exceeds limit of " + maxPayloadBytes);
		}
		require(buffer, (int) length, type);
		byte[] payload = new byte[(int) length];
		buffer.get(payload);
		return payload;
	}

	private static SignalingMessage.Error readError(ByteBuffer buffer) throws MessageDecodeException {
		SignalingMessage.Type type = SignalingMessage.Type.ERROR;
		require(buffer, 1 + REASON_LEN_FIELD, type);
		int rawCode = buffer.get() & 0xFF;
		ErrorCode code = ErrorCode.fromCode(rawCode);
		if (code == null) {
			throw new MessageDecodeException(String.format("Unknown error code 0x%02x", rawCode));
		}
		int length = buffer.getShort() & 0xFFFF;
		require(buffer, length, type);
		ByteBuffer reasonBytes = buffer.slice();
		reasonBytes.limit(length);
		buffer.position(buffer.position() + length);

		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			CharBuffer reason = decoder.decode(reasonBytes);
			return new SignalingMessage.Error(code, reason.toString());
		} catch (CharacterCodingException e) {
			throw new MessageDecodeException("Error reason is not valid UTF-8");
		}
	}

	private static void require(ByteBuffer buffer, int bytes, SignalingMessage.Type type) throws MessageDecodeException {
		if (buffer.remaining() < bytes) {
			throw new MessageDecodeException(
					"Truncated " + type + ": needed " + bytes + " bytes, " + buffer.remaining() + " available");
		}
	}

}
