package com.signalserver.discovery;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Minimal STUN (RFC 5389) codec: recognizes Binding Requests and builds Binding Success
 * Responses carrying the observed transport address. Pure functions, no state.
 */
public final class StunMessageCodec {

	public static final int HEADER_SIZE = 20;
	public static final int MAGIC_COOKIE = 0x2112A442;
	public static final int TRANSACTION_ID_SIZE = 12;

	public static final int BINDING_REQUEST = 0x0001;
	public static final int BINDING_SUCCESS_RESPONSE = 0x0101;

	public static final int ATTR_MAPPED_ADDRESS = 0x0001;
	public static final int ATTR_XOR_MAPPED_ADDRESS = 0x0020;
	public static final int ATTR_SOFTWARE = 0x8022;

	static final int FAMILY_IPV4 = 0x01;
	static final int FAMILY_IPV6 = 0x02;

	private static final byte[] SOFTWARE = "signal-server".getBytes(StandardCharsets.UTF_8);

	private StunMessageCodec() {
	}

	/**
	 * Parse a datagram as a Binding Request.
	 *
	 * @return the request, or empty if the datagram is not a well-formed Binding Request
	 */
	public static Optional<BindingRequest> parseBindingRequest(byte[] data, int offset, int length) {
		if (length < HEADER_SIZE) {
			return Optional.empty();
		}
		ByteBuffer buffer = ByteBuffer.wrap(data, offset, length);
		int messageType = buffer.getShort() & 0xFFFF;
		int messageLength = buffer.getShort() & 0xFFFF;
		int cookie = buffer.getInt();

		// the two most significant bits of every STUN message are zero
		if ((messageType & 0xC000) != 0 || messageType != BINDING_REQUEST) {
			return Optional.empty();
		}
		if (cookie != MAGIC_COOKIE) {
			return Optional.empty();
		}
		if (messageLength % 4 != 0 || messageLength != length - HEADER_SIZE) {
			return Optional.empty();
		}
		byte[] transactionId = new byte[TRANSACTION_ID_SIZE];
		buffer.get(transactionId);
		return Optional.of(new BindingRequest(transactionId));
	}

	/**
	 * Build a Binding Success Response with XOR-MAPPED-ADDRESS, MAPPED-ADDRESS and SOFTWARE.
	 */
	public static byte[] bindingResponse(byte[] transactionId, InetSocketAddress observed) {
		if (transactionId.length != TRANSACTION_ID_SIZE) {
			throw new IllegalArgumentException("Transaction ID must be " + TRANSACTION_ID_SIZE + " bytes");
		}
		InetAddress address = observed.getAddress();
		byte[] addressBytes = address.getAddress();
		int family;
		if (address instanceof Inet4Address) {
			family = FAMILY_IPV4;
		} else if (address instanceof Inet6Address) {
			family = FAMILY_IPV6;
		} else {
			throw new IllegalArgumentException("Unsupported address type: " + address);
		}

		int addressAttrLength = 4 + addressBytes.length;
		int softwarePadded = padded(SOFTWARE.length);
		int messageLength = 2 * (4 + addressAttrLength) + 4 + softwarePadded;

		ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + messageLength);
		buffer.putShort((short) BINDING_SUCCESS_RESPONSE);
		buffer.putShort((short) messageLength);
		buffer.putInt(MAGIC_COOKIE);
		buffer.put(transactionId);

		// XOR-MAPPED-ADDRESS: port XOR top 16 bits of the cookie, address XOR cookie || transaction id
		byte[] mask = ByteBuffer.allocate(16).putInt(MAGIC_COOKIE).put(transactionId).array();
		byte[] xored = new byte[addressBytes.length];
		for (int i = 0; i < addressBytes.length; i++) {
			xored[i] = (byte) (addressBytes[i] ^ mask[i]);
		}
		putAddressAttribute(buffer, ATTR_XOR_MAPPED_ADDRESS, family,
				observed.getPort() ^ (MAGIC_COOKIE >>> 16), xored);

		putAddressAttribute(buffer, ATTR_MAPPED_ADDRESS, family, observed.getPort(), addressBytes);

		buffer.putShort((short) ATTR_SOFTWARE);
		buffer.putShort((short) SOFTWARE.length);
		buffer.put(SOFTWARE);
		for (int i = SOFTWARE.length; i < softwarePadded; i++) {
			buffer.put((byte) 0);
		}
		return buffer.array();
	}

	private static void putAddressAttribute(ByteBuffer buffer, int type, int family, int port, byte[] address) {
		buffer.putShort((short) type);
		buffer.putShort((short) (4 + address.length));
		buffer.put((byte) 0);
		buffer.put((byte) family);
		buffer.putShort((short) port);
		buffer.put(address);
	}

	private static int padded(int length) {
		return (length + 3) & ~3;
	}

	public static final class BindingRequest {
		private final byte[] transactionId;

		BindingRequest(byte[] transactionId) {
			this.transactionId = transactionId;
		}

		public byte[] getTransactionId() {
			return transactionId.clone();
		}
	}

}
