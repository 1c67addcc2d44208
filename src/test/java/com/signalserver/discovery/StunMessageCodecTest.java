package com.signalserver.discovery;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class StunMessageCodecTest {

	private static final byte[] TRANSACTION_ID = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11};

	@Test
	void parsesBindingRequest() {
		byte[] request = bindingRequest(TRANSACTION_ID);

		assertThat(StunMessageCodec.parseBindingRequest(request, 0, request.length))
				.hasValueSatisfying(r -> assertThat(r.getTransactionId()).isEqualTo(TRANSACTION_ID));
	}

	@Test
	void honoursOffsetIntoReceiveBuffer() {
		byte[] request = bindingRequest(TRANSACTION_ID);
		byte[] buffer = new byte[request.length + 7];
		System.arraycopy(request, 0, buffer, 7, request.length);

		assertThat(StunMessageCodec.parseBindingRequest(buffer, 7, request.length)).isPresent();
	}

	@Test
	void encodesIpv4ResponseExactly() throws Exception {
		InetSocketAddress observed = new InetSocketAddress(InetAddress.getByName("1.2.3.4"), 5000);

		byte[] response = StunMessageCodec.bindingResponse(TRANSACTION_ID, observed);

		assertThat(response).hasSize(64);
		ByteBuffer buffer = ByteBuffer.wrap(response);
		assertThat(buffer.getShort() & 0xFFFF).isEqualTo(StunMessageCodec.BINDING_SUCCESS_RESPONSE);
		assertThat(buffer.getShort() & 0xFFFF).isEqualTo(44);
		assertThat(buffer.getInt()).isEqualTo(StunMessageCodec.MAGIC_COOKIE);
		assertThat(Arrays.copyOfRange(response, 8, 20)).isEqualTo(TRANSACTION_ID);

		assertThat(Arrays.copyOfRange(response, 20, 32)).containsExactly(
				0x00, 0x20, 0x00, 0x08,
				0x00, 0x01, 0x32, 0x9A,
				0x20, 0x10, 0xA7, 0x46);
		assertThat(Arrays.copyOfRange(response, 32, 44)).containsExactly(
				0x00, 0x01, 0x00, 0x08,
				0x00, 0x01, 0x13, 0x88,
				0x01, 0x02, 0x03, 0x04);
		assertThat(Arrays.copyOfRange(response, 44, 48)).containsExactly(0x80, 0x22, 0x00, 0x0D);
		assertThat(new String(response, 48, 13)).isEqualTo("signal-server");
		assertThat(Arrays.copyOfRange(response, 61, 64)).containsOnly(0);
	}

	@Test
	void xorMappedAddressDecodesBackToIpv6Source() throws Exception {
		InetAddress address = InetAddress.getByName("2001:db8::1");
		InetSocketAddress observed = new InetSocketAddress(address, 61000);

		byte[] response = StunMessageCodec.bindingResponse(TRANSACTION_ID, observed);

		ByteBuffer buffer = ByteBuffer.wrap(response, StunMessageCodec.HEADER_SIZE, response.length - StunMessageCodec.HEADER_SIZE);
		assertThat(buffer.getShort() & 0xFFFF).isEqualTo(StunMessageCodec.ATTR_XOR_MAPPED_ADDRESS);
		assertThat(buffer.getShort() & 0xFFFF).isEqualTo(20);
		buffer.get();
		assertThat((int) buffer.get()).isEqualTo(StunMessageCodec.FAMILY_IPV6);
		assertThat((buffer.getShort() & 0xFFFF) ^ (StunMessageCodec.MAGIC_COOKIE >>> 16)).isEqualTo(61000);

		byte[] mask = ByteBuffer.allocate(16).putInt(StunMessageCodec.MAGIC_COOKIE).put(TRANSACTION_ID).array();
		byte[] decoded = new byte[16];
		for (int i = 0; i < 16; i++) {
			decoded[i] = (byte) (buffer.get() ^ mask[i]);
		}
		assertThat(InetAddress.getByAddress(decoded)).isEqualTo(address);
	}

	@Test
	void dropsShortDatagram() {
		assertThat(StunMessageCodec.parseBindingRequest(new byte[19], 0, 19)).isEmpty();
	}

	@Test
	void dropsWrongMagicCookie() {
		byte[] request = bindingRequest(TRANSACTION_ID);
		request[4] = 0x00;

		assertThat(StunMessageCodec.parseBindingRequest(request, 0, request.length)).isEmpty();
	}

	@Test
	void dropsNonBindingType() {
		byte[] request = bindingRequest(TRANSACTION_ID);
		request[1] = 0x11;

		assertThat(StunMessageCodec.parseBindingRequest(request, 0, request.length)).isEmpty();
	}

	@Test
	void dropsTopBitsSet() {
		byte[] request = bindingRequest(TRANSACTION_ID);
		request[0] = (byte) 0xC0;

		assertThat(StunMessageCodec.parseBindingRequest(request, 0, request.length)).isEmpty();
	}

	@Test
	void dropsLengthMismatch() {
		byte[] request = Arrays.copyOf(bindingRequest(TRANSACTION_ID), 24);

		assertThat(StunMessageCodec.parseBindingRequest(request, 0, request.length)).isEmpty();
	}

	@Test
	void acceptsRequestCarryingAttributes() {
		ByteBuffer buffer = ByteBuffer.allocate(28);
		buffer.putShort((short) StunMessageCodec.BINDING_REQUEST);
		buffer.putShort((short) 8);
		buffer.putInt(StunMessageCodec.MAGIC_COOKIE);
		buffer.put(TRANSACTION_ID);
		buffer.putShort((short) StunMessageCodec.ATTR_SOFTWARE);
		buffer.putShort((short) 4);
		buffer.put("test".getBytes());

		assertThat(StunMessageCodec.parseBindingRequest(buffer.array(), 0, 28)).isPresent();
	}

	static byte[] bindingRequest(byte[] transactionId) {
		ByteBuffer buffer = ByteBuffer.allocate(StunMessageCodec.HEADER_SIZE);
		buffer.putShort((short) StunMessageCodec.BINDING_REQUEST);
		buffer.putShort((short) 0);
		buffer.putInt(StunMessageCodec.MAGIC_COOKIE);
		buffer.put(transactionId);
		return buffer.array();
	}

}
