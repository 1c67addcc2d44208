package com.signalserver.discovery;

import com.signalserver.metrics.SignalingMetricsTracker;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Answers STUN Binding Requests on an already-bound UDP socket with the source address the
 * request was observed from. Malformed datagrams are dropped without a reply.
 * <p>
 * Each datagram is handled on the receive thread; there is no per-client state, so unrelated
 * requests never interfere with each other.
 */
@Slf4j
public class AddressDiscoveryResponder {

	private static final int MAX_DATAGRAM = 1500;

	private final DatagramSocket socket;
	private final SignalingMetricsTracker metrics;
	private final AtomicBoolean running = new AtomicBoolean(false);
	private Thread receiver;

	public AddressDiscoveryResponder(DatagramSocket socket, SignalingMetricsTracker metrics) {
		this.socket = socket;
		this.metrics = metrics;
	}

	public void start() {
		if (!running.compareAndSet(false, true)) {
			return;
		}
		receiver = new Thread(this::receiveLoop, "stun-responder");
		receiver.setDaemon(true);
		receiver.start();
		log.info("STUN responder listening on UDP {}", socket.getLocalSocketAddress());
	}

	public void stop() {
		if (!running.compareAndSet(true, false)) {
			return;
		}
		socket.close();
		if (receiver != null) {
			try {
				receiver.join(5000);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
		log.info("STUN responder stopped");
	}

	public boolean isRunning() {
		return running.get();
	}

	public int getLocalPort() {
		return socket.getLocalPort();
	}

	private void receiveLoop() {
		byte[] buffer = new byte[MAX_DATAGRAM];
		while (running.get()) {
			DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
			try {
				socket.receive(packet);
			} catch (SocketException e) {
				if (running.get()) {
					log.error("STUN socket failed, responder stopping: {}", e.getMessage());
					running.set(false);
				}
				break;
			} catch (IOException e) {
				log.warn("Error receiving STUN datagram: {}", e.getMessage());
				continue;
			}
			handle(packet);
		}
	}

	void handle(DatagramPacket packet) {
		InetSocketAddress source = (InetSocketAddress) packet.getSocketAddress();
		Optional<StunMessageCodec.BindingRequest> request =
				StunMessageCodec.parseBindingRequest(packet.getData(), packet.getOffset(), packet.getLength());
		if (request.isEmpty()) {
			metrics.recordDiscoveryDropped();
			log.debug("Dropped non-binding datagram from {} ({} bytes)", source, packet.getLength());
			return;
		}

		byte[] response = StunMessageCodec.bindingResponse(request.get().getTransactionId(), source);
		try {
			socket.send(new DatagramPacket(response, response.length, source));
			metrics.recordDiscoveryResponse();
			log.debug("Sent binding response to {}", source);
		} catch (IOException e) {
			log.warn("Failed to send binding response to {}: {}", source, e.getMessage());
		}
	}

}
