package com.signalserver.config;

import com.signalserver.discovery.AddressDiscoveryResponder;
import com.signalserver.metrics.SignalingMetricsTracker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;

/**
 * Binds the STUN socket and hands it to the responder.
 */
@Configuration
@ConditionalOnProperty(prefix = "discovery", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DiscoveryConfig {

	@Bean(initMethod = "start", destroyMethod = "stop")
	public AddressDiscoveryResponder addressDiscoveryResponder(DiscoveryProperties properties,
			SignalingMetricsTracker metrics) throws SocketException {
		DatagramSocket socket = new DatagramSocket(
				new InetSocketAddress(properties.getBindAddress(), properties.getPort()));
		return new AddressDiscoveryResponder(socket, metrics);
	}

}
