package com.signalserver.config;

import com.signalserver.handler.SignalingWebSocketHandler;
import com.signalserver.protocol.SignalingCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import jakarta.annotation.PostConstruct;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
	private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

	private final SignalingWebSocketHandler signalingWebSocketHandler;
	private final SignalingProperties properties;
	private final SignalingCodec codec;

	public WebSocketConfig(SignalingWebSocketHandler signalingWebSocketHandler, SignalingProperties properties,
			SignalingCodec codec) {
		this.signalingWebSocketHandler = signalingWebSocketHandler;
		this.properties = properties;
		this.codec = codec;
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		// Raw binary WebSocket, no SockJS/STOMP: every frame is one signaling envelope
		registry.addHandler(signalingWebSocketHandler, properties.getPath())
				.setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(new String[0]));
	}

	/**
	 * Size the servlet container's binary buffer to the largest envelope the codec accepts,
	 * otherwise Tomcat rejects big Offer frames before they reach the handler.
	 * <p>
	 * Only active in a servlet container context; skipped in tests without one.
	 */
	@Bean
	public ServletServerContainerFactoryBean createWebSocketContainer() {
		ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
		container.setMaxBinaryMessageBufferSize(codec.getMaxFrameBytes());
		container.setMaxTextMessageBufferSize(8 * 1024);
		container.setMaxSessionIdleTimeout(properties.getMaxSessionIdleTimeout().toMillis());
		container.setAsyncSendTimeout(properties.getSendTimeLimit().toMillis());
		return container;
	}

	/**
	 * Log WebSocket configuration at startup
	 */
	@PostConstruct
	public void logWebSocketConfig() {
		log.info("=== Signaling WebSocket Configuration ===");
		log.info("Endpoint: {} (allowed origins: {})", properties.getPath(), properties.getAllowedOrigins());
		log.info("Max payload={}KB, max frame={}KB, sendTimeLimit={}s, sendBufferSizeLimit={}KB",
				properties.getMaxPayloadBytes() / 1024, codec.getMaxFrameBytes() / 1024,
				properties.getSendTimeLimit().toSeconds(), properties.getSendBufferSizeLimit() / 1024);
		log.info("Pending message limit={}, decode error tolerance={}",
				properties.getPendingMessageLimit(), properties.getDecodeErrorTolerance());
		log.info("Timeouts: waiting={}, pairedIdle={}, closingGrace={}, containerIdle={}",
				properties.getWaitingTimeout(), properties.getPairedIdleTimeout(),
				properties.getClosingGracePeriod(), properties.getMaxSessionIdleTimeout());
		log.info("==========================================");
	}

}
