package com.signalserver.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "signaling")
public class SignalingProperties {

	/** WebSocket endpoint path. */
	@NotBlank
	private String path = "/one-to-one";

	@NotEmpty
	private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

	/** Largest Offer/Answer/Candidate payload accepted or relayed. */
	@Min(0)
	private int maxPayloadBytes = 512 * 1024;

	/** Messages buffered for a waiting session before NO_COUNTERPART is returned; 0 disables buffering. */
	@Min(0)
	private int pendingMessageLimit = 0;

	/** Decode errors tolerated on a registered channel before it is closed. */
	@Min(0)
	private int decodeErrorTolerance = 3;

	@NotNull
	private Duration waitingTimeout = Duration.ofMinutes(2);

	@NotNull
	private Duration pairedIdleTimeout = Duration.ofMinutes(5);

	/** How long a CLOSING session waits for both channels to close before it is torn down. */
	@NotNull
	private Duration closingGracePeriod = Duration.ofSeconds(10);

	@NotNull
	private Duration sendTimeLimit = Duration.ofSeconds(15);

	@Min(1024)
	private int sendBufferSizeLimit = 512 * 1024;

	@NotNull
	private Duration maxSessionIdleTimeout = Duration.ofSeconds(60);

	@Min(1)
	private int outboundPoolSize = 10;

}
