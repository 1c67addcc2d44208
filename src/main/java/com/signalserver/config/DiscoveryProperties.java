package com.signalserver.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {

	private boolean enabled = true;

	@NotBlank
	private String bindAddress = "0.0.0.0";

	/** UDP port for STUN binding requests; 0 picks an ephemeral port. */
	@Min(0)
	@Max(65535)
	private int port = 9004;

}
