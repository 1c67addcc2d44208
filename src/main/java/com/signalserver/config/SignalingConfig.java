package com.signalserver.config;

import com.signalserver.protocol.SignalingCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SignalingConfig {

	@Bean
	public SignalingCodec signalingCodec(SignalingProperties properties) {
		return new SignalingCodec(properties.getMaxPayloadBytes());
	}

	/**
	 * Drains participant outbound queues. Unbounded queue so handing off a send never blocks.
	 */
	@Bean
	public ThreadPoolTaskExecutor signalingOutboundExecutor(SignalingProperties properties) {
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(properties.getOutboundPoolSize());
		executor.setMaxPoolSize(properties.getOutboundPoolSize());
		executor.setThreadNamePrefix("signaling-outbound-");
		executor.setWaitForTasksToCompleteOnShutdown(true);
		executor.setAwaitTerminationSeconds(10);
		executor.initialize();
		return executor;
	}

	/**
	 * Runs the idle session sweep and the metrics summary.
	 * Named {@code taskScheduler} so {@code @Scheduled} picks it over the WebSocket support scheduler.
	 */
	@Bean
	public ThreadPoolTaskScheduler taskScheduler() {
		ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
		scheduler.setPoolSize(2);
		scheduler.setThreadNamePrefix("signaling-sweep-");
		scheduler.setAwaitTerminationSeconds(10);
		scheduler.setWaitForTasksToCompleteOnShutdown(false);
		scheduler.initialize();
		return scheduler;
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

}
