package com.signalserver.metrics;

import com.signalserver.protocol.ErrorCode;
import com.signalserver.registry.SessionTable;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Aggregates signaling and discovery counters so activity can be followed without logging
 * every relayed frame. Logs a periodic summary when something happened in the window.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SignalingMetricsTracker {

	private final SessionTable sessionTable;

	private final LongAdder connectionsOpened = new LongAdder();
	private final LongAdder sessionsPaired = new LongAdder();
	private final LongAdder sessionsEstablished = new LongAdder();
	private final LongAdder sessionsAbandoned = new LongAdder();
	private final LongAdder sessionsReaped = new LongAdder();
	private final LongAdder messagesRelayed = new LongAdder();
	private final LongAdder payloadBytesRelayed = new LongAdder();
	private final LongAdder messagesBuffered = new LongAdder();
	private final LongAdder decodeErrors = new LongAdder();
	private final LongAdder discoveryResponses = new LongAdder();
	private final LongAdder discoveryDropped = new LongAdder();
	private final Map<ErrorCode, LongAdder> errorsReported = new EnumMap<>(ErrorCode.class);

	private final LongAdder windowRelayed = new LongAdder();
	private final LongAdder windowBytes = new LongAdder();
	private final LongAdder windowDiscovery = new LongAdder();
	private final AtomicLong lastLogTime = new AtomicLong(System.currentTimeMillis());

	{
		for (ErrorCode code : ErrorCode.values()) {
			errorsReported.put(code, new LongAdder());
		}
	}

	public void recordConnectionOpened() {
		connectionsOpened.increment();
	}

	public void recordPaired() {
		sessionsPaired.increment();
	}

	public void recordEstablished() {
		sessionsEstablished.increment();
	}

	public void recordAbandoned() {
		sessionsAbandoned.increment();
	}

	public void recordReaped(int count) {
		sessionsReaped.add(count);
	}

	/**
	 * @param payloadBytes opaque payload length, 0 for messages without one
	 */
	public void recordRelayed(int payloadBytes) {
		messagesRelayed.increment();
		windowRelayed.increment();
		if (payloadBytes > 0) {
			payloadBytesRelayed.add(payloadBytes);
			windowBytes.add(payloadBytes);
		}
	}

	public void recordBuffered() {
		messagesBuffered.increment();
	}

	public void recordDecodeError() {
		decodeErrors.increment();
	}

	public void recordErrorReported(ErrorCode code) {
		errorsReported.get(code).increment();
	}

	public void recordDiscoveryResponse() {
		discoveryResponses.increment();
		windowDiscovery.increment();
	}

	public void recordDiscoveryDropped() {
		discoveryDropped.increment();
	}

	public Snapshot snapshot() {
		Map<ErrorCode, Long> errors = new EnumMap<>(ErrorCode.class);
		errorsReported.forEach((code, adder) -> errors.put(code, adder.sum()));
		return new Snapshot(
				connectionsOpened.sum(),
				sessionsPaired.sum(),
				sessionsEstablished.sum(),
				sessionsAbandoned.sum(),
				sessionsReaped.sum(),
				messagesRelayed.sum(),
				payloadBytesRelayed.sum(),
				messagesBuffered.sum(),
				decodeErrors.sum(),
				discoveryResponses.sum(),
				discoveryDropped.sum(),
				errors);
	}

	/**
	 * Log relay and discovery throughput for the last window. Silent when idle.
	 */
	@Scheduled(fixedRateString = "${signaling.metrics-interval-ms:5000}")
	public void logStats() {
		long relayed = windowRelayed.sumThenReset();
		long bytes = windowBytes.sumThenReset();
		long lookups = windowDiscovery.sumThenReset();
		long now = System.currentTimeMillis();
		long windowMs = now - lastLogTime.getAndSet(now);

		if ((relayed == 0 && lookups == 0) || windowMs <= 0) {
			return;
		}

		double msgPerSec = relayed * 1000.0 / windowMs;
		double avgKb = relayed > 0 ? (bytes / (double) relayed) / 1024.0 : 0.0;

		log.info("Signaling stats: relayed={}, msg/s≈{}, avgPayloadKB≈{}, stunResponses={}, activeSessions={}, window={}ms",
			relayed,
			String.format("%.1f", msgPerSec),
			String.format("%.2f", avgKb),
			lookups,
			sessionTable.size(),
			windowMs);
	}

	@Value
	public static class Snapshot {
		long connectionsOpened;
		long sessionsPaired;
		long sessionsEstablished;
		long sessionsAbandoned;
		long sessionsReaped;
		long messagesRelayed;
		long payloadBytesRelayed;
		long messagesBuffered;
		long decodeErrors;
		long discoveryResponses;
		long discoveryDropped;
		Map<ErrorCode, Long> errorsReported;
	}

}
