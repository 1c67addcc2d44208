package com.signalserver.controller;

import com.signalserver.discovery.AddressDiscoveryResponder;
import com.signalserver.dto.SessionStatusResponse;
import com.signalserver.dto.StatsResponse;
import com.signalserver.exception.SignalingException;
import com.signalserver.metrics.SignalingMetricsTracker;
import com.signalserver.protocol.ErrorCode;
import com.signalserver.protocol.SessionId;
import com.signalserver.registry.SessionPhase;
import com.signalserver.service.SessionSnapshot;
import com.signalserver.service.SessionSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inspection of the session table and counters, plus an operator hook to force a session closed.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class SessionController {

	private final SessionSupervisor sessionSupervisor;
	private final SignalingMetricsTracker metricsTracker;
	private final ObjectProvider<AddressDiscoveryResponder> discoveryResponder;

	/**
	 * Current phase of a session; unknown ids report EMPTY.
	 * GET /api/sessions/{sessionId}
	 */
	@GetMapping("/{sessionId}")
	public ResponseEntity<SessionStatusResponse> status(@PathVariable String sessionId) {
		SessionId id = SessionId.parse(sessionId);
		SessionSnapshot snapshot = sessionSupervisor.snapshot(id);
		log.debug("Status lookup for session {}: {}", id, snapshot.getPhase());

		SessionStatusResponse response = SessionStatusResponse.builder()
				.sessionId(id.toString())
				.phase(snapshot.getPhase().name())
				.participants(snapshot.getParticipants())
				.established(snapshot.getEstablished())
				.pendingMessages(snapshot.getPendingMessages())
				.createdAt(snapshot.getCreatedAt())
				.lastActivity(snapshot.getLastActivity())
				.build();
		return ResponseEntity.ok(response);
	}

	/**
	 * Force a session closed. Both channels are closed; buffered messages are reported dropped.
	 * DELETE /api/sessions/{sessionId}
	 */
	@DeleteMapping("/{sessionId}")
	public ResponseEntity<Void> close(@PathVariable String sessionId) {
		SessionId id = SessionId.parse(sessionId);
		if (!sessionSupervisor.teardown(id)) {
			throw new SignalingException(ErrorCode.UNKNOWN_SESSION, "No such session: " + id);
		}
		log.info("Session {} closed through the API", id);
		return ResponseEntity.noContent().build();
	}

	/**
	 * Aggregate counters.
	 * GET /api/sessions/stats
	 */
	@GetMapping("/stats")
	public ResponseEntity<StatsResponse> stats() {
		Map<SessionPhase, Integer> byPhase = sessionSupervisor.countByPhase();
		Map<String, Integer> phases = new LinkedHashMap<>();
		int active = 0;
		for (Map.Entry<SessionPhase, Integer> entry : byPhase.entrySet()) {
			phases.put(entry.getKey().name(), entry.getValue());
			active += entry.getValue();
		}

		SignalingMetricsTracker.Snapshot metrics = metricsTracker.snapshot();
		Map<String, Long> errors = new LinkedHashMap<>();
		metrics.getErrorsReported().forEach((code, count) -> {
			if (count > 0) {
				errors.put(code.name(), count);
			}
		});

		AddressDiscoveryResponder responder = discoveryResponder.getIfAvailable();

		StatsResponse response = StatsResponse.builder()
				.activeSessions(active)
				.sessionsByPhase(phases)
				.connectionsOpened(metrics.getConnectionsOpened())
				.sessionsPaired(metrics.getSessionsPaired())
				.sessionsEstablished(metrics.getSessionsEstablished())
				.sessionsAbandoned(metrics.getSessionsAbandoned())
				.sessionsReaped(metrics.getSessionsReaped())
				.messagesRelayed(metrics.getMessagesRelayed())
				.payloadBytesRelayed(metrics.getPayloadBytesRelayed())
				.messagesBuffered(metrics.getMessagesBuffered())
				.decodeErrors(metrics.getDecodeErrors())
				.errorsReported(errors)
				.discoveryRunning(responder != null && responder.isRunning())
				.discoveryPort(responder != null ? responder.getLocalPort() : null)
				.discoveryResponses(metrics.getDiscoveryResponses())
				.discoveryDropped(metrics.getDiscoveryDropped())
				.build();
		return ResponseEntity.ok(response);
	}

}
