package com.signalserver.service;

import com.signalserver.protocol.SessionId;
import com.signalserver.registry.SessionPhase;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of a session, taken under its table lock.
 */
@Value
@Builder
public class SessionSnapshot {

	SessionId sessionId;
	SessionPhase phase;
	int participants;
	int established;
	int pendingMessages;
	Instant createdAt;
	Instant lastActivity;

	public static SessionSnapshot empty(SessionId sessionId) {
		return SessionSnapshot.builder()
				.sessionId(sessionId)
				.phase(SessionPhase.EMPTY)
				.build();
	}

}
