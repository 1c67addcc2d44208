package com.signalserver.service;

import com.signalserver.config.SignalingProperties;
import com.signalserver.exception.SignalingException;
import com.signalserver.metrics.SignalingMetricsTracker;
import com.signalserver.protocol.ErrorCode;
import com.signalserver.protocol.SessionId;
import com.signalserver.protocol.SignalingMessage;
import com.signalserver.registry.Participant;
import com.signalserver.registry.Session;
import com.signalserver.registry.SessionPhase;
import com.signalserver.registry.SessionTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pairs participants under a session id, routes negotiation messages between the pair and
 * tears the pair down once both report a direct link.
 * <p>
 * Every state change runs in the {@link SessionTable} critical section for that id only.
 * Participant hand-offs made there ({@link Participant#send}, {@link Participant#close})
 * are non-blocking queue operations, which keeps buffered and relayed messages in order
 * without holding the lock across a socket write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionSupervisor {

	private final SessionTable sessionTable;
	private final SignalingProperties properties;
	private final SignalingMetricsTracker metrics;
	private final Clock clock;

	/**
	 * Register {@code participant} under {@code sessionId}. The first registrant waits and gets
	 * {@code SessionWaiting}; the second completes the pair and both get {@code SessionReady},
	 * followed by anything the first one sent while waiting.
	 *
	 * @throws SignalingException {@code SESSION_FULL} if the session is paired or closing
	 */
	public Registration register(SessionId sessionId, Participant participant) {
		AtomicReference<Registration> outcome = new AtomicReference<>();
		AtomicInteger flushed = new AtomicInteger();

		sessionTable.compute(sessionId, (id, session) -> {
			Instant now = clock.instant();
			if (session == null) {
				participant.send(new SignalingMessage.SessionWaiting(id));
				outcome.set(Registration.waiting());
				return new Session(id, participant, now);
			}
			if (session.isParticipant(participant)) {
				throw new SignalingException(ErrorCode.PROTOCOL_VIOLATION,
						"Participant already registered in session " + id);
			}
			if (session.getPhase() != SessionPhase.WAITING) {
				throw new SignalingException(ErrorCode.SESSION_FULL,
						"Session " + id + " already has two participants");
			}

			Participant waiting = session.pair(participant, now);
			waiting.send(new SignalingMessage.SessionReady(id));
			participant.send(new SignalingMessage.SessionReady(id));
			for (SignalingMessage buffered : session.drainPending()) {
				participant.send(buffered);
				flushed.incrementAndGet();
			}
			outcome.set(Registration.paired(waiting));
			return session;
		});

		Registration registration = outcome.get();
		if (registration.getStatus() == Registration.Status.PAIRED) {
			metrics.recordPaired();
			log.info("Session {} paired: {} <-> {} ({} buffered message(s) flushed)",
					sessionId, registration.getCounterpart().map(Participant::getId).orElse("?"),
					participant.getId(), flushed.get());
		} else {
			log.info("Session {} waiting for counterpart, first participant {}", sessionId, participant.getId());
		}
		return registration;
	}

	/**
	 * Route a negotiation message from {@code from} to its counterpart. While the session is
	 * waiting the message is buffered up to {@code signaling.pending-message-limit}.
	 *
	 * @return the counterpart the message was queued for, or empty if it was buffered
	 * @throws SignalingException {@code UNKNOWN_SESSION}, {@code NOT_A_PARTICIPANT},
	 *                            {@code NO_COUNTERPART} or {@code SESSION_CLOSING}
	 */
	public Optional<Participant> relay(SessionId sessionId, Participant from, SignalingMessage message) {
		AtomicReference<Participant> recipient = new AtomicReference<>();
		AtomicBoolean found = new AtomicBoolean();

		sessionTable.computeIfPresent(sessionId, (id, session) -> {
			found.set(true);
			requireParticipant(session, from);
			switch (session.getPhase()) {
				case WAITING:
					if (!session.buffer(message, properties.getPendingMessageLimit())) {
						throw new SignalingException(ErrorCode.NO_COUNTERPART,
								"Session " + id + " has no counterpart yet");
					}
					break;
				case PAIRED:
					Participant counterpart = session.counterpartOf(from);
					counterpart.send(message);
					recipient.set(counterpart);
					break;
				default:
					throw new SignalingException(ErrorCode.SESSION_CLOSING,
							"Session " + id + " is closing, relay stopped");
			}
			session.touch(clock.instant());
			return session;
		});

		if (!found.get()) {
			throw new SignalingException(ErrorCode.UNKNOWN_SESSION, "No such session: " + sessionId);
		}
		if (recipient.get() == null) {
			metrics.recordBuffered();
			log.debug("Buffered {} from {} in waiting session {}", message, from.getId(), sessionId);
		} else {
			metrics.recordRelayed(payloadLength(message));
			log.debug("Relayed {} in session {}: {} -> {}", message, sessionId, from.getId(), recipient.get().getId());
		}
		return Optional.ofNullable(recipient.get());
	}

	/**
	 * Record that {@code participant} has a working direct link. When both participants have
	 * reported, the session enters {@code CLOSING} and both channels are told to close.
	 *
	 * @return {@code true} if this report triggered the teardown
	 */
	public boolean reportEstablished(SessionId sessionId, Participant participant) {
		AtomicBoolean found = new AtomicBoolean();
		AtomicBoolean closing = new AtomicBoolean();

		sessionTable.computeIfPresent(sessionId, (id, session) -> {
			found.set(true);
			requireParticipant(session, participant);
			switch (session.getPhase()) {
				case WAITING:
					throw new SignalingException(ErrorCode.NO_COUNTERPART,
							"Session " + id + " has no counterpart to be connected to");
				case PAIRED:
					session.touch(clock.instant());
					if (session.markEstablished(participant)) {
						session.beginClosing(clock.instant());
						for (Participant p : session.getParticipants()) {
							p.send(new SignalingMessage.SessionClosed(id));
							p.close();
						}
						closing.set(true);
					}
					break;
				default:
					// both already confirmed; a repeated report changes nothing
					break;
			}
			return session;
		});

		if (!found.get()) {
			throw new SignalingException(ErrorCode.UNKNOWN_SESSION, "No such session: " + sessionId);
		}
		if (closing.get()) {
			metrics.recordEstablished();
			log.info("Session {} established by both participants, closing signaling channels", sessionId);
		} else {
			log.info("Participant {} reported direct link in session {}", participant.getId(), sessionId);
		}
		return closing.get();
	}

	/**
	 * Called exactly once when a participant's channel goes away, for whatever reason.
	 * A waiting session is dropped; a paired session is abandoned and the counterpart is
	 * notified and closed; a closing session is torn down once both channels are gone.
	 */
	public void participantLeft(SessionId sessionId, Participant participant) {
		AtomicReference<SessionPhase> phaseBefore = new AtomicReference<>();
		AtomicBoolean removed = new AtomicBoolean();

		sessionTable.compute(sessionId, (id, session) -> {
			if (session == null || !session.isParticipant(participant)) {
				return session;
			}
			phaseBefore.set(session.getPhase());
			switch (session.getPhase()) {
				case WAITING:
					tearDown(session, participant);
					removed.set(true);
					return null;
				case PAIRED:
					Participant counterpart = session.counterpartOf(participant);
					counterpart.send(new SignalingMessage.Error(ErrorCode.COUNTERPART_LEFT,
							"Counterpart disconnected from session " + id));
					tearDown(session, participant);
					removed.set(true);
					return null;
				default:
					if (session.markClosed(participant)) {
						tearDown(session, participant);
						removed.set(true);
						return null;
					}
					return session;
			}
		});

		if (phaseBefore.get() == null) {
			log.debug("Participant {} left session {} which no longer tracks it", participant.getId(), sessionId);
			return;
		}
		if (phaseBefore.get() == SessionPhase.PAIRED) {
			metrics.recordAbandoned();
			metrics.recordErrorReported(ErrorCode.COUNTERPART_LEFT);
			log.warn("Participant {} dropped out of paired session {}, counterpart notified", participant.getId(), sessionId);
		} else if (removed.get()) {
			log.info("Session {} closed after participant {} left (was {})", sessionId, participant.getId(), phaseBefore.get());
		} else {
			log.debug("Participant {} closed its channel in closing session {}", participant.getId(), sessionId);
		}
	}

	/**
	 * Remove the session and close any channel still open. Messages still buffered for a
	 * counterpart that never came are reported to the participants as {@code SESSION_CLOSING}
	 * before the close. Idempotent.
	 *
	 * @return {@code true} if an entry was removed
	 */
	public boolean teardown(SessionId sessionId) {
		AtomicBoolean removed = new AtomicBoolean();
		sessionTable.computeIfPresent(sessionId, (id, session) -> {
			tearDown(session, null);
			removed.set(true);
			return null;
		});
		if (!removed.get()) {
			return false;
		}
		log.info("Session {} torn down", sessionId);
		return true;
	}

	/**
	 * Sweep for sessions that were never paired, went quiet after pairing, or never finished
	 * closing. Best effort; relies on the configured timeouts only.
	 *
	 * @return number of sessions removed
	 */
	public int reapIdleSessions(Instant now) {
		Duration waitingTimeout = properties.getWaitingTimeout();
		Duration idleTimeout = properties.getPairedIdleTimeout();
		Duration closingGrace = properties.getClosingGracePeriod();
		AtomicInteger reaped = new AtomicInteger();

		for (SessionId sessionId : sessionTable.ids()) {
			sessionTable.computeIfPresent(sessionId, (id, session) -> {
				switch (session.getPhase()) {
					case WAITING:
						if (expired(session.getCreatedAt(), waitingTimeout, now)) {
							String reason = "No counterpart joined session " + id + " within " + waitingTimeout;
							if (session.getPendingCount() > 0) {
								reason += "; " + session.getPendingCount() + " buffered message(s) dropped";
							}
							expire(session, reason);
							reaped.incrementAndGet();
							return null;
						}
						return session;
					case PAIRED:
						if (expired(session.getLastActivity(), idleTimeout, now)) {
							expire(session, "Session " + id + " idle for more than " + idleTimeout);
							reaped.incrementAndGet();
							return null;
						}
						return session;
					default:
						if (session.getClosingSince() != null && expired(session.getClosingSince(), closingGrace, now)) {
							tearDown(session, null);
							reaped.incrementAndGet();
							return null;
						}
						return session;
				}
			});
		}

		if (reaped.get() > 0) {
			metrics.recordReaped(reaped.get());
			log.info("Reaped {} idle session(s), {} remaining", reaped.get(), sessionTable.size());
		}
		return reaped.get();
	}

	@Scheduled(fixedRateString = "${signaling.sweep-interval-ms:30000}")
	public void sweep() {
		reapIdleSessions(clock.instant());
	}

	public SessionSnapshot snapshot(SessionId sessionId) {
		return sessionTable.inspect(sessionId, session -> SessionSnapshot.builder()
						.sessionId(session.getId())
						.phase(session.getPhase())
						.participants(session.getParticipants().size())
						.established(session.getEstablishedCount())
						.pendingMessages(session.getPendingCount())
						.createdAt(session.getCreatedAt())
						.lastActivity(session.getLastActivity())
						.build())
				.orElseGet(() -> SessionSnapshot.empty(sessionId));
	}

	public SessionPhase phase(SessionId sessionId) {
		return snapshot(sessionId).getPhase();
	}

	public Map<SessionPhase, Integer> countByPhase() {
		return sessionTable.countByPhase();
	}

	private static void requireParticipant(Session session, Participant participant) {
		if (!session.isParticipant(participant)) {
			throw new SignalingException(ErrorCode.NOT_A_PARTICIPANT,
					"Participant " + participant.getId() + " is not part of session " + session.getId());
		}
	}

	private void expire(Session session, String reason) {
		// the reason already names the dropped count
		session.drainPending();
		for (Participant p : session.getParticipants()) {
			p.send(new SignalingMessage.Error(ErrorCode.SESSION_EXPIRED, reason));
			metrics.recordErrorReported(ErrorCode.SESSION_EXPIRED);
		}
		log.warn("Expiring session {}: {}", session.getId(), reason);
		tearDown(session, null);
	}

	/**
	 * Final step for every session leaving the table. Must run inside the session's critical
	 * section; the caller returns {@code null} to remove the entry. {@code departed} is the
	 * participant whose channel is already gone, if any.
	 */
	private void tearDown(Session session, Participant departed) {
		int dropped = session.getPendingCount();
		if (dropped > 0) {
			session.drainPending();
			String reason = "Session " + session.getId() + " closed; " + dropped + " buffered message(s) dropped";
			for (Participant p : session.getParticipants()) {
				if (p != departed) {
					p.send(new SignalingMessage.Error(ErrorCode.SESSION_CLOSING, reason));
					metrics.recordErrorReported(ErrorCode.SESSION_CLOSING);
				}
			}
			log.warn("Dropping {} buffered message(s) of session {} on teardown", dropped, session.getId());
		}
		for (Participant p : session.getParticipants()) {
			if (p != departed) {
				p.close();
			}
		}
	}

	private static boolean expired(Instant since, Duration timeout, Instant now) {
		return !since.plus(timeout).isAfter(now);
	}

	private static int payloadLength(SignalingMessage message) {
		if (message instanceof SignalingMessage.Negotiation) {
			return ((SignalingMessage.Negotiation) message).getPayload().length;
		}
		return 0;
	}

}
