package com.signalserver.registry;

import com.signalserver.protocol.SessionId;
import com.signalserver.protocol.SignalingMessage;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-session state machine: {@code WAITING -> PAIRED -> CLOSING}; removal from the
 * {@link SessionTable} is {@code CLOSED}.
 * <p>
 * Not thread-safe on its own. Every mutation happens inside {@link SessionTable}'s
 * per-key critical section; {@link #getPhase()} may be read without it.
 */
public class Session {

	@Getter
	private final SessionId id;
	@Getter
	private final Instant createdAt;

	private final Participant first;
	private Participant second;
	private volatile SessionPhase phase;

	private final Set<Participant> established = new HashSet<>(2);
	private final Set<Participant> closed = new HashSet<>(2);
	private final Deque<SignalingMessage> pending = new ArrayDeque<>();

	@Getter
	private Instant lastActivity;
	@Getter
	private Instant closingSince;

	public Session(SessionId id, Participant first, Instant now) {
		this.id = id;
		this.first = first;
		this.createdAt = now;
		this.lastActivity = now;
		this.phase = SessionPhase.WAITING;
	}

	public SessionPhase getPhase() {
		return phase;
	}

	public boolean isParticipant(Participant participant) {
		return participant == first || (second != null && participant == second);
	}

	public List<Participant> getParticipants() {
		if (second == null) {
			return Collections.singletonList(first);
		}
		List<Participant> participants = new ArrayList<>(2);
		participants.add(first);
		participants.add(second);
		return participants;
	}

	/**
	 * @return the other participant, or {@code null} while waiting
	 */
	public Participant counterpartOf(Participant participant) {
		if (participant == first) {
			return second;
		}
		if (participant == second) {
			return first;
		}
		throw new IllegalArgumentException("Not a participant of session " + id);
	}

	/**
	 * Admit the second participant.
	 *
	 * @return the participant that was waiting
	 */
	public Participant pair(Participant participant, Instant now) {
		if (phase != SessionPhase.WAITING) {
			throw new IllegalStateException("Session " + id + " cannot pair in phase " + phase);
		}
		second = participant;
		phase = SessionPhase.PAIRED;
		lastActivity = now;
		return first;
	}

	/**
	 * Buffer a message sent before the counterpart arrived.
	 *
	 * @return {@code false} if the buffer already holds {@code limit} messages
	 */
	public boolean buffer(SignalingMessage message, int limit) {
		if (pending.size() >= limit) {
			return false;
		}
		pending.addLast(message);
		return true;
	}

	public int getPendingCount() {
		return pending.size();
	}

	/**
	 * Remove and return buffered messages in arrival order.
	 */
	public List<SignalingMessage> drainPending() {
		List<SignalingMessage> drained = new ArrayList<>(pending);
		pending.clear();
		return drained;
	}

	/**
	 * @return {@code true} once both participants have reported
	 */
	public boolean markEstablished(Participant participant) {
		established.add(participant);
		return second != null && established.contains(first) && established.contains(second);
	}

	public int getEstablishedCount() {
		return established.size();
	}

	public void beginClosing(Instant now) {
		phase = SessionPhase.CLOSING;
		closingSince = now;
	}

	/**
	 * Record that a participant's channel is gone during {@code CLOSING}.
	 *
	 * @return {@code true} once every participant channel is closed
	 */
	public boolean markClosed(Participant participant) {
		closed.add(participant);
		return closed.containsAll(getParticipants());
	}

	public void touch(Instant now) {
		lastActivity = now;
	}

}
