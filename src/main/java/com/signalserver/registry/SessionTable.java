package com.signalserver.registry;

import com.signalserver.protocol.SessionId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Concurrent map from {@link SessionId} to {@link Session}.
 * <p>
 * Mutations run inside {@link ConcurrentHashMap#compute}, which serializes callers per key;
 * operations on one session never wait on another session's entry. Remapping functions
 * must stay short and must not touch the network.
 */
@Component
public class SessionTable {

	private final Map<SessionId, Session> sessions = new ConcurrentHashMap<>();

	/**
	 * Atomically create, update or remove (return {@code null}) the entry for {@code id}.
	 */
	public Session compute(SessionId id, BiFunction<SessionId, Session, Session> mutation) {
		return sessions.compute(id, mutation);
	}

	/**
	 * Like {@link #compute} but only runs when an entry exists.
	 *
	 * @return the new value, or {@code null} if there was no entry or it was removed
	 */
	public Session computeIfPresent(SessionId id, BiFunction<SessionId, Session, Session> mutation) {
		return sessions.computeIfPresent(id, mutation);
	}

	/**
	 * Read a consistent view of one entry under its lock.
	 */
	public <T> Optional<T> inspect(SessionId id, Function<Session, T> reader) {
		List<T> result = new ArrayList<>(1);
		sessions.computeIfPresent(id, (key, session) -> {
			result.add(reader.apply(session));
			return session;
		});
		return result.isEmpty() ? Optional.empty() : Optional.ofNullable(result.get(0));
	}

	public List<SessionId> ids() {
		return new ArrayList<>(sessions.keySet());
	}

	public int size() {
		return sessions.size();
	}

	public Map<SessionPhase, Integer> countByPhase() {
		Map<SessionPhase, Integer> counts = new EnumMap<>(SessionPhase.class);
		for (Session session : sessions.values()) {
			counts.merge(session.getPhase(), 1, Integer::sum);
		}
		return counts;
	}

}
