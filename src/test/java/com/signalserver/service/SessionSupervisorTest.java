package com.signalserver.service;

import com.signalserver.config.SignalingProperties;
import com.signalserver.exception.SignalingException;
import com.signalserver.metrics.SignalingMetricsTracker;
import com.signalserver.protocol.ErrorCode;
import com.signalserver.protocol.SessionId;
import com.signalserver.protocol.SignalingMessage;
import com.signalserver.registry.SessionPhase;
import com.signalserver.registry.SessionTable;
import com.signalserver.support.MutableClock;
import com.signalserver.support.RecordingParticipant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SessionSupervisorTest {

	private static final SessionId SESSION = SessionId.of(1);

	private SessionTable table;
	private SignalingProperties properties;
	private SignalingMetricsTracker metrics;
	private MutableClock clock;
	private SessionSupervisor supervisor;

	private RecordingParticipant alice;
	private RecordingParticipant bob;

	@BeforeEach
	void setUp() {
		table = new SessionTable();
		properties = new SignalingProperties();
		metrics = new SignalingMetricsTracker(table);
		clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
		supervisor = new SessionSupervisor(table, properties, metrics, clock);
		alice = new RecordingParticipant("alice");
		bob = new RecordingParticipant("bob");
	}

	@Test
	void fullNegotiationEndsWithBothChannelsClosed() {
		assertThat(supervisor.register(SESSION, alice).getStatus()).isEqualTo(Registration.Status.WAITING);
		assertThat(alice.getReceived()).containsExactly(new SignalingMessage.SessionWaiting(SESSION));
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.WAITING);

		Registration second = supervisor.register(SESSION, bob);
		assertThat(second.getStatus()).isEqualTo(Registration.Status.PAIRED);
		assertThat(second.getCounterpart()).contains(alice);
		assertThat(alice.last()).isEqualTo(new SignalingMessage.SessionReady(SESSION));
		assertThat(bob.getReceived()).containsExactly(new SignalingMessage.SessionReady(SESSION));

		SignalingMessage.Offer offer = new SignalingMessage.Offer("sdp-offer".getBytes());
		SignalingMessage.Answer answer = new SignalingMessage.Answer("sdp-answer".getBytes());
		SignalingMessage.Candidate candidate = new SignalingMessage.Candidate("cand".getBytes());
		assertThat(supervisor.relay(SESSION, alice, offer)).contains(bob);
		assertThat(supervisor.relay(SESSION, bob, answer)).contains(alice);
		supervisor.relay(SESSION, alice, candidate);
		assertThat(bob.receivedOfType(SignalingMessage.Offer.class)).containsExactly(offer);
		assertThat(bob.receivedOfType(SignalingMessage.Candidate.class)).containsExactly(candidate);
		assertThat(alice.receivedOfType(SignalingMessage.Answer.class)).containsExactly(answer);

		assertThat(supervisor.reportEstablished(SESSION, alice)).isFalse();
		assertThat(alice.isOpen()).isTrue();
		assertThat(bob.isOpen()).isTrue();

		assertThat(supervisor.reportEstablished(SESSION, bob)).isTrue();
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.CLOSING);
		assertThat(alice.last()).isEqualTo(new SignalingMessage.SessionClosed(SESSION));
		assertThat(bob.last()).isEqualTo(new SignalingMessage.SessionClosed(SESSION));
		assertThat(alice.isClosed()).isTrue();
		assertThat(bob.isClosed()).isTrue();

		supervisor.participantLeft(SESSION, alice);
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.CLOSING);
		supervisor.participantLeft(SESSION, bob);
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.EMPTY);

		SignalingMetricsTracker.Snapshot snapshot = metrics.snapshot();
		assertThat(snapshot.getSessionsPaired()).isEqualTo(1);
		assertThat(snapshot.getSessionsEstablished()).isEqualTo(1);
		assertThat(snapshot.getMessagesRelayed()).isEqualTo(3);
		assertThat(snapshot.getPayloadBytesRelayed()).isEqualTo("sdp-offer".length() + "sdp-answer".length() + 4);
	}

	@Test
	void thirdParticipantIsRejectedWithoutDisturbingThePair() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		RecordingParticipant carol = new RecordingParticipant("carol");
		List<SignalingMessage> aliceBefore = alice.getReceived();
		List<SignalingMessage> bobBefore = bob.getReceived();

		SignalingException error = catchThrowableOfType(
				() -> supervisor.register(SESSION, carol), SignalingException.class);

		assertThat(error.getErrorCode()).isEqualTo(ErrorCode.SESSION_FULL);
		assertThat(carol.getReceived()).isEmpty();
		assertThat(alice.getReceived()).isEqualTo(aliceBefore);
		assertThat(bob.getReceived()).isEqualTo(bobBefore);
		assertThat(supervisor.relay(SESSION, alice, new SignalingMessage.Offer(new byte[] {1}))).contains(bob);
	}

	@Test
	void messagesArriveInSendOrder() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		List<SignalingMessage.Candidate> sent = new ArrayList<>();
		for (int i = 0; i < 50; i++) {
			SignalingMessage.Candidate candidate = new SignalingMessage.Candidate(new byte[] {(byte) i});
			sent.add(candidate);
			supervisor.relay(SESSION, alice, candidate);
		}

		assertThat(bob.receivedOfType(SignalingMessage.Candidate.class)).containsExactlyElementsOf(sent);
	}

	@Test
	void relayWhileWaitingIsRejectedWhenBufferingDisabled() {
		supervisor.register(SESSION, alice);

		SignalingException error = catchThrowableOfType(
				() -> supervisor.relay(SESSION, alice, new SignalingMessage.Offer(new byte[] {1})),
				SignalingException.class);

		assertThat(error.getErrorCode()).isEqualTo(ErrorCode.NO_COUNTERPART);
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.WAITING);
	}

	@Test
	void bufferedMessagesAreFlushedToTheSecondParticipantAfterReady() {
		properties.setPendingMessageLimit(3);
		supervisor.register(SESSION, alice);
		SignalingMessage.Offer offer = new SignalingMessage.Offer("o".getBytes());
		SignalingMessage.Candidate c1 = new SignalingMessage.Candidate("c1".getBytes());
		SignalingMessage.Candidate c2 = new SignalingMessage.Candidate("c2".getBytes());

		assertThat(supervisor.relay(SESSION, alice, offer)).isEmpty();
		assertThat(supervisor.relay(SESSION, alice, c1)).isEmpty();
		assertThat(supervisor.relay(SESSION, alice, c2)).isEmpty();
		SignalingException overflow = catchThrowableOfType(
				() -> supervisor.relay(SESSION, alice, new SignalingMessage.Candidate("c3".getBytes())),
				SignalingException.class);
		assertThat(overflow.getErrorCode()).isEqualTo(ErrorCode.NO_COUNTERPART);
		assertThat(supervisor.snapshot(SESSION).getPendingMessages()).isEqualTo(3);

		supervisor.register(SESSION, bob);

		assertThat(bob.getReceived()).containsExactly(new SignalingMessage.SessionReady(SESSION), offer, c1, c2);
		assertThat(supervisor.snapshot(SESSION).getPendingMessages()).isZero();
		assertThat(metrics.snapshot().getMessagesBuffered()).isEqualTo(3);
	}

	@Test
	void singleConfirmationKeepsSessionPaired() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);

		supervisor.reportEstablished(SESSION, alice);
		supervisor.reportEstablished(SESSION, alice);

		SessionSnapshot snapshot = supervisor.snapshot(SESSION);
		assertThat(snapshot.getPhase()).isEqualTo(SessionPhase.PAIRED);
		assertThat(snapshot.getEstablished()).isEqualTo(1);
		assertThat(alice.isOpen()).isTrue();
		assertThat(bob.isOpen()).isTrue();
	}

	@Test
	void dropDuringConfirmationNotifiesCounterpart() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		supervisor.reportEstablished(SESSION, alice);

		supervisor.participantLeft(SESSION, bob);

		SignalingMessage last = alice.last();
		assertThat(last).isInstanceOf(SignalingMessage.Error.class);
		assertThat(((SignalingMessage.Error) last).getCode()).isEqualTo(ErrorCode.COUNTERPART_LEFT);
		assertThat(alice.isClosed()).isTrue();
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.EMPTY);
		assertThat(metrics.snapshot().getSessionsAbandoned()).isEqualTo(1);
	}

	@Test
	void waitingParticipantLeavingRemovesSession() {
		supervisor.register(SESSION, alice);

		supervisor.participantLeft(SESSION, alice);

		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.EMPTY);
		assertThat(alice.getCloseCalls()).isZero();
	}

	@Test
	void strangerLeavingDoesNotTouchSession() {
		supervisor.register(SESSION, alice);

		supervisor.participantLeft(SESSION, new RecordingParticipant("carol"));

		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.WAITING);
	}

	@Test
	void closedSessionIdCanBeReused() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		supervisor.reportEstablished(SESSION, alice);
		supervisor.reportEstablished(SESSION, bob);
		supervisor.participantLeft(SESSION, alice);
		supervisor.participantLeft(SESSION, bob);

		RecordingParticipant carol = new RecordingParticipant("carol");
		Registration registration = supervisor.register(SESSION, carol);

		assertThat(registration.getStatus()).isEqualTo(Registration.Status.WAITING);
		assertThat(carol.getReceived()).containsExactly(new SignalingMessage.SessionWaiting(SESSION));
	}

	@Test
	void rejectsRelayFromNonParticipant() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);

		SignalingException error = catchThrowableOfType(
				() -> supervisor.relay(SESSION, new RecordingParticipant("mallory"), new SignalingMessage.Offer(new byte[0])),
				SignalingException.class);

		assertThat(error.getErrorCode()).isEqualTo(ErrorCode.NOT_A_PARTICIPANT);
		assertThat(alice.receivedOfType(SignalingMessage.Offer.class)).isEmpty();
		assertThat(bob.receivedOfType(SignalingMessage.Offer.class)).isEmpty();
	}

	@Test
	void rejectsOperationsOnUnknownSession() {
		SignalingException relay = catchThrowableOfType(
				() -> supervisor.relay(SessionId.of(99), alice, new SignalingMessage.Offer(new byte[0])),
				SignalingException.class);
		SignalingException established = catchThrowableOfType(
				() -> supervisor.reportEstablished(SessionId.of(99), alice),
				SignalingException.class);

		assertThat(relay.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_SESSION);
		assertThat(established.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_SESSION);
		assertThat(table.size()).isZero();
	}

	@Test
	void rejectsDoubleRegistration() {
		supervisor.register(SESSION, alice);

		assertThatThrownBy(() -> supervisor.register(SESSION, alice))
				.isInstanceOfSatisfying(SignalingException.class,
						e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PROTOCOL_VIOLATION));
		assertThat(supervisor.snapshot(SESSION).getParticipants()).isEqualTo(1);
	}

	@Test
	void establishedWhileWaitingIsRejected() {
		supervisor.register(SESSION, alice);

		SignalingException error = catchThrowableOfType(
				() -> supervisor.reportEstablished(SESSION, alice), SignalingException.class);

		assertThat(error.getErrorCode()).isEqualTo(ErrorCode.NO_COUNTERPART);
	}

	@Test
	void relayStopsOnceClosing() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		supervisor.reportEstablished(SESSION, alice);
		supervisor.reportEstablished(SESSION, bob);

		SignalingException error = catchThrowableOfType(
				() -> supervisor.relay(SESSION, alice, new SignalingMessage.Candidate(new byte[] {9})),
				SignalingException.class);

		assertThat(error.getErrorCode()).isEqualTo(ErrorCode.SESSION_CLOSING);
		assertThat(bob.receivedOfType(SignalingMessage.Candidate.class)).isEmpty();
		assertThat(supervisor.reportEstablished(SESSION, bob)).isFalse();
	}

	@Test
	void joiningClosingSessionIsRejected() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		supervisor.reportEstablished(SESSION, alice);
		supervisor.reportEstablished(SESSION, bob);

		SignalingException error = catchThrowableOfType(
				() -> supervisor.register(SESSION, new RecordingParticipant("carol")), SignalingException.class);

		assertThat(error.getErrorCode()).isEqualTo(ErrorCode.SESSION_FULL);
	}

	@Test
	void reapsWaitingSessionAfterTimeout() {
		supervisor.register(SESSION, alice);

		assertThat(supervisor.reapIdleSessions(clock.instant().plus(Duration.ofSeconds(119)))).isZero();
		assertThat(supervisor.reapIdleSessions(clock.instant().plus(properties.getWaitingTimeout()))).isEqualTo(1);

		SignalingMessage last = alice.last();
		assertThat(((SignalingMessage.Error) last).getCode()).isEqualTo(ErrorCode.SESSION_EXPIRED);
		assertThat(alice.isClosed()).isTrue();
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.EMPTY);
		assertThat(metrics.snapshot().getSessionsReaped()).isEqualTo(1);
	}

	@Test
	void relayKeepsPairedSessionAlive() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);

		clock.advance(Duration.ofMinutes(4));
		supervisor.relay(SESSION, alice, new SignalingMessage.Candidate(new byte[] {1}));
		clock.advance(Duration.ofMinutes(4));

		assertThat(supervisor.reapIdleSessions(clock.instant())).isZero();

		clock.advance(Duration.ofMinutes(1));
		assertThat(supervisor.reapIdleSessions(clock.instant())).isEqualTo(1);
		assertThat(alice.receivedOfType(SignalingMessage.Error.class)).hasSize(1);
		assertThat(bob.receivedOfType(SignalingMessage.Error.class)).hasSize(1);
		assertThat(alice.isClosed()).isTrue();
		assertThat(bob.isClosed()).isTrue();
	}

	@Test
	void reapsClosingSessionAfterGracePeriod() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		supervisor.reportEstablished(SESSION, alice);
		supervisor.reportEstablished(SESSION, bob);
		supervisor.participantLeft(SESSION, alice);

		assertThat(supervisor.reapIdleSessions(clock.instant().plusSeconds(5))).isZero();
		assertThat(supervisor.reapIdleSessions(clock.instant().plus(properties.getClosingGracePeriod()))).isEqualTo(1);
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.EMPTY);
		assertThat(bob.receivedOfType(SignalingMessage.Error.class)).isEmpty();
	}

	@Test
	void teardownClosesRemainingChannels() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);

		assertThat(supervisor.teardown(SESSION)).isTrue();
		assertThat(supervisor.teardown(SESSION)).isFalse();
		assertThat(alice.isClosed()).isTrue();
		assertThat(bob.isClosed()).isTrue();
	}

	@Test
	void teardownReportsDroppedBufferedMessages() {
		properties.setPendingMessageLimit(2);
		supervisor.register(SESSION, alice);
		supervisor.relay(SESSION, alice, new SignalingMessage.Offer("sdp".getBytes()));

		assertThat(supervisor.teardown(SESSION)).isTrue();

		SignalingMessage last = alice.last();
		assertThat(last).isInstanceOf(SignalingMessage.Error.class);
		SignalingMessage.Error error = (SignalingMessage.Error) last;
		assertThat(error.getCode()).isEqualTo(ErrorCode.SESSION_CLOSING);
		assertThat(error.getReason()).contains("1 buffered message(s) dropped");
		assertThat(alice.isClosed()).isTrue();
		assertThat(metrics.snapshot().getErrorsReported()).containsEntry(ErrorCode.SESSION_CLOSING, 1L);
	}

	@Test
	void teardownWithoutBufferedMessagesClosesQuietly() {
		supervisor.register(SESSION, alice);

		supervisor.teardown(SESSION);

		assertThat(alice.receivedOfType(SignalingMessage.Error.class)).isEmpty();
		assertThat(alice.getCloseCalls()).isEqualTo(1);
	}

	@Test
	void expiredWaitingSessionReportsDroppedMessagesOnce() {
		properties.setPendingMessageLimit(2);
		supervisor.register(SESSION, alice);
		supervisor.relay(SESSION, alice, new SignalingMessage.Candidate(new byte[] {1}));
		supervisor.relay(SESSION, alice, new SignalingMessage.Candidate(new byte[] {2}));

		supervisor.reapIdleSessions(clock.instant().plus(properties.getWaitingTimeout()));

		List<SignalingMessage.Error> errors = alice.receivedOfType(SignalingMessage.Error.class);
		assertThat(errors).hasSize(1);
		assertThat(errors.get(0).getCode()).isEqualTo(ErrorCode.SESSION_EXPIRED);
		assertThat(errors.get(0).getReason()).contains("2 buffered message(s) dropped");
		assertThat(alice.getCloseCalls()).isEqualTo(1);
	}

	@Test
	void lastChannelLeavingClosingSessionRemovesIt() {
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		supervisor.reportEstablished(SESSION, alice);
		supervisor.reportEstablished(SESSION, bob);

		supervisor.participantLeft(SESSION, alice);
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.CLOSING);
		supervisor.participantLeft(SESSION, bob);

		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.EMPTY);
		assertThat(supervisor.teardown(SESSION)).isFalse();
	}

	@Test
	void waitingParticipantLeavingDropsItsBufferedMessages() {
		properties.setPendingMessageLimit(2);
		supervisor.register(SESSION, alice);
		supervisor.relay(SESSION, alice, new SignalingMessage.Offer("sdp".getBytes()));

		supervisor.participantLeft(SESSION, alice);

		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.EMPTY);
		// nobody is left to tell
		assertThat(alice.receivedOfType(SignalingMessage.Error.class)).isEmpty();
		assertThat(alice.getCloseCalls()).isZero();

		supervisor.register(SESSION, bob);
		assertThat(bob.getReceived()).containsExactly(new SignalingMessage.SessionWaiting(SESSION));
	}

	@Test
	void sessionsDoNotInterfere() {
		SessionId other = SessionId.of(2);
		RecordingParticipant carol = new RecordingParticipant("carol");
		RecordingParticipant dave = new RecordingParticipant("dave");
		supervisor.register(SESSION, alice);
		supervisor.register(SESSION, bob);
		supervisor.register(other, carol);
		supervisor.register(other, dave);

		supervisor.relay(SESSION, alice, new SignalingMessage.Offer("x".getBytes()));
		supervisor.participantLeft(other, carol);

		assertThat(bob.receivedOfType(SignalingMessage.Offer.class)).hasSize(1);
		assertThat(dave.receivedOfType(SignalingMessage.Offer.class)).isEmpty();
		assertThat(bob.isOpen()).isTrue();
		assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.PAIRED);
		assertThat(supervisor.phase(other)).isEqualTo(SessionPhase.EMPTY);
	}

	@Test
	void concurrentRegistrationsAdmitAtMostTwo() throws Exception {
		int contenders = 16;
		ExecutorService pool = Executors.newFixedThreadPool(contenders);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<Boolean>> results = new ArrayList<>();
		try {
			for (int i = 0; i < contenders; i++) {
				RecordingParticipant participant = new RecordingParticipant("p" + i);
				results.add(pool.submit(() -> {
					start.await();
					try {
						supervisor.register(SESSION, participant);
						return true;
					} catch (SignalingException e) {
						return false;
					}
				}));
			}
			start.countDown();

			int admitted = 0;
			for (Future<Boolean> result : results) {
				if (result.get(10, TimeUnit.SECONDS)) {
					admitted++;
				}
			}
			assertThat(admitted).isEqualTo(2);
			assertThat(supervisor.snapshot(SESSION).getParticipants()).isEqualTo(2);
			assertThat(supervisor.phase(SESSION)).isEqualTo(SessionPhase.PAIRED);
		} finally {
			pool.shutdownNow();
		}
	}

}
