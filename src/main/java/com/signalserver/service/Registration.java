package com.signalserver.service;

import com.signalserver.registry.Participant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of {@link SessionSupervisor#register}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Registration {

	public enum Status {
		WAITING,
		PAIRED
	}

	Status status;
	Participant counterpart;

	public static Registration waiting() {
		return new Registration(Status.WAITING, null);
	}

	public static Registration paired(Participant counterpart) {
		return new Registration(Status.PAIRED, counterpart);
	}

	public Optional<Participant> getCounterpart() {
		return Optional.ofNullable(counterpart);
	}

}
