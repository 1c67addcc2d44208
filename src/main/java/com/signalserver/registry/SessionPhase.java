package com.signalserver.registry;

public enum SessionPhase {

	/** No entry exists for the id. */
	EMPTY,
	/** One participant registered. */
	WAITING,
	/** Two participants registered, relay active. */
	PAIRED,
	/** Both reported a direct link; channels are being torn down and nothing is relayed. */
	CLOSING,
	/** Terminal; the entry has been removed. */
	CLOSED

}
