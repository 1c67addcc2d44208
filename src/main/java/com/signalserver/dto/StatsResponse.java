package com.signalserver.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {

	private int activeSessions;
	private Map<String, Integer> sessionsByPhase;
	private long connectionsOpened;
	private long sessionsPaired;
	private long sessionsEstablished;
	private long sessionsAbandoned;
	private long sessionsReaped;
	private long messagesRelayed;
	private long payloadBytesRelayed;
	private long messagesBuffered;
	private long decodeErrors;
	private Map<String, Long> errorsReported;
	private boolean discoveryRunning;
	private Integer discoveryPort;
	private long discoveryResponses;
	private long discoveryDropped;

}
