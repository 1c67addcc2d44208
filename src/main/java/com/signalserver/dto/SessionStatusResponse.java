package com.signalserver.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStatusResponse {

	private String sessionId;
	private String phase;
	private int participants;
	private int established;
	private int pendingMessages;
	private Instant createdAt;
	private Instant lastActivity;

}
