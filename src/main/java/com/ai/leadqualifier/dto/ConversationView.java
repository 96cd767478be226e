package com.ai.leadqualifier.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ai.leadqualifier.conversation.LeadConversation;
import com.ai.leadqualifier.conversation.Message;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Read-only conversation snapshot for the admin endpoints.
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationView {

	private final String phone;

	private final String status;

	private final int score;

	private final int attempts;

	@JsonProperty("collected_data")
	private final Map<String, Object> collectedData;

	@JsonProperty("messages_count")
	private final int messagesCount;

	private final List<Map<String, Object>> messages;

	private final List<String> notes;

	@JsonProperty("started_at")
	private final Instant startedAt;

	@JsonProperty("last_activity_at")
	private final Instant lastActivityAt;

	@JsonProperty("ended_at")
	private final Instant endedAt;

	/** Listing form: no message bodies or notes. */
	public static ConversationView summary(LeadConversation conversation) {
		return base(conversation).build();
	}

	public static ConversationView detail(LeadConversation conversation) {
		List<Map<String, Object>> history = new ArrayList<>();
		for (Message m : conversation.getMessages()) {
			Map<String, Object> entry = new LinkedHashMap<>();
			entry.put("role", m.getRole().value());
			entry.put("content", m.getContent());
			entry.put("timestamp", m.getTimestamp().toString());
			history.add(entry);
		}
		return base(conversation)
				.messages(history)
				.notes(new ArrayList<>(conversation.getNotes()))
				.build();
	}

	private static ConversationViewBuilder base(LeadConversation conversation) {
		return ConversationView.builder()
				.phone(conversation.getPhone())
				.status(conversation.getStatus().value())
				.score(conversation.getScore())
				.attempts(conversation.getAttempts())
				.collectedData(new LinkedHashMap<>(conversation.getCollectedData()))
				.messagesCount(conversation.getMessages().size())
				.startedAt(conversation.getStartedAt())
				.lastActivityAt(conversation.getLastActivityAt())
				.endedAt(conversation.getEndedAt());
	}
}
