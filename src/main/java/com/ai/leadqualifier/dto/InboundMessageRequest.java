package com.ai.leadqualifier.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * WhatsApp webhook payload, already normalized by the messaging gateway.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessageRequest {

	private String phone;

	private String message;

	/** Contact display name as shown in WhatsApp. */
	private String name;
}
