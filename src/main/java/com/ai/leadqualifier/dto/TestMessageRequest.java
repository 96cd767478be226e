package com.ai.leadqualifier.dto;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class TestMessageRequest {

	private String phone;

	private String message;

	private Map<String, Object> metadata;
}
