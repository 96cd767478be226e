package com.ai.leadqualifier.dto;

import java.util.List;

import com.ai.leadqualifier.conversation.BusinessType;
import com.ai.leadqualifier.conversation.QualificationCriteria;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Partial update of the qualification criteria; absent fields keep their current value.
 */
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriteriaUpdateRequest {

	@JsonProperty("min_score")
	private Integer minScore;

	@JsonProperty("max_attempts")
	private Integer maxAttempts;

	@JsonProperty("timeout_minutes")
	private Integer timeoutMinutes;

	@JsonProperty("business_type")
	private String businessType;

	@JsonProperty("required_fields")
	private List<String> requiredFields;

	/**
	 * @throws IllegalArgumentException when a value is out of range
	 */
	public QualificationCriteria applyTo(QualificationCriteria current) {
		QualificationCriteria updated = current;
		if (minScore != null) updated = updated.withMinScore(minScore);
		if (maxAttempts != null) updated = updated.withMaxAttempts(maxAttempts);
		if (timeoutMinutes != null) updated = updated.withTimeoutMinutes(timeoutMinutes);
		if (businessType != null) updated = updated.withBusinessType(BusinessType.fromKey(businessType));
		if (requiredFields != null) updated = updated.withRequiredFields(requiredFields);
		return updated;
	}
}
