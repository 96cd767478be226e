package com.ai.leadqualifier.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Qualification thresholds for an engine instance. Immutable; swapping criteria
 * means replacing the whole instance.
 */
public final class QualificationCriteria {

    private final List<String> requiredFields;
    private final int minScore;
    private final int maxAttempts;
    private final int timeoutMinutes;
    private final BusinessType businessType;

    public QualificationCriteria(List<String> requiredFields, int minScore, int maxAttempts,
                                 int timeoutMinutes, BusinessType businessType) {
        if (minScore < 0 || minScore > 100) {
            throw new IllegalArgumentException("min_score must be within 0-100, got " + minScore);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max_attempts must be >= 1, got " + maxAttempts);
        }
        if (timeoutMinutes <= 0) {
            throw new IllegalArgumentException("timeout_minutes must be > 0, got " + timeoutMinutes);
        }
        this.requiredFields = requiredFields == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(requiredFields));
        this.minScore = minScore;
        this.maxAttempts = maxAttempts;
        this.timeoutMinutes = timeoutMinutes;
        this.businessType = businessType != null ? businessType : BusinessType.DEFAULT;
    }

    public static QualificationCriteria defaults() {
        return new QualificationCriteria(List.of("name", "phone"), 50, 5, 30, BusinessType.DEFAULT);
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    public int getMinScore() {
        return minScore;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getTimeoutMinutes() {
        return timeoutMinutes;
    }

    public BusinessType getBusinessType() {
        return businessType;
    }

    public QualificationCriteria withMinScore(int value) {
        return new QualificationCriteria(requiredFields, value, maxAttempts, timeoutMinutes, businessType);
    }

    public QualificationCriteria withMaxAttempts(int value) {
        return new QualificationCriteria(requiredFields, minScore, value, timeoutMinutes, businessType);
    }

    public QualificationCriteria withTimeoutMinutes(int value) {
        return new QualificationCriteria(requiredFields, minScore, maxAttempts, value, businessType);
    }

    public QualificationCriteria withBusinessType(BusinessType value) {
        return new QualificationCriteria(requiredFields, minScore, maxAttempts, timeoutMinutes, value);
    }

    public QualificationCriteria withRequiredFields(List<String> value) {
        return new QualificationCriteria(value, minScore, maxAttempts, timeoutMinutes, businessType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualificationCriteria)) return false;
        QualificationCriteria that = (QualificationCriteria) o;
        return minScore == that.minScore
                && maxAttempts == that.maxAttempts
                && timeoutMinutes == that.timeoutMinutes
                && requiredFields.equals(that.requiredFields)
                && businessType == that.businessType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(requiredFields, minScore, maxAttempts, timeoutMinutes, businessType);
    }

    @Override
    public String toString() {
        return "QualificationCriteria{requiredFields=" + requiredFields + ", minScore=" + minScore
                + ", maxAttempts=" + maxAttempts + ", timeoutMinutes=" + timeoutMinutes
                + ", businessType=" + businessType.key() + "}";
    }
}
