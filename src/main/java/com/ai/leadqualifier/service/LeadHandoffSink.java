package com.ai.leadqualifier.service;

import com.ai.leadqualifier.conversation.QualificationResult;

import java.util.Optional;

/**
 * Receives terminal qualification results destined for the lead database.
 */
public interface LeadHandoffSink {

    /**
     * Records the result's CRM payload.
     *
     * @return id of the created lead, or empty when nothing was recorded
     *         (result not meant for the CRM, or the write failed)
     */
    Optional<Long> submit(QualificationResult result);
}
