package com.ai.leadqualifier.service;

import com.ai.leadqualifier.conversation.QualificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically times out idle conversations and hands them to the CRM.
 */
@Component
public class ConversationReaper {

    private static final Logger log = LoggerFactory.getLogger(ConversationReaper.class);

    private final QualificationEngine engine;
    private final LeadHandoffSink handoffSink;

    public ConversationReaper(QualificationEngine engine, LeadHandoffSink handoffSink) {
        this.engine = engine;
        this.handoffSink = handoffSink;
    }

    @Scheduled(fixedDelayString = "${qualification.reaper.interval-ms:60000}")
    public void reap() {
        List<QualificationResult> timedOut = engine.handleTimeouts();
        for (QualificationResult result : timedOut) {
            handoffSink.submit(result);
        }
        if (!timedOut.isEmpty()) {
            log.info("Reaper timed out {} conversation(s)", timedOut.size());
        } else {
            log.debug("Reaper found no idle conversations");
        }
    }
}
