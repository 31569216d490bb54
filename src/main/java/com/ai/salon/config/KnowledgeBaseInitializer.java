package com.ai.salon.config;

import com.ai.salon.service.KnowledgeBaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Loads the curated FAQ file into the knowledge index on startup and re-syncs it
 * periodically. Safe to re-run in UPSERT mode.
 */
@Component
public class KnowledgeBaseInitializer {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseInitializer.class);

    private final KnowledgeBaseService knowledgeBaseService;

    public KnowledgeBaseInitializer(KnowledgeBaseService knowledgeBaseService) {
        this.knowledgeBaseService = knowledgeBaseService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        sync("startup");
    }

    @Scheduled(fixedDelayString = "${knowledge.refresh-interval:PT30M}",
            initialDelayString = "${knowledge.refresh-interval:PT30M}")
    public void refresh() {
        sync("refresh");
    }

    private void sync(String trigger) {
        try {
            int synced = knowledgeBaseService.reloadFaq();
            log.info("KnowledgeBaseInitializer ({}): {} FAQ entries synced", trigger, synced);
        } catch (RuntimeException e) {
            log.warn("FAQ sync on {} failed; FAQ tier keeps working from the file: {}", trigger, e.getMessage());
        }
    }
}
