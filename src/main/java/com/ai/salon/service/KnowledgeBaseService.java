package com.ai.salon.service;

import com.ai.salon.component.FaqCatalog;
import com.ai.salon.config.KnowledgeProperties;
import com.ai.salon.dto.FaqEntry;
import com.ai.salon.dto.KnowledgeItem;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Writes to the knowledge index: curated FAQ sync and items learned from supervisors.
 * Nothing here ever deletes an item.
 */
@Service
public class KnowledgeBaseService {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseService.class);

    private final FaqCatalog faqCatalog;
    private final KnowledgeIndex index;
    private final KnowledgeProperties properties;

    public KnowledgeBaseService(FaqCatalog faqCatalog,
                                KnowledgeIndex index,
                                KnowledgeProperties properties) {
        this.faqCatalog = faqCatalog;
        this.index = index;
        this.properties = properties;
    }

    /**
     * Re-reads the FAQ file and pushes every entry into the index.
     *
     * @return number of FAQ items written
     */
    public int reloadFaq() {
        faqCatalog.reload();
        return syncFaqs();
    }

    public int syncFaqs() {
        List<FaqEntry> faqs = faqCatalog.entries();
        KnowledgeProperties.FaqSyncMode mode = properties.getFaqSyncMode();
        Instant now = Instant.now();
        index.upsert(faqs.stream()
                .map(faq -> new KnowledgeItem(
                        mode == KnowledgeProperties.FaqSyncMode.UPSERT ? faqId(faq.question()) : UUID.randomUUID().toString(),
                        faq.question(),
                        faq.answer(),
                        KnowledgeItem.CATEGORY_FAQ,
                        KnowledgeItem.SOURCE_FAQ,
                        now))
                .toList());
        if (mode == KnowledgeProperties.FaqSyncMode.APPEND && !faqs.isEmpty()) {
            log.warn("FAQ sync in APPEND mode: {} new items written, earlier copies are kept", faqs.size());
        }
        log.info("Synced {} FAQs to knowledge index ({})", faqs.size(), mode);
        return faqs.size();
    }

    /**
     * Stores a supervisor's answer as a learned item.
     */
    public KnowledgeItem addToKnowledgeBase(String question, String answer, String category) {
        KnowledgeItem item = index.upsert(new KnowledgeItem(
                UUID.randomUUID().toString(),
                question,
                answer,
                StringUtils.defaultIfBlank(category, KnowledgeItem.CATEGORY_GENERAL),
                KnowledgeItem.SOURCE_SUPERVISOR,
                Instant.now()));
        log.info("Added new KB item: {}", StringUtils.abbreviate(question, 50));
        return item;
    }

    static String faqId(String question) {
        String normalized = StringUtils.normalizeSpace(question).toLowerCase(Locale.ENGLISH);
        return UUID.nameUUIDFromBytes(("faq:" + normalized).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
