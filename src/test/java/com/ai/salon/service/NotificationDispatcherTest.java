package com.ai.salon.service;

import com.ai.salon.config.NotificationProperties;
import com.ai.salon.entity.NotificationOutbox;
import com.ai.salon.exception.DependencyUnavailableException;
import com.ai.salon.repository.NotificationOutboxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    private static final String SUPERVISOR_URL = "http://supervisor.test/hook";
    private static final String CALLBACK_URL = "http://agent.test/callback";

    @Mock
    private NotificationOutboxRepository repository;

    @Mock
    private WebhookClient webhookClient;

    private NotificationProperties properties;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new NotificationProperties();
        properties.setSupervisorWebhookUrl(SUPERVISOR_URL);
        properties.setAgentCallbackUrl(CALLBACK_URL);
        dispatcher = new NotificationDispatcher(repository, webhookClient, properties);
    }

    private static NotificationOutbox notification(NotificationOutbox.Channel channel) {
        return NotificationOutbox.builder()
                .channel(channel)
                .aggregateId("req-1")
                .payload("{\"event\":\"help_request_created\"}")
                .maxRetries(3)
                .nextRetryAt(Instant.now())
                .build();
    }

    @Test
    void deliveredNotificationIsMarkedSent() {
        NotificationOutbox n = notification(NotificationOutbox.Channel.SUPERVISOR);

        dispatcher.dispatch(n);

        verify(webhookClient).post(SUPERVISOR_URL, n.getPayload());
        verify(repository).save(n);
        assertThat(n.getStatus()).isEqualTo(NotificationOutbox.Status.SENT);
        assertThat(n.getSentAt()).isNotNull();
    }

    @Test
    void callbackGoesToTheAgentUrl() {
        NotificationOutbox n = notification(NotificationOutbox.Channel.AGENT_CALLBACK);

        dispatcher.dispatch(n);

        verify(webhookClient).post(CALLBACK_URL, n.getPayload());
    }

    @Test
    void failureSchedulesARetryWithBackoff() {
        NotificationOutbox n = notification(NotificationOutbox.Channel.SUPERVISOR);
        doThrow(new DependencyUnavailableException("Webhook returned 502")).when(webhookClient).post(anyString(), anyString());
        Instant before = Instant.now();

        dispatcher.dispatch(n);

        assertThat(n.getStatus()).isEqualTo(NotificationOutbox.Status.RETRY_SCHEDULED);
        assertThat(n.getRetryCount()).isEqualTo(1);
        assertThat(n.getLastError()).contains("502");
        assertThat(n.getNextRetryAt()).isAfterOrEqualTo(before.plusSeconds(30));
    }

    @Test
    void lastAttemptFailsPermanently() {
        NotificationOutbox n = notification(NotificationOutbox.Channel.SUPERVISOR);
        n.setRetryCount(2);
        n.setStatus(NotificationOutbox.Status.RETRY_SCHEDULED);
        doThrow(new DependencyUnavailableException("timeout")).when(webhookClient).post(anyString(), anyString());

        dispatcher.dispatch(n);

        assertThat(n.getStatus()).isEqualTo(NotificationOutbox.Status.FAILED);
        assertThat(n.getRetryCount()).isEqualTo(3);
    }

    @Test
    void missingUrlSkipsWithoutCalling() {
        properties.setSupervisorWebhookUrl(" ");
        NotificationOutbox n = notification(NotificationOutbox.Channel.SUPERVISOR);

        dispatcher.dispatch(n);

        verify(webhookClient, never()).post(anyString(), anyString());
        assertThat(n.getStatus()).isEqualTo(NotificationOutbox.Status.SKIPPED);
    }

    @Test
    void backoffDoublesUpToTheCap() {
        assertThat(dispatcher.backoff(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(dispatcher.backoff(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(dispatcher.backoff(3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(dispatcher.backoff(20)).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void pollDispatchesEveryReadyRow() {
        NotificationOutbox first = notification(NotificationOutbox.Channel.SUPERVISOR);
        NotificationOutbox second = notification(NotificationOutbox.Channel.AGENT_CALLBACK);
        when(repository.findByStatusInAndNextRetryAtLessThanEqualOrderByCreatedAtAsc(anyCollection(), any(Instant.class),
                any(Pageable.class))).thenReturn(List.of(first, second));

        dispatcher.dispatchPending();

        assertThat(first.getStatus()).isEqualTo(NotificationOutbox.Status.SENT);
        assertThat(second.getStatus()).isEqualTo(NotificationOutbox.Status.SENT);
    }
}
