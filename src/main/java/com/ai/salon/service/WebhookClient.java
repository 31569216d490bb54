package com.ai.salon.service;

/**
 * Outbound JSON webhook.
 */
public interface WebhookClient {

    /**
     * POSTs {@code jsonPayload} to {@code url}.
     *
     * @throws com.ai.salon.exception.DependencyUnavailableException on timeout, transport failure or a non-2xx answer
     */
    void post(String url, String jsonPayload);
}
