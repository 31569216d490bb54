package com.ai.salon.service;

import com.ai.salon.exception.DependencyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Webhook delivery over the shared {@link RestTemplate}, which carries the connect and
 * read timeouts.
 */
@Service
public class RestWebhookClient implements WebhookClient {

    private static final Logger log = LoggerFactory.getLogger(RestWebhookClient.class);

    private final RestTemplate restTemplate;

    public RestWebhookClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void post(String url, String jsonPayload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        HttpEntity<String> request = new HttpEntity<>(jsonPayload, headers);
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, request, String.class);
        } catch (RestClientException e) {
            throw new DependencyUnavailableException("Webhook " + url + " failed: " + e.getMessage(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            log.warn("Webhook {} returned {}", url, response.getStatusCode());
            throw new DependencyUnavailableException("Webhook " + url + " returned " + response.getStatusCode());
        }
    }
}
