package mail.archiver.app.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.entity.MailAccount;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * App-only (client credentials) access tokens for Microsoft Graph, cached per account.
 */
@Slf4j
@Service
public class GraphTokenService {
    // Refresh tokens that expire within the next 5 minutes
    private static final long EXPIRY_MARGIN_SECONDS = 300;

    private final ArchiverProperties.Graph settings;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Map<Long, CachedToken> tokens = new ConcurrentHashMap<>();

    private static class CachedToken {
        final String accessToken;
        final Instant expiry;

        CachedToken(String accessToken, Instant expiry) {
            this.accessToken = accessToken;
            this.expiry = expiry;
        }
    }

    public GraphTokenService(ArchiverProperties properties) {
        this.settings = properties.getGraph();
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Returns a cached token, or requests a new one when none is cached or it is about to expire.
     */
    public String ensureValidAccessToken(MailAccount account) {
        CachedToken cached = tokens.get(account.getId());
        if (cached != null && cached.expiry.isAfter(Instant.now().plusSeconds(EXPIRY_MARGIN_SECONDS))) {
            return cached.accessToken;
        }
        return requestToken(account);
    }

    /**
     * Drops the cached token after Graph answered 401 and fetches a fresh one.
     */
    public String refreshTokenOn401(MailAccount account) {
        log.info("Received 401, requesting new Graph token for account: {}", account.getName());
        tokens.remove(account.getId());
        return requestToken(account);
    }

    private String requestToken(MailAccount account) {
        validateClientCredentials(account);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", account.getClientId());
        body.add("client_secret", account.getClientSecret());
        body.add("scope", settings.getScope());
        body.add("grant_type", "client_credentials");

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(
                String.format(settings.getTokenUrl(), account.getTenantId()),
                new HttpEntity<>(body, headers),
                String.class
            );
        } catch (ResourceAccessException e) {
            throw new MailSourceException("Token endpoint unreachable: " + e.getMessage(), e, true);
        } catch (HttpStatusCodeException e) {
            boolean transientFailure = e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429;
            throw new MailSourceException("Token request for " + account.getName() + " failed with "
                + e.getStatusCode() + ": " + e.getResponseBodyAsString(), e, transientFailure);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new MailSourceException("Token request failed. Status: " + response.getStatusCode(), false);
        }
        try {
            JsonNode json = objectMapper.readTree(response.getBody());
            if (!json.has("access_token")) {
                throw new MailSourceException("Token response missing access_token", false);
            }
            String accessToken = json.get("access_token").asText();
            long expiresInSeconds = json.has("expires_in") ? json.get("expires_in").asLong() : 3600;
            Instant expiry = Instant.now().plusSeconds(expiresInSeconds);
            tokens.put(account.getId(), new CachedToken(accessToken, expiry));
            log.info("Graph token acquired for account: {}, expires at: {}", account.getName(), expiry);
            return accessToken;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new MailSourceException("Unreadable token response: " + e.getMessage(), e, false);
        }
    }

    private void validateClientCredentials(MailAccount account) {
        if (isBlank(account.getTenantId()) || isBlank(account.getClientId()) || isBlank(account.getClientSecret())) {
            throw new MailSourceException("Graph app registration (tenant, client id, secret) is incomplete for account: "
                + account.getName(), false);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
