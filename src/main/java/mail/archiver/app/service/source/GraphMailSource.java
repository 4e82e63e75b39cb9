package mail.archiver.app.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.ProviderType;
import mail.archiver.app.service.content.MimeSupport;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Microsoft 365 mailbox access through the Graph REST API, authenticated with the
 * account's app registration.
 */
@Slf4j
@Component
public class GraphMailSource implements MailSourceAdapter {
    private static final String MESSAGE_FIELDS = "id,internetMessageId,subject,sentDateTime,receivedDateTime";

    private final GraphTokenService tokenService;
    private final ArchiverProperties.Graph settings;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public GraphMailSource(GraphTokenService tokenService, ArchiverProperties properties) {
        this.tokenService = tokenService;
        this.settings = properties.getGraph();
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.M365;
    }

    @Override
    public MailSourceSession open(MailAccount account) {
        if (account.getEmailAddress() == null || account.getEmailAddress().isBlank()) {
            throw new MailSourceException("Account " + account.getName() + " has no mailbox address", false);
        }
        return new GraphSession(account);
    }

    class GraphSession implements MailSourceSession {
        private final MailAccount account;
        // folder path ("Inbox/Projects") to Graph folder id
        private Map<String, String> folderIds;

        GraphSession(MailAccount account) {
            this.account = account;
        }

        @Override
        public List<String> listFolders() {
            return new ArrayList<>(folderIds().keySet());
        }

        @Override
        public MessageStream fetchMessages(String folder, Instant since) {
            String folderId = requireFolderId(folder);
            UriComponentsBuilder builder = mailbox()
                .pathSegment("mailFolders", folderId, "messages")
                .queryParam("$top", settings.getPageSize())
                .queryParam("$select", MESSAGE_FIELDS)
                .queryParam("$orderby", "receivedDateTime asc");
            if (since != null) {
                builder.queryParam("$filter", "receivedDateTime ge " + DateTimeFormatter.ISO_INSTANT.format(since));
            }
            return new GraphMessageStream(this, builder.build().encode().toUri());
        }

        @Override
        public void deleteMessage(String folder, SourceMessage message) {
            URI uri = mailbox().pathSegment("messages", message.getProviderRef(), "permanentDelete")
                .build().encode().toUri();
            exchange(account, uri, HttpMethod.POST, null, null, String.class);
        }

        @Override
        public boolean pushMessage(String folder, MimeMessage message) {
            String folderId = folderIds().containsKey(folder) ? folderIds().get(folder) : createFolder(folder);
            byte[] mime;
            try {
                mime = MimeSupport.toBytes(message);
            } catch (MessagingException | IOException e) {
                throw new MailSourceException("Cannot serialize message: " + e.getMessage(), e, false);
            }
            URI uri = mailbox().pathSegment("mailFolders", folderId, "messages").build().encode().toUri();
            // Graph accepts a whole MIME message as base64 text
            ResponseEntity<String> response = exchange(account, uri, HttpMethod.POST,
                Base64.getEncoder().encodeToString(mime), MediaType.TEXT_PLAIN, String.class);
            return response.getStatusCode().is2xxSuccessful();
        }

        @Override
        public void close() {
            // stateless HTTP; nothing to release
        }

        JsonNode getJson(URI uri) {
            ResponseEntity<String> response = exchange(account, uri, HttpMethod.GET, null, null, String.class);
            try {
                return objectMapper.readTree(response.getBody() != null ? response.getBody() : "{}");
            } catch (JsonProcessingException e) {
                throw new MailSourceException("Unreadable Graph response: " + e.getMessage(), e, false);
            }
        }

        MimeMessage downloadMime(String messageId) {
            URI uri = mailbox().pathSegment("messages", messageId, "$value").build().encode().toUri();
            ResponseEntity<byte[]> response = exchange(account, uri, HttpMethod.GET, null, null, byte[].class);
            byte[] body = response.getBody() != null ? response.getBody() : new byte[0];
            try {
                return MimeSupport.parse(new ByteArrayInputStream(body));
            } catch (MessagingException e) {
                throw new MailSourceException("Cannot parse MIME of message " + messageId + ": " + e.getMessage(), e, false);
            }
        }

        private UriComponentsBuilder mailbox() {
            return UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl()).pathSegment("users", account.getEmailAddress());
        }

        private String requireFolderId(String folder) {
            String id = folderIds().get(folder);
            if (id == null) {
                throw new MailSourceException("Folder " + folder + " not found in mailbox " + account.getEmailAddress(), false);
            }
            return id;
        }

        private Map<String, String> folderIds() {
            if (folderIds == null) {
                Map<String, String> ids = new LinkedHashMap<>();
                URI root = mailbox().pathSegment("mailFolders").queryParam("$top", 100).build().encode().toUri();
                collectFolders(root, null, ids);
                folderIds = ids;
                log.debug("Mailbox {} has {} folders", account.getEmailAddress(), ids.size());
            }
            return folderIds;
        }

        private void collectFolders(URI uri, String parentPath, Map<String, String> ids) {
            URI next = uri;
            while (next != null) {
                JsonNode page = getJson(next);
                for (JsonNode folder : page.path("value")) {
                    String id = folder.path("id").asText();
                    String name = folder.path("displayName").asText();
                    String path = parentPath == null ? name : parentPath + "/" + name;
                    ids.put(path, id);
                    if (folder.path("childFolderCount").asInt(0) > 0) {
                        URI children = mailbox().pathSegment("mailFolders", id, "childFolders")
                            .queryParam("$top", 100).build().encode().toUri();
                        collectFolders(children, path, ids);
                    }
                }
                next = page.hasNonNull("@odata.nextLink") ? URI.create(page.get("@odata.nextLink").asText()) : null;
            }
        }

        private String createFolder(String folder) {
            URI uri = mailbox().pathSegment("mailFolders").build().encode().toUri();
            ResponseEntity<String> response = exchange(account, uri, HttpMethod.POST,
                Collections.singletonMap("displayName", folder), MediaType.APPLICATION_JSON, String.class);
            try {
                String id = objectMapper.readTree(response.getBody()).path("id").asText();
                folderIds().put(folder, id);
                log.info("Created folder {} in mailbox {}", folder, account.getEmailAddress());
                return id;
            } catch (JsonProcessingException e) {
                throw new MailSourceException("Unreadable folder creation response: " + e.getMessage(), e, false);
            }
        }
    }

    private class GraphMessageStream implements MessageStream {
        private final GraphSession session;
        private URI nextPage;
        private Iterator<JsonNode> current = Collections.emptyIterator();

        GraphMessageStream(GraphSession session, URI firstPage) {
            this.session = session;
            this.nextPage = firstPage;
        }

        @Override
        public int size() {
            return -1;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && nextPage != null) {
                JsonNode page = session.getJson(nextPage);
                List<JsonNode> items = new ArrayList<>();
                page.path("value").forEach(items::add);
                current = items.iterator();
                nextPage = page.hasNonNull("@odata.nextLink") ? URI.create(page.get("@odata.nextLink").asText()) : null;
            }
            return current.hasNext();
        }

        @Override
        public SourceMessage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            JsonNode item = current.next();
            String id = item.path("id").asText();
            try {
                String internetMessageId = item.hasNonNull("internetMessageId") ? item.get("internetMessageId").asText() : null;
                Instant sent = item.hasNonNull("sentDateTime") ? Instant.parse(item.get("sentDateTime").asText()) : null;
                Instant received = item.hasNonNull("receivedDateTime") ? Instant.parse(item.get("receivedDateTime").asText()) : null;
                return new SourceMessage(id, internetMessageId, item.path("subject").asText(null), sent, received,
                    () -> session.downloadMime(id));
            } catch (DateTimeParseException e) {
                throw new MailSourceException("Cannot read envelope of message " + id + ": " + e.getMessage(), e, false);
            }
        }

        @Override
        public void close() {
            current = Collections.emptyIterator();
            nextPage = null;
        }
    }

    /**
     * Sends a Graph request, refreshing the token once when Graph answers 401.
     */
    private <T> ResponseEntity<T> exchange(MailAccount account, URI uri, HttpMethod method, Object body,
                                           MediaType contentType, Class<T> responseType) {
        String token = tokenService.ensureValidAccessToken(account);
        try {
            return send(uri, method, body, contentType, responseType, token);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() != 401) {
                throw toSourceException(method, uri, e);
            }
        } catch (ResourceAccessException e) {
            throw new MailSourceException("Graph unreachable: " + e.getMessage(), e, true);
        }

        token = tokenService.refreshTokenOn401(account);
        try {
            return send(uri, method, body, contentType, responseType, token);
        } catch (HttpStatusCodeException e) {
            throw toSourceException(method, uri, e);
        } catch (ResourceAccessException e) {
            throw new MailSourceException("Graph unreachable: " + e.getMessage(), e, true);
        }
    }

    private <T> ResponseEntity<T> send(URI uri, HttpMethod method, Object body, MediaType contentType,
                                       Class<T> responseType, String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        if (contentType != null) {
            headers.setContentType(contentType);
        }
        return restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), responseType);
    }

    private MailSourceException toSourceException(HttpMethod method, URI uri, HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        boolean transientFailure = status == 429 || e.getStatusCode().is5xxServerError();
        return new MailSourceException("Graph " + method + " " + uri.getPath() + " failed with " + status
            + ": " + e.getResponseBodyAsString(), e, transientFailure);
    }
}
