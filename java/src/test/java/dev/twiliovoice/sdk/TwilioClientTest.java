package dev.twiliovoice.sdk;

import dev.twiliovoice.sdk.endpoints.accounts.AccountResource;
import dev.twiliovoice.sdk.endpoints.accounts.AccountType;
import dev.twiliovoice.sdk.endpoints.accounts.FetchAccount;
import dev.twiliovoice.sdk.endpoints.voice.CallPage;
import dev.twiliovoice.sdk.endpoints.voice.CallQuery;
import dev.twiliovoice.sdk.endpoints.voice.CallResource;
import dev.twiliovoice.sdk.endpoints.voice.CallStatus;
import dev.twiliovoice.sdk.endpoints.voice.CreateCall;
import dev.twiliovoice.sdk.endpoints.voice.CreateCallBody;
import dev.twiliovoice.sdk.endpoints.voice.DeleteCall;
import dev.twiliovoice.sdk.endpoints.voice.ListCalls;
import dev.twiliovoice.sdk.endpoints.voice.StopStream;
import dev.twiliovoice.sdk.endpoints.voice.StreamResource;
import dev.twiliovoice.sdk.endpoints.voice.StreamStatus;
import dev.twiliovoice.sdk.webhook.WebhookRequests;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import static org.junit.jupiter.api.Assertions.*;

class TwilioClientTest {

    private static final String CALL_JSON = "{\"sid\":\"CA42\",\"account_sid\":\"AC123\",\"to\":\"+15550001111\","
        + "\"from\":\"+15550002222\",\"status\":\"queued\",\"api_version\":\"2010-04-01\","
        + "\"date_created\":\"Tue, 31 Aug 2010 20:36:28 +0000\",\"uri\":\"/2010-04-01/Accounts/AC123/Calls/CA42.json\"}";

    private HttpServer server;
    private URI baseUri;
    private volatile String lastMethod;
    private volatile String lastPath;
    private volatile String lastQuery;
    private volatile String lastBody;
    private volatile String lastAuthorization;
    private volatile String lastContentType;
    private final AtomicInteger requests = new AtomicInteger();

    private final DelegatingHandler apiHandler = new DelegatingHandler();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        apiHandler.delegate = exchange -> respond(exchange, 201, CALL_JSON);
        server.createContext("/2010-04-01", new RecordingHandler(apiHandler));
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        requests.set(0);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void createCallPostsFormBodyWithBasicAuth() throws Exception {
        TwilioClient client = new TwilioClient(config().build());

        CallResource call = client.hit(new CreateCall("AC123",
            CreateCallBody.of("+15550001111", "+15550002222", "https://example.com/twiml")));

        assertEquals("CA42", call.sid());
        assertEquals(CallStatus.QUEUED, call.status());
        assertEquals("Tue, 31 Aug 2010 20:36:28 +0000", call.dateCreated());
        assertEquals("POST", lastMethod);
        assertEquals("/2010-04-01/Accounts/AC123/Calls.json", lastPath);
        assertEquals("application/x-www-form-urlencoded", lastContentType);
        assertEquals(basic("AC123", "token"), lastAuthorization);

        Map<String, String> form = WebhookRequests.parseForm(lastBody);
        assertEquals(Map.of("To", "+15550001111", "From", "+15550002222", "Url", "https://example.com/twiml"), form);
    }

    @Test
    void apiKeyPairTakesPrecedenceForAuthentication() throws Exception {
        TwilioClient client = new TwilioClient(config().apiKey("SK1").apiKeySecret("key-secret").build());

        client.createCallWithUrl("+15550001111", "+15550002222", "https://example.com/twiml");

        assertEquals(basic("SK1", "key-secret"), lastAuthorization);
    }

    @Test
    void createCallWithTwimlSendsInlineDocument() throws Exception {
        TwilioClient client = new TwilioClient(config().build());

        client.createCallWithTwiml("+15550001111", "+15550002222", "<Response><Reject /></Response>");

        Map<String, String> form = WebhookRequests.parseForm(lastBody);
        assertEquals("<Response><Reject /></Response>", form.get("Twiml"));
        assertFalse(form.containsKey("Url"));
    }

    @Test
    void updateCallWithUrlTargetsCallResource() throws Exception {
        apiHandler.delegate = exchange -> respond(exchange, 200, CALL_JSON);
        TwilioClient client = new TwilioClient(config().build());

        client.updateCallWithUrl("CA42", "https://example.com/next");

        assertEquals("POST", lastMethod);
        assertEquals("/2010-04-01/Accounts/AC123/Calls/CA42.json", lastPath);
        assertEquals(Map.of("Url", "https://example.com/next"), WebhookRequests.parseForm(lastBody));
    }

    @Test
    void unauthorizedSurfacesApiError() {
        apiHandler.delegate = exchange -> respond(exchange, 401,
            "{\"code\":20003,\"message\":\"Authenticate\",\"more_info\":\"https://www.twilio.com/docs/errors/20003\",\"status\":401}");
        TwilioClient client = new TwilioClient(config().build());

        TwilioApiException ex = assertThrows(TwilioApiException.class, () -> client.hit(new FetchAccount("AC123")));
        assertEquals(401, ex.getStatusCode());
        assertEquals(20003, ex.getCode());
        assertEquals("Authenticate", ex.getMessage());
        assertEquals("https://www.twilio.com/docs/errors/20003", ex.getMoreInfo());
        assertEquals(1, requests.get());
    }

    @Test
    void nonJsonErrorBodyBecomesMessage() {
        apiHandler.delegate = exchange -> respond(exchange, 502, "Bad Gateway");
        TwilioClient client = new TwilioClient(config().build());

        TwilioApiException ex = assertThrows(TwilioApiException.class, () -> client.hit(new FetchAccount("AC123")));
        assertEquals(502, ex.getStatusCode());
        assertNull(ex.getCode());
        assertEquals("Bad Gateway", ex.getMessage());
    }

    @Test
    void malformedSuccessBodyRaisesDeserializationError() {
        apiHandler.delegate = exchange -> respond(exchange, 200, "{\"sid\": ");
        TwilioClient client = new TwilioClient(config().build());

        assertThrows(DeserializationException.class, () -> client.hit(new FetchAccount("AC123")));
    }

    @Test
    void emptySuccessBodyRaisesDeserializationError() {
        apiHandler.delegate = exchange -> respond(exchange, 200, "");
        TwilioClient client = new TwilioClient(config().build());

        assertThrows(DeserializationException.class, () -> client.hit(new FetchAccount("AC123")));
    }

    @Test
    void unknownEnumValueRaisesDeserializationError() {
        apiHandler.delegate = exchange -> respond(exchange, 200, "{\"sid\":\"CA42\",\"status\":\"exploded\"}");
        TwilioClient client = new TwilioClient(config().build());

        assertThrows(DeserializationException.class,
            () -> client.createCallWithUrl("+15550001111", "+15550002222", "https://example.com/twiml"));
    }

    @Test
    void fetchAccountDecodesResource() throws Exception {
        apiHandler.delegate = exchange -> respond(exchange, 200,
            "{\"sid\":\"AC123\",\"friendly_name\":\"Main\",\"status\":\"active\",\"type\":\"Full\",\"auth_token\":\"secret\"}");
        TwilioClient client = new TwilioClient(config().build());

        AccountResource account = client.hit(new FetchAccount("AC123"));

        assertEquals("GET", lastMethod);
        assertEquals("/2010-04-01/Accounts/AC123.json", lastPath);
        assertNull(lastContentType);
        assertEquals("Main", account.friendlyName());
        assertEquals(AccountType.FULL, account.type());
        assertFalse(account.toString().contains("secret"));
    }

    @Test
    void listCallsSendsFiltersAsQueryString() throws Exception {
        apiHandler.delegate = exchange -> respond(exchange, 200, "{\"calls\":[" + CALL_JSON + "],\"page\":0,"
            + "\"page_size\":20,\"uri\":\"/2010-04-01/Accounts/AC123/Calls.json?PageSize=20\","
            + "\"next_page_uri\":\"/2010-04-01/Accounts/AC123/Calls.json?Page=1&PageSize=20&PageToken=PA1\"}");
        TwilioClient client = new TwilioClient(config().build());

        CallPage page = client.hit(new ListCalls("AC123",
            new CallQuery().status(CallStatus.COMPLETED).startTimeAfter("2024-01-01").pageSize(20)));

        assertEquals("GET", lastMethod);
        assertEquals("Status=completed&StartTime%3E=2024-01-01&PageSize=20", lastQuery);
        assertEquals(1, page.calls().size());
        assertEquals(20, page.pageSize());
        assertTrue(page.pageInfo().hasNextPage());
    }

    @Test
    void deleteCallReturnsNullOnNoContent() throws Exception {
        apiHandler.delegate = exchange -> {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        };
        TwilioClient client = new TwilioClient(config().build());

        assertNull(client.hit(new DeleteCall("AC123", "CA42")));
        assertEquals("DELETE", lastMethod);
        assertEquals("/2010-04-01/Accounts/AC123/Calls/CA42.json", lastPath);
    }

    @Test
    void stopStreamPostsStoppedStatus() throws Exception {
        apiHandler.delegate = exchange -> respond(exchange, 200,
            "{\"sid\":\"MZ1\",\"call_sid\":\"CA42\",\"name\":\"audio\",\"status\":\"stopped\"}");
        TwilioClient client = new TwilioClient(config().build());

        StreamResource stream = client.hit(new StopStream("AC123", "CA42", "audio"));

        assertEquals("/2010-04-01/Accounts/AC123/Calls/CA42/Streams/audio.json", lastPath);
        assertEquals("Status=stopped", lastBody);
        assertEquals(StreamStatus.STOPPED, stream.status());
    }

    @Test
    void connectionFailureRaisesTransportError() {
        TwilioClient client = new TwilioClient(config().build());
        server.stop(0);
        server = null;

        TransportException ex = assertThrows(TransportException.class, () -> client.hit(new FetchAccount("AC123")));
        assertNotNull(ex.getCause());
    }

    @Test
    void withPhoneNumberKeepsCredentials() {
        TwilioClient client = new TwilioClient(config().build());

        TwilioClient copy = client.withPhoneNumber("+15550009999");

        assertEquals("+15550009999", copy.phoneNumber().orElseThrow());
        assertTrue(client.phoneNumber().isEmpty());
        assertEquals("AC123", copy.accountSid());
        assertEquals("token", copy.authToken());
        assertEquals(client.baseUrl(), copy.baseUrl());
    }

    private Config.Builder config() {
        return Config.builder()
            .accountSid("AC123")
            .authToken("token")
            .baseUrl(baseUri.toString())
            .httpClient(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build())
            .httpTimeout(Duration.ofSeconds(5));
    }

    private static String basic(String username, String password) {
        String credentials = username + ':' + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private class RecordingHandler implements HttpHandler {
        private final HttpHandler next;

        RecordingHandler(HttpHandler next) {
            this.next = next;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            requests.incrementAndGet();
            lastMethod = exchange.getRequestMethod();
            lastPath = exchange.getRequestURI().getPath();
            lastQuery = exchange.getRequestURI().getRawQuery();
            lastAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
            lastContentType = exchange.getRequestHeaders().getFirst("Content-Type");
            lastBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            next.handle(exchange);
        }
    }

    private static class DelegatingHandler implements HttpHandler {
        volatile HttpHandler delegate;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (delegate == null) {
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            } else {
                delegate.handle(exchange);
            }
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
