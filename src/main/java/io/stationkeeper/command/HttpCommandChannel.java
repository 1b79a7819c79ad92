package io.stationkeeper.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.stationkeeper.util.Jsons;
import io.stationkeeper.worker.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Polls {@code GET <url>/command} for requests ({@code 204} when there is
 * none) and posts results to {@code <url>/result}.
 *
 * <p>The server proves itself with the token configured for the station; a
 * request carrying any other token, or a {@code 401}/{@code 403} answer, raises
 * {@link AuthenticationException}. A request whose text equals the previously
 * consumed one is ignored; the caller keeps that request, so the channel itself
 * holds no state between polls.
 */
public final class HttpCommandChannel implements CommandChannel {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final Logger LOG = LoggerFactory.getLogger(HttpCommandChannel.class);

    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final HttpClient http;

    public HttpCommandChannel(String url, String token) {
        this(url, token, DEFAULT_TIMEOUT);
    }

    public HttpCommandChannel(String url, String token, Duration timeout) {
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.token = token;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public Optional<CommandRequest> poll(CommandRequest previous) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/command"))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = send(request);
        int status = response.statusCode();
        if (status == 204) {
            return Optional.empty();
        }
        rejectUnauthorized(status);
        if (status / 100 != 2) {
            throw new CommandException("failed to poll " + baseUrl + "/command: status=" + status);
        }
        if (response.body() == null || response.body().isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(response.body());
        } catch (IOException e) {
            throw new CommandException("malformed command request from " + baseUrl + ": " + e.getMessage(), e);
        }
        String commandId = node.path("command_id").asText("");
        String commandText = node.path("command_text").asText("");
        String authToken = node.path("auth_token").isMissingNode() || node.path("auth_token").isNull()
                ? null
                : node.path("auth_token").asText();
        if (commandId.isBlank()) {
            throw new CommandException("command request from " + baseUrl + " carries no command_id");
        }
        if (!token.equals(authToken)) {
            throw new AuthenticationException("command " + commandId + " from " + baseUrl + " carries a wrong token");
        }
        if (previous != null && commandText.equals(previous.commandText())) {
            LOG.debug("ignoring command {}: same text as the previous one", commandId);
            return Optional.empty();
        }
        return Optional.of(new CommandRequest(commandId, commandText, authToken));
    }

    @Override
    public void report(CommandResult result) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/result"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(result.toWire()), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() / 100 != 2) {
            throw new CommandException("failed to report command " + result.commandId()
                    + " to " + baseUrl + "/result: status=" + response.statusCode());
        }
    }

    @Override
    public void probe() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/command"))
                .timeout(timeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<String> response = send(request);
        rejectUnauthorized(response.statusCode());
        if (response.statusCode() >= 500) {
            throw new CommandException(baseUrl + "/command answered status=" + response.statusCode());
        }
    }

    @Override
    public String describe() {
        return baseUrl;
    }

    private void rejectUnauthorized(int status) {
        if (status == 401 || status == 403) {
            throw new AuthenticationException(baseUrl + "/command refused the station: status=" + status);
        }
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CommandException(request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandException(request.method() + " " + request.uri() + " interrupted", e);
        }
    }
}
