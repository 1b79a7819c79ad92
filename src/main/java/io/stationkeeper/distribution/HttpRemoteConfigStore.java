package io.stationkeeper.distribution;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Remote store served as an HTTP(S) directory index (WebDAV or plain web
 * server listing): file names are the {@code href} targets of the index page.
 */
public final class HttpRemoteConfigStore implements RemoteConfigStore {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final Pattern HREF = Pattern.compile("href\\s*=\\s*[\"']([^\"'#?]+)[\"']", Pattern.CASE_INSENSITIVE);

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient http;

    public HttpRemoteConfigStore(String url) {
        this(url, DEFAULT_TIMEOUT);
    }

    public HttpRemoteConfigStore(String url, Duration timeout) {
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<String> listFiles() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/"))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DistributionException("failed to list " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DistributionException("interrupted while listing " + baseUrl, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new DistributionException("failed to list " + baseUrl + ": status=" + response.statusCode());
        }
        return parseIndex(response.body());
    }

    static List<String> parseIndex(String page) {
        Set<String> out = new LinkedHashSet<>();
        Matcher matcher = HREF.matcher(page);
        while (matcher.find()) {
            String href = matcher.group(1).trim();
            if (href.endsWith("/")) {
                continue;
            }
            int slash = href.lastIndexOf('/');
            String name = URLDecoder.decode(slash >= 0 ? href.substring(slash + 1) : href, StandardCharsets.UTF_8);
            if (!name.isBlank()) {
                out.add(name);
            }
        }
        return new ArrayList<>(out);
    }

    @Override
    public void download(String filename, Path target) {
        String url = baseUrl + "/" + filename;
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<Path> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofFile(target));
        } catch (IOException e) {
            throw new DistributionException("failed to download " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DistributionException("interrupted while downloading " + url, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new DistributionException("failed to download " + url + ": status=" + response.statusCode());
        }
    }

    @Override
    public String location() {
        return baseUrl;
    }
}
