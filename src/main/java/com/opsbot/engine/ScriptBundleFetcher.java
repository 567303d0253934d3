package com.opsbot.engine;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Downloads a namespace's auxiliary script bundle into its working directory.
 */
public class ScriptBundleFetcher {
    private static final Logger logger = Logger.getLogger(ScriptBundleFetcher.class.getName());
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;

    public ScriptBundleFetcher() {
        this(HttpClient.newBuilder()
                .connectTimeout(TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public ScriptBundleFetcher(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Replace {@code target} with the body served at {@code url}. The previous file is left
     * untouched if the download fails.
     *
     * @throws IOException on transport failure or a non-2xx status
     */
    public void fetch(String url, Path target) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(TIMEOUT).GET().build();
        Path partial = target.resolveSibling(target.getFileName() + ".part");

        HttpResponse<Path> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(partial));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Files.deleteIfExists(partial);
            throw new IOException("Interrupted while fetching " + url, e);
        } catch (IOException e) {
            Files.deleteIfExists(partial);
            throw e;
        }

        if (response.statusCode() / 100 != 2) {
            Files.deleteIfExists(partial);
            throw new IOException("HTTP " + response.statusCode());
        }
        Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Refreshed " + target + " from " + url);
    }
}
