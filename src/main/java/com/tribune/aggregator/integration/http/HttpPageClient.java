package com.tribune.aggregator.integration.http;

import com.tribune.aggregator.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Outbound GET for feeds, listing pages and article pages. The timeout bounds the whole
 * exchange including the body, every request carries the crawler User-Agent, and redirects
 * are followed up to the JDK client's limit of 5.
 */
@Slf4j
@Component
public class HttpPageClient {

    public static final String ACCEPT_FEED = "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.1";
    public static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(7))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    @Value("${crawler.user-agent:Tribune News Aggregator/1.0}")
    private String userAgent;

    @Value("${crawler.max-body-bytes:5242880}")
    private int maxBodyBytes;

    public PageResponse get(String url, String accept, Duration timeout) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new FetchException("Invalid URL url=" + url, e);
        }

        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .header("User-Agent", userAgent)
                .header("Accept", accept)
                .header("Accept-Language", "en-US,en;q=0.9")
                .build();

        // The request timeout only covers the headers; the deadline below bounds the body too.
        CompletableFuture<HttpResponse<byte[]>> call = httpClient.sendAsync(req, this::bodyHandler);
        try {
            HttpResponse<byte[]> resp = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int status = resp.statusCode();
            String ct = resp.headers().firstValue("Content-Type").orElse("");

            if (status < 200 || status >= 300) {
                throw new FetchException("Non-2xx status=" + status + " url=" + uri, null);
            }

            Charset charset = parseCharsetFromContentType(ct).orElse(StandardCharsets.UTF_8);
            byte[] body = resp.body();
            log.debug("HTTP: OK url={} status={} bytes={} contentType='{}'", uri, status, body.length, ct);
            return new PageResponse(resp.uri(), body, charset, ct);

        } catch (TimeoutException e) {
            call.cancel(true);
            throw new FetchException("Timed out after " + timeout.toMillis() + "ms url=" + uri, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof FetchException fe) {
                throw fe;
            }
            throw new FetchException("Failed to fetch url=" + uri + " cause=" + cause.getClass().getSimpleName(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted fetching url=" + uri, e);
        }
    }

    private HttpResponse.BodySubscriber<byte[]> bodyHandler(HttpResponse.ResponseInfo info) {
        if (info.statusCode() < 200 || info.statusCode() >= 300) {
            return HttpResponse.BodySubscribers.replacing(new byte[0]);
        }
        return new CappedBodySubscriber(maxBodyBytes);
    }

    /**
     * Collects the body in memory and gives up, cancelling the exchange, once it passes
     * {@code maxBytes}.
     */
    static final class CappedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {

        private final int maxBytes;
        private final CompletableFuture<byte[]> result = new CompletableFuture<>();
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private Flow.Subscription subscription;
        private long received;

        CappedBodySubscriber(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return result;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (result.isDone()) return;
            for (ByteBuffer buffer : items) {
                received += buffer.remaining();
                if (received > maxBytes) {
                    subscription.cancel();
                    result.completeExceptionally(new FetchException("Body exceeded maxBodyBytes=" + maxBytes, null));
                    return;
                }
                byte[] chunk = new byte[buffer.remaining()];
                buffer.get(chunk);
                out.writeBytes(chunk);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            result.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            result.complete(out.toByteArray());
        }
    }

    static Optional<Charset> parseCharsetFromContentType(String contentType) {
        if (contentType == null) return Optional.empty();
        String ct = contentType.toLowerCase(Locale.ROOT);
        int i = ct.indexOf("charset=");
        if (i < 0) return Optional.empty();
        String cs = ct.substring(i + "charset=".length()).trim();
        int semi = cs.indexOf(';');
        if (semi >= 0) cs = cs.substring(0, semi).trim();
        cs = cs.replace("\"", "").trim();
        try {
            return Optional.of(Charset.forName(cs));
        } catch (IllegalArgumentException ignored) {
            return Optional.empty();
        }
    }

    /**
     * Body of a 2xx response. {@code uri} is the final URI after redirects.
     */
    public record PageResponse(URI uri, byte[] body, Charset charset, String contentType) {

        public String text() {
            return new String(body, charset);
        }
    }
}
