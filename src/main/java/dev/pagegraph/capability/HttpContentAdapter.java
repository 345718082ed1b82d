package dev.pagegraph.capability;

import dev.pagegraph.config.CapabilityProperties;
import dev.pagegraph.exception.FetchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.netty.channel.ChannelOption;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Fetches pages over HTTP and extracts readable text with jsoup.
 * Uses WebClient with .block(); the caller already runs it on a capability thread with a timeout.
 * Bodies longer than {@code maxFetchBytes} are cut at that length, not rejected.
 */
@Component
public class HttpContentAdapter implements ContentAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpContentAdapter.class);

    static final String HTML_METHOD = "jsoup-html";
    static final String PLAIN_METHOD = "plain-text";

    private final WebClient webClient;
    private final int maxFetchBytes;

    public HttpContentAdapter(WebClient.Builder builder, CapabilityProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(properties.fetchResponseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.fetchConnectTimeout().toMillis());
        this.webClient = builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,text/plain;q=0.9")
                .build();
        this.maxFetchBytes = properties.maxFetchBytes();
    }

    @Override
    @CircuitBreaker(name = "content-fetch")
    public FetchedContent fetch(String url) {
        RawPage page;
        try {
            page = webClient.get().uri(url)
                    .exchangeToMono(response -> {
                        if (response.statusCode().isError()) {
                            return response.releaseBody().then(Mono.<RawPage>error(new FetchException(
                                    "HTTP %d from %s".formatted(response.statusCode().value(), url))));
                        }
                        MediaType contentType = response.headers().contentType().orElse(null);
                        return DataBufferUtils.join(DataBufferUtils.takeUntilByteCount(
                                        response.bodyToFlux(DataBuffer.class), maxFetchBytes))
                                .map(buffer -> readCapped(buffer, contentType, url));
                    })
                    .block();
        } catch (WebClientException e) {
            throw new FetchException("Could not fetch %s: %s".formatted(url, e.getMessage()), e);
        }
        if (page == null || page.body().isBlank()) {
            throw new FetchException("Empty response from " + url);
        }
        FetchedContent content = extract(page.body(), page.contentType());
        log.debug("Fetched {} ({} chars via {})", url, content.text().length(), content.extractionMethod());
        return content;
    }

    private RawPage readCapped(DataBuffer buffer, MediaType contentType, String url) {
        try {
            if (buffer.readableByteCount() >= maxFetchBytes) {
                log.debug("Body of {} cut at {} bytes", url, maxFetchBytes);
            }
            Charset charset = contentType != null && contentType.getCharset() != null
                    ? contentType.getCharset() : StandardCharsets.UTF_8;
            return new RawPage(buffer.toString(charset), contentType);
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private record RawPage(String body, MediaType contentType) {}

    static FetchedContent extract(String body, MediaType contentType) {
        if (contentType == null || contentType.isCompatibleWith(MediaType.TEXT_HTML)
                || contentType.isCompatibleWith(MediaType.APPLICATION_XHTML_XML)) {
            return new FetchedContent(htmlToText(body), HTML_METHOD);
        }
        if (contentType.isCompatibleWith(MediaType.TEXT_PLAIN)) {
            return new FetchedContent(body.strip(), PLAIN_METHOD);
        }
        throw new FetchException("Unsupported content type " + contentType);
    }

    static String htmlToText(String html) {
        Document doc = Jsoup.parse(html);
        doc.select("script, style, noscript, nav, footer, header, aside, form, svg").remove();
        String title = doc.title().strip();
        String body = doc.body() != null ? doc.body().text().strip() : "";
        String text = title.isEmpty() || body.startsWith(title) ? body : title + "\n\n" + body;
        if (text.isBlank()) {
            throw new FetchException("No readable text in page");
        }
        return text;
    }
}
