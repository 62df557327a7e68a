package com.moneylens.categorization.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.moneylens.categorization.config.CategorizationProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpEmbeddingProviderTest {

    private static CategorizationProperties.ProviderProperties providerProperties(String url) {
        CategorizationProperties.ProviderProperties p = new CategorizationProperties.ProviderProperties();
        p.setUrl(url);
        p.setModel("all-minilm");
        p.setApiKey("secret");
        return p;
    }

    private static HttpEmbeddingProvider provider(String url, HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret");
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new HttpEmbeddingProvider(builder, new ObjectMapper(), RateLimiter.ofDefaults("test"),
                providerProperties(url));
    }

    @Test
    @DisplayName("reads data[0].embedding from an OpenAI-compatible response")
    void readsEmbedding() {
        HttpEmbeddingProvider provider = provider("http://embeddings.local/v1/embeddings", HttpStatus.OK,
                "{\"object\":\"list\",\"data\":[{\"object\":\"embedding\",\"index\":0,\"embedding\":[0.5,-0.25,1]}]}");

        assertThat(provider.isAvailable()).isTrue();
        assertThat(provider.embed("gas station")).containsExactly(0.5, -0.25, 1.0);
    }

    @Test
    @DisplayName("HTTP errors surface as EmbeddingProviderException")
    void httpErrorIsProviderException() {
        HttpEmbeddingProvider provider = provider("http://embeddings.local/v1/embeddings",
                HttpStatus.SERVICE_UNAVAILABLE, "{}");

        assertThatThrownBy(() -> provider.embed("gas station")).isInstanceOf(EmbeddingProviderException.class);
    }

    @Test
    @DisplayName("responses without an embedding are rejected")
    void malformedResponses() {
        HttpEmbeddingProvider provider = provider("http://embeddings.local/v1/embeddings", HttpStatus.OK, "{}");

        assertThatThrownBy(() -> provider.parseEmbedding("{\"data\":[]}")).isInstanceOf(EmbeddingProviderException.class);
        assertThatThrownBy(() -> provider.parseEmbedding("not json")).isInstanceOf(EmbeddingProviderException.class);
        assertThatThrownBy(() -> provider.parseEmbedding("{\"data\":[{\"embedding\":[1,\"x\"]}]}"))
                .isInstanceOf(EmbeddingProviderException.class);
    }

    @Test
    @DisplayName("blank url means unavailable")
    void blankUrlUnavailable() {
        HttpEmbeddingProvider provider = provider("", HttpStatus.OK, "{}");

        assertThat(provider.isAvailable()).isFalse();
        assertThatThrownBy(() -> provider.embed("x")).isInstanceOf(EmbeddingProviderException.class);
    }
}
