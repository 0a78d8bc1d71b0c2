/**
 * Configuration for WebClient
 * - Defines the shared builder used for remote processing calls and asset downloads
 * - Sets up default timeouts and connection settings
 */
package net.closetcapture.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - Provides a pre-configured WebClient Builder
 * - Socket timeouts sit above the processing timeout so the logical race in
 *   {@link net.closetcapture.service.processing.ProcessingClient} decides the outcome
 */
@Configuration
public class WebClientConfig {

    private static final String DEFAULT_USER_AGENT = "closet-capture/0.1";

    /** Ceiling for a buffered, decoded response body such as the processing JSON; request bodies are not bounded by it. */
    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Sets connection timeout to 5000ms
     * - Sets read and write timeouts to 15 seconds
     * - Sets response timeout to 15 seconds
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(false)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(15, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(15));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
