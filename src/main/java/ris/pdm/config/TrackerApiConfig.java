package ris.pdm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelOption;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.DefaultUriBuilderFactory;
import reactor.netty.http.client.HttpClient;
import ris.pdm.external.TrackerSource;
import ris.pdm.external.impl.LiveTrackerSource;
import ris.pdm.external.impl.StaticFixtureTrackerSource;
import ris.pdm.global.ratelimit.SlidingWindowRateLimiter;
import ris.pdm.global.ratelimit.Sleeper;

/**
 * 트래커 API 클라이언트 구성
 *
 * <ul>
 *   <li>WebClient: Basic 인증({@code :PAT}), gzip, 연결/응답 타임아웃
 *   <li>SlidingWindowRateLimiter: 프로세스 단위 호출 예산
 *   <li>TrackerSource: {@code tracker.api.source} 값으로 기동 시 한 번 선택
 * </ul>
 */
@Slf4j
@Configuration
public class TrackerApiConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public WebClient trackerWebClient(TrackerApiProperties properties) {
        String baseUrl = properties.getBaseUrl() + "/" + properties.getOrganization();

        // 경로 변수 값만 인코딩 (프로젝트/팀 이름의 공백, 백슬래시)
        DefaultUriBuilderFactory factory = new DefaultUriBuilderFactory(baseUrl);
        factory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.VALUES_ONLY);

        HttpClient httpClient =
                HttpClient.create()
                        .compress(true)
                        .option(
                                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                                (int) properties.getConnectTimeout().toMillis())
                        .responseTimeout(properties.getRequestTimeout());

        return WebClient.builder()
                .uriBuilderFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, basicAuth(properties.getPat()))
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(
            TrackerApiProperties properties, Clock clock, Sleeper sleeper, MeterRegistry meterRegistry) {
        TrackerApiProperties.RateLimit rateLimit = properties.getRateLimit();
        return new SlidingWindowRateLimiter(
                rateLimit.getRequestsPerWindow(), rateLimit.getWindow(), clock, sleeper, meterRegistry);
    }

    @Bean
    public TrackerSource trackerSource(
            TrackerApiProperties properties, WebClient trackerWebClient, ObjectMapper objectMapper) {
        if (properties.getSource() == TrackerApiProperties.SourceMode.FIXTURE) {
            log.info("[TrackerApiConfig] fixture 소스 사용: path={}", properties.getFixturePath());
            return new StaticFixtureTrackerSource(objectMapper, properties.getFixturePath());
        }
        log.info(
                "[TrackerApiConfig] live 소스 사용: baseUrl={}, organization={}",
                properties.getBaseUrl(),
                properties.getOrganization());
        return new LiveTrackerSource(
                trackerWebClient, properties.getApiVersion(), properties.getRequestTimeout());
    }

    private static String basicAuth(String pat) {
        String token = Base64.getEncoder().encodeToString((":" + pat).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }
}
