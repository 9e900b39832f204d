package ris.pdm.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 트래커(Azure DevOps 호환) API 클라이언트 설정 프로퍼티
 *
 * <p>application.yml에서 다음과 같이 설정:
 * <pre>
 * tracker:
 *   api:
 *     source: live            # live | fixture
 *     organization: my-org
 *     pat: ${TRACKER_API_PAT:}
 *     request-timeout: 30s
 *     rate-limit:
 *       requests-per-window: 180
 *       window: 60s
 *     batch:
 *       max-batch-size: 100
 *       delay: 100ms
 * </pre>
 *
 * <h4>타임아웃 계층</h4>
 * <pre>
 * ┌──────────────────────────────────────────────┐
 * │ Rate Limiter 대기 (최대 window)               │
 * │  ┌────────────────────────────────────────┐  │
 * │  │ requestTimeout (30s, 응답 전체)         │  │
 * │  │  - connectTimeout: 5s                  │  │
 * │  └────────────────────────────────────────┘  │
 * └──────────────────────────────────────────────┘
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "tracker.api")
public class TrackerApiProperties {

    /**
     * 데이터 소스 선택 (기동 시 1회 결정)
     * <p>live: 실제 트래커 REST API, fixture: 클래스패스 JSON 픽스처
     */
    @NotNull
    private SourceMode source = SourceMode.LIVE;

    @NotBlank
    private String baseUrl = "https://dev.azure.com";

    private String organization = "";

    /** Personal Access Token (로그에 절대 남기지 않음) */
    private String pat = "";

    @NotBlank
    private String apiVersion = "7.0";

    /** 프로젝트 미지정 요청에 사용할 기본 프로젝트 */
    private String defaultProject = "";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * 요청 1건당 고정 타임아웃
     * <p>타임아웃은 전송 실패와 동일하게 취급되어 상위 fallback tier로 넘어갑니다.
     */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    /** fixture 모드에서 읽을 클래스패스 디렉토리 */
    @NotBlank
    private String fixturePath = "fixtures/tracker";

    @NotNull
    @Valid
    private RateLimit rateLimit = new RateLimit();

    @NotNull
    @Valid
    private Batch batch = new Batch();

    public enum SourceMode {
        LIVE,
        FIXTURE
    }

    public SourceMode getSource() {
        return source;
    }

    public void setSource(SourceMode source) {
        this.source = source;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getOrganization() {
        return organization;
    }

    public void setOrganization(String organization) {
        this.organization = organization;
    }

    public String getPat() {
        return pat;
    }

    public void setPat(String pat) {
        this.pat = pat;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String getDefaultProject() {
        return defaultProject;
    }

    public void setDefaultProject(String defaultProject) {
        this.defaultProject = defaultProject;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public String getFixturePath() {
        return fixturePath;
    }

    public void setFixturePath(String fixturePath) {
        this.fixturePath = fixturePath;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    /**
     * 아웃바운드 호출 예산 (슬라이딩 윈도우)
     * <p>기본값: 60초당 180회
     */
    public static class RateLimit {

        @Min(1)
        @Max(10000)
        private int requestsPerWindow = 180;

        @NotNull
        private Duration window = Duration.ofSeconds(60);

        public int getRequestsPerWindow() {
            return requestsPerWindow;
        }

        public void setRequestsPerWindow(int requestsPerWindow) {
            this.requestsPerWindow = requestsPerWindow;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    /**
     * 상세 조회 배치 설정
     * <p>업스트림 한도는 요청당 200건. 기본 100건 + 배치 간 100ms 간격
     */
    public static class Batch {

        @Min(1)
        @Max(200)
        private int maxBatchSize = 100;

        @NotNull
        private Duration delay = Duration.ofMillis(100);

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }
    }
}
