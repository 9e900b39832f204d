package ris.pdm.global.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import ris.pdm.config.CacheProperties;
import ris.pdm.global.executor.LogicExecutor;
import ris.pdm.global.executor.TaskContext;
import ris.pdm.global.executor.strategy.ExceptionTranslator;
import org.springframework.stereotype.Component;

/**
 * 캐시 키 생성기
 *
 * <h4>키 규칙</h4>
 *
 * <ul>
 *   <li>형식: {@code <prefix>:<namespace>:<identifier>:<readable>_<digest>}
 *   <li>파라미터: null 값 제거 후 키 정렬 (중첩 Map도 정렬)
 *   <li>각 구성 요소는 {@code [^a-zA-Z0-9-_] → _} 로 정제
 *   <li>파라미터가 있거나 identifier가 정제로 바뀐 경우, 정제 전 (namespace, identifier, 정렬된 파라미터) JSON의 SHA-256 앞
 *       12자리를 덧붙임
 * </ul>
 */
@Component
public class CacheKeyGenerator {

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9\\-_]");
    private static final int READABLE_MAX_LENGTH = 120;
    private static final int DIGEST_HEX_LENGTH = 12;

    private final String prefix;
    private final LogicExecutor executor;
    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator(CacheProperties properties, LogicExecutor executor) {
        this.prefix = properties.getKeyPrefix();
        this.executor = executor;
        this.canonicalMapper =
                new ObjectMapper()
                        .findAndRegisterModules()
                        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                        .setDefaultPropertyInclusion(
                                JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.NON_NULL));
    }

    /** 구조화된 키 생성 */
    public CacheKey cacheKey(String namespace, String identifier, Map<String, ?> params) {
        Map<String, Object> sorted = normalize(params);
        String safeIdentifier = sanitize(identifier);
        boolean identifierAltered = identifier != null && !safeIdentifier.equals(identifier);
        return new CacheKey(
                sanitize(namespace), safeIdentifier, paramsHash(namespace, identifier, sorted, identifierAltered));
    }

    /** 저장소 키 생성 ({@link CacheKey#toStorageKey(String)}) */
    public String generateKey(String namespace, String identifier, Map<String, ?> params) {
        return cacheKey(namespace, identifier, params).toStorageKey(prefix);
    }

    /** 네임스페이스 전체를 가리키는 glob 패턴 */
    public String namespacePattern(String namespace) {
        return prefix + ":" + sanitize(namespace) + ":*";
    }

    /** 전체 키 공간 glob 패턴 */
    public String allKeysPattern() {
        return prefix + ":*";
    }

    public String getPrefix() {
        return prefix;
    }

    static String sanitize(String part) {
        if (part == null) {
            return "";
        }
        return UNSAFE.matcher(part).replaceAll("_");
    }

    private Map<String, Object> normalize(Map<String, ?> params) {
        Map<String, Object> sorted = new TreeMap<>();
        if (params == null) {
            return sorted;
        }
        params.forEach((k, v) -> {
            if (k != null && v != null) {
                sorted.put(k, v);
            }
        });
        return sorted;
    }

    private String paramsHash(
            String namespace, String identifier, Map<String, Object> sorted, boolean identifierAltered) {
        if (sorted.isEmpty()) {
            return identifierAltered ? digest(namespace, identifier, sorted) : "";
        }
        StringJoiner readable = new StringJoiner("_");
        sorted.forEach((k, v) -> readable.add(sanitize(k) + "-" + sanitize(display(v))));
        String head = readable.toString();
        if (head.length() > READABLE_MAX_LENGTH) {
            head = head.substring(0, READABLE_MAX_LENGTH);
        }
        return head + "_" + digest(namespace, identifier, sorted);
    }

    private String display(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        if (value instanceof Map<?, ?>) {
            return "map";
        }
        return String.valueOf(value);
    }

    /** 정제 전 namespace, identifier와 정렬된 파라미터를 함께 다이제스트 */
    private String digest(String namespace, String identifier, Map<String, Object> sorted) {
        Map<String, Object> material = new TreeMap<>();
        material.put("namespace", namespace == null ? "" : namespace);
        material.put("identifier", identifier == null ? "" : identifier);
        material.put("params", sorted);
        String canonical =
                executor.executeWithTranslation(
                        () -> canonicalMapper.writeValueAsString(material),
                        ExceptionTranslator.forJson("params"),
                        TaskContext.of("CacheKey", "canonicalize"));
        return sha256Hex(canonical).substring(0, DIGEST_HEX_LENGTH);
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
