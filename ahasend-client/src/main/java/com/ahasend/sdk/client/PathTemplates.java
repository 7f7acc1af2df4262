package com.ahasend.sdk.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 경로 템플릿 확장 유틸리티.
 *
 * <p>{@code /v2/accounts/{account_id}/messages} 형태의 템플릿에서 placeholder를
 * 퍼센트 인코딩된 파라미터 값으로 치환합니다.</p>
 *
 * <p><strong>보안 검증:</strong></p>
 * <ul>
 *   <li>{@code ..} 또는 {@code //} 포함 값 거부 (path traversal)</li>
 *   <li>개행/탭 문자 포함 값 거부</li>
 *   <li>{@code /}는 {@code %2F}로 인코딩되어 세그먼트를 벗어나지 못함</li>
 * </ul>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class PathTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}/]+)}");

    private PathTemplates() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 템플릿의 placeholder 이름 목록 (등장 순서, 중복 제거).
     */
    public static Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * 템플릿 확장.
     *
     * @param template 경로 템플릿
     * @param params placeholder 이름 → 값
     * @return 확장된 경로
     * @throws IllegalArgumentException 필수 파라미터가 없거나 값이 안전하지 않은 경우
     */
    public static String expand(String template, Map<String, String> params) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        Map<String, String> values = params == null ? Map.of() : params;
        for (String name : placeholders(template)) {
            if (!values.containsKey(name)) {
                throw new IllegalArgumentException("missing required path parameter: " + name);
            }
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder path = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            validate(name, value);
            matcher.appendReplacement(path, Matcher.quoteReplacement(escape(value)));
        }
        matcher.appendTail(path);
        return path.toString();
    }

    /**
     * 경로 세그먼트용 퍼센트 인코딩 (공백은 {@code %20}).
     */
    public static String escape(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void validate(String name, String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("invalid path parameter " + name + ": value cannot be empty");
        }
        if (value.contains("..") || value.contains("//")) {
            throw new IllegalArgumentException(
                "invalid path parameter " + name + ": potential path traversal detected: " + value);
        }
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0 || value.indexOf('\t') >= 0) {
            throw new IllegalArgumentException(
                "invalid path parameter " + name + ": invalid characters in parameter");
        }
    }
}
