package com.imperium.lexi.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前加载项目根目录下的 .env 文件，将 KEY=VALUE 写入 System.setProperty，
 * 以便 application.yaml 中的 ${KEY} 能解析到 .env 里的值（OPENAI_API_KEY、GOOGLE_AI_API_KEY、DB_URL 等）。
 * <p>
 * 已存在的系统属性不会被覆盖，命令行 -D 参数优先。
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    /** Spring AI 的 OpenAiApi 会自动拼接 /v1 前缀，这些 key 的值需要去掉结尾的 /v1 */
    private static final Set<String> OPENAI_BASE_URL_KEYS = Set.of("OPENAI_BASE_URL", "OPENAI_EMBEDDING_BASE_URL");

    private DotenvLoader() {
    }

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    /**
     * 解析并加载指定 .env 文件。
     *
     * @return 实际写入系统属性的键值（文件不存在或读取失败时为空）
     */
    public static Map<String, String> load(Path envPath) {
        Map<String, String> loaded = new LinkedHashMap<>();
        if (!Files.isRegularFile(envPath)) {
            log.info(".env file not found at: {}", envPath);
            return loaded;
        }
        try {
            List<String> lines = Files.readAllLines(envPath);
            for (String line : lines) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                Matcher matcher = ENV_LINE.matcher(trimmed);
                if (!matcher.matches()) {
                    continue;
                }
                String key = matcher.group(1).trim();
                String value = unquote(matcher.group(2).trim());

                if (OPENAI_BASE_URL_KEYS.contains(key)) {
                    String normalized = normalizeOpenAiBaseUrl(value);
                    if (!normalized.equals(value)) {
                        log.info("Normalized {} (removed trailing /v1): {} -> {}", key, value, normalized);
                    }
                    value = normalized;
                }
                if (System.getProperty(key) != null) {
                    continue;
                }
                System.setProperty(key, value);
                loaded.put(key, value);
                log.info("Loaded: {} = {}", key, isSecret(key) ? "***" : value);
            }
        } catch (Exception e) {
            log.error("Failed to load .env from {}: {}", envPath, e.getMessage());
        }
        return loaded;
    }

    static String normalizeOpenAiBaseUrl(String value) {
        if (value == null) {
            return "";
        }
        String v = stripTrailingSlashes(value.trim());
        if (v.endsWith("/v1")) {
            v = v.substring(0, v.length() - 3);
        }
        return stripTrailingSlashes(v);
    }

    private static String stripTrailingSlashes(String v) {
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static boolean isSecret(String key) {
        return key.contains("KEY") || key.contains("SECRET") || key.contains("PASSWORD");
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }
}
