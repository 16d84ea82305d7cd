package com.cacheshield.key;

import com.cacheshield.exception.KeyTemplateException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Key 模板转换函数注册表（封闭集合）
 *
 * <ul>
 *   <li>lower / upper：大小写转换</li>
 *   <li>len：格式化后字符串长度</li>
 *   <li>hash(md5|sha1|sha256)：十六进制摘要，默认 md5</li>
 *   <li>get(field)：取 Map 参数中的字段</li>
 *   <li>jwt(claim)：取 JWT 载荷中的声明</li>
 * </ul>
 */
public final class KeyTransforms {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final Map<String, String> DIGESTS = Map.of(
        "md5", "MD5",
        "sha1", "SHA-1",
        "sha256", "SHA-256");

    private static final Map<String, KeyTransform> TRANSFORMS = Map.of(
        "lower", (raw, formatted, params) -> formatted.toLowerCase(Locale.ROOT),
        "upper", (raw, formatted, params) -> formatted.toUpperCase(Locale.ROOT),
        "len", (raw, formatted, params) -> String.valueOf(formatted.length()),
        "hash", (raw, formatted, params) -> hash(formatted, params.isEmpty() ? "md5" : params.get(0)),
        "get", (raw, formatted, params) -> field(raw, params),
        "jwt", (raw, formatted, params) -> jwtClaim(formatted, params));

    private KeyTransforms() {}

    public static boolean contains(String name) {
        return TRANSFORMS.containsKey(name);
    }

    public static KeyTransform lookup(String name) {
        KeyTransform transform = TRANSFORMS.get(name);
        if (transform == null) {
            throw new KeyTemplateException("Unknown key transform: " + name);
        }
        return transform;
    }

    static String hash(String value, String algorithm) {
        String digestName = DIGESTS.get(algorithm);
        if (digestName == null) {
            throw new KeyTemplateException("Unsupported hash algorithm: " + algorithm);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(digestName);
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new KeyTemplateException("Hash algorithm not available: " + digestName);
        }
    }

    private static String field(Object raw, List<String> params) {
        if (params.isEmpty()) {
            throw new KeyTemplateException("Transform get requires a field name");
        }
        if (raw instanceof Map<?, ?> map) {
            return KeyTemplate.formatValue(map.get(params.get(0)));
        }
        return "";
    }

    private static String jwtClaim(String token, List<String> params) {
        if (params.isEmpty()) {
            throw new KeyTemplateException("Transform jwt requires a claim name");
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return "";
        }
        try {
            JsonNode payload = JSON.readTree(Base64.getUrlDecoder().decode(parts[1]));
            JsonNode claim = payload.get(params.get(0));
            return claim == null || claim.isNull() ? "" : claim.asText();
        } catch (IOException | IllegalArgumentException e) {
            throw new KeyTemplateException("Malformed jwt in key argument");
        }
    }
}
