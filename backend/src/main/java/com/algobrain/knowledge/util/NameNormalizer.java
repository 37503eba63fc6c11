package com.algobrain.knowledge.util;

import org.apache.commons.lang3.StringUtils;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 实体名称归一化工具
 */
public final class NameNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Pattern NON_PREDICATE = Pattern.compile("[^\\p{L}\\p{N}\\-]");

    // CVE-2025-1234 / T1059 / T1059.001 / CWE-79
    private static final Pattern EXTERNAL_ID = Pattern.compile(
        "^(CVE-\\d{4}-\\d+|T\\d{4}(\\.\\d{3})?|TA\\d{4}|CWE-\\d+|[GSM]\\d{4})$", Pattern.CASE_INSENSITIVE);

    private NameNormalizer() {
    }

    /**
     * 小写、NFKC、去标点、合并空白
     */
    public static String normalize(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        String s = Normalizer.normalize(raw, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        s = NON_WORD.matcher(s).replaceAll(" ");
        return StringUtils.normalizeSpace(s);
    }

    public static Set<String> tokens(String raw) {
        String normalized = normalize(raw);
        if (normalized.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(normalized.split(" "))
            .filter(t -> !t.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String t : a) {
            if (b.contains(t)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }

    /**
     * 名称本身就是外部标识（CVE、ATT&CK 编号）时返回大写形式，否则返回 null
     */
    public static String detectExternalId(String name) {
        if (StringUtils.isBlank(name)) {
            return null;
        }
        Matcher m = EXTERNAL_ID.matcher(name.trim());
        return m.matches() ? name.trim().toUpperCase(Locale.ROOT) : null;
    }

    /**
     * 谓词统一为小写短横线形式，如 "Attributed To" -> "attributed-to"；非拉丁文字原样保留
     */
    public static String normalizePredicate(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        String s = Normalizer.normalize(raw.trim(), Normalizer.Form.NFKC).toLowerCase(Locale.ROOT)
            .replaceAll("[\\s_]+", "-");
        return NON_PREDICATE.matcher(s).replaceAll("").replaceAll("-{2,}", "-");
    }
}
