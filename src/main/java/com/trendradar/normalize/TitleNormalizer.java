package com.trendradar.normalize;

import com.trendradar.config.Config;
import com.trendradar.model.NormalizedItem;
import com.trendradar.model.RawItem;
import lombok.Value;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw platform titles for display and derives the key used for matching.
 * Pure and total: null and empty input yield empty strings.
 */
public final class TitleNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");
    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cc}");
    // punctuation, symbols (emoji included), variation selectors and zero-width joiners
    private static final Pattern KEY_NOISE = Pattern.compile("[\\p{P}\\p{S}\\uFE00-\\uFE0F\\u200B-\\u200D]");
    private static final Pattern LATIN = Pattern.compile("\\p{IsLatin}");

    private final int maxTitleLength;
    private final String ellipsis;
    private final List<String> boilerplateTokens;
    // Latin tokens match whole words only; others (CJK) match anywhere
    private final Map<String, Pattern> wordTokens = new HashMap<>();

    public TitleNormalizer(int maxTitleLength, String ellipsis, List<String> boilerplateTokens) {
        this.maxTitleLength = maxTitleLength;
        this.ellipsis = ellipsis == null ? "" : ellipsis;
        Set<String> tokens = new LinkedHashSet<>();
        if (boilerplateTokens != null) {
            for (String token : boilerplateTokens) {
                String normalized = stripNoise(token);
                if (!normalized.isEmpty()) {
                    tokens.add(normalized);
                }
            }
        }
        this.boilerplateTokens = List.copyOf(tokens);
        for (String token : this.boilerplateTokens) {
            if (LATIN.matcher(token).find()) {
                wordTokens.put(token, Pattern.compile("(?<!\\S)" + Pattern.quote(token) + "(?!\\S)"));
            }
        }
    }

    public static TitleNormalizer fromConfig(Config config) {
        return new TitleNormalizer(
                config.getInt("normalize.max_title_length"),
                config.getString("normalize.ellipsis"),
                config.getList("normalize.boilerplate_tokens")
        );
    }

    public NormalizedTitle normalize(String rawTitle) {
        String canonical = canonicalTitle(rawTitle);
        return new NormalizedTitle(canonical, normalizationKey(canonical));
    }

    public NormalizedItem normalize(RawItem item) {
        NormalizedTitle title = normalize(item.title);
        return new NormalizedItem(
                item.platformId.trim(),
                title.canonicalTitle,
                title.normalizationKey,
                item.rankPosition,
                item.url == null ? "" : item.url.trim(),
                item.fetchedAt
        );
    }

    /**
     * Decodes HTML entities, collapses whitespace, drops control characters and truncates.
     */
    public String canonicalTitle(String rawTitle) {
        if (rawTitle == null || rawTitle.isEmpty()) {
            return "";
        }
        String text = Parser.unescapeEntities(rawTitle, false);
        text = WHITESPACE.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        return truncate(text);
    }

    /**
     * Lowercased, punctuation-free, whitespace-collapsed form with boilerplate tokens removed.
     * Never longer than the display limit in code points, so a key fed back in is not truncated again.
     */
    public String normalizationKey(String canonicalTitle) {
        String key = capLength(stripNoise(canonicalTitle));
        if (key.isEmpty() || boilerplateTokens.isEmpty()) {
            return key;
        }
        // removing one token can join the halves of another, so repeat until stable
        String previous;
        do {
            previous = key;
            for (String token : boilerplateTokens) {
                Pattern word = wordTokens.get(token);
                key = word == null ? key.replace(token, "") : word.matcher(key).replaceAll(" ");
            }
            key = WHITESPACE.matcher(key).replaceAll(" ").trim();
        } while (!key.equals(previous));
        return key;
    }

    List<String> boilerplateTokens() {
        return new ArrayList<>(boilerplateTokens);
    }

    private static String stripNoise(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        lower = KEY_NOISE.matcher(lower).replaceAll(" ");
        lower = CONTROL_CHARS.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(lower).replaceAll(" ").trim();
    }

    /**
     * Lowercasing can add code points (U+0130 becomes two), so the key gets its own cap without an ellipsis.
     */
    private String capLength(String key) {
        int ellipsisLength = ellipsis.codePointCount(0, ellipsis.length());
        if (maxTitleLength <= ellipsisLength || key.codePointCount(0, key.length()) <= maxTitleLength) {
            return key;
        }
        return key.substring(0, key.offsetByCodePoints(0, maxTitleLength)).trim();
    }

    private String truncate(String text) {
        int ellipsisLength = ellipsis.codePointCount(0, ellipsis.length());
        if (maxTitleLength <= ellipsisLength) {
            return text;
        }
        int length = text.codePointCount(0, text.length());
        if (length <= maxTitleLength) {
            return text;
        }
        int end = text.offsetByCodePoints(0, maxTitleLength - ellipsisLength);
        return text.substring(0, end).stripTrailing() + ellipsis;
    }

    @Value
    public static class NormalizedTitle {
        public final String canonicalTitle;
        public final String normalizationKey;
    }
}
