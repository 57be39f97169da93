package com.trendradar.normalize;

import com.trendradar.config.Config;
import com.trendradar.model.NormalizedItem;
import com.trendradar.model.RawItem;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TitleNormalizerTest {

    private final TitleNormalizer normalizer = new TitleNormalizer(20, "...", List.of("直播", "热议"));

    @Test
    void canonicalTitle_shouldTrimCollapseAndDecodeEntities() {
        assertEquals("Tom & Jerry return", normalizer.canonicalTitle("  Tom &amp; Jerry \n\t return  "));
        assertEquals("华为 发布会", normalizer.canonicalTitle("华为　　发布会"));
        assertEquals("ab", normalizer.canonicalTitle("a\u0001b"));
        assertEquals("<b>x</b>", normalizer.canonicalTitle("&lt;b&gt;x&lt;/b&gt;"));
    }

    @Test
    void canonicalTitle_shouldTruncateWithEllipsis() {
        String title = normalizer.canonicalTitle("abcdefghijklmnopqrstuvwxyz");
        assertEquals("abcdefghijklmnopq...", title);
        assertEquals(20, title.length());

        assertEquals("abcdefghijklmnopqrst", normalizer.canonicalTitle("abcdefghijklmnopqrst"));
    }

    @Test
    void canonicalTitle_shouldNotSplitSurrogatePairs() {
        TitleNormalizer shortNormalizer = new TitleNormalizer(5, "...", List.of());
        String title = shortNormalizer.canonicalTitle("😀😀😀😀😀😀");
        assertEquals("😀😀...", title);
    }

    @Test
    void normalizationKey_shouldLowercaseStripPunctuationAndBoilerplate() {
        assertEquals("breaking news ai chips", normalizer.normalizationKey("Breaking-News: AI, chips!"));
        assertEquals("发布会", normalizer.normalizationKey("【直播】发布会"));
        assertEquals("某地 暴雨", normalizer.normalizationKey("#某地 暴雨热议#"));
        assertEquals("话题", normalizer.normalizationKey("热直播议话题"));
        assertEquals("", normalizer.normalizationKey("直直播播"));
    }

    @Test
    void normalize_shouldHandleEmptyAndNullInput() {
        TitleNormalizer.NormalizedTitle empty = normalizer.normalize("");
        assertEquals("", empty.canonicalTitle);
        assertEquals("", empty.normalizationKey);

        TitleNormalizer.NormalizedTitle nothing = normalizer.normalize((String) null);
        assertEquals("", nothing.canonicalTitle);
        assertEquals("", nothing.normalizationKey);

        assertEquals("", normalizer.normalize("  !!! ？？ ").normalizationKey);
    }

    @Test
    void normalize_shouldBeIdempotentOnKey() {
        List<String> samples = List.of(
                "",
                "   ",
                "Tom &amp; Jerry",
                "【直播】华为 Mate 70 发布会！！",
                "直直播播",
                "OpenAI releases GPT — again?",
                "某地暴雨 #热议# 😀❤️",
                "ÀÉÎ ÕÜ déjà vu",
                "a‍b️c",
                "&amp;amp; double encoded",
                "a very long title that will certainly be truncated by the normalizer"
        );
        for (String sample : samples) {
            String once = normalizer.normalize(sample).normalizationKey;
            String twice = normalizer.normalize(once).normalizationKey;
            assertEquals(once, twice, "key should be stable for: " + sample);
        }
    }

    @Test
    void normalize_shouldStayIdempotentWhenLowercasingLengthensKey() {
        TitleNormalizer shortNormalizer = new TitleNormalizer(5, "...", List.of());

        String once = shortNormalizer.normalize("İİİİİ").normalizationKey;
        String twice = shortNormalizer.normalize(once).normalizationKey;

        assertEquals(5, once.codePointCount(0, once.length()));
        assertEquals(once, twice);
        assertEquals("İİİİİ", shortNormalizer.normalize("İİİİİ").canonicalTitle);
    }

    @Test
    void normalizationKey_shouldRemoveLatinBoilerplateOnlyAsWholeWord() {
        TitleNormalizer mixed = new TitleNormalizer(100, "...", List.of("LIVE", "直播"));

        assertEquals("delivery now", mixed.normalizationKey("Delivery LIVE now"));
        assertEquals("olive oil", mixed.normalizationKey("olive oil"));
        assertEquals("发布会", mixed.normalizationKey("live 发布会直播"));
        assertEquals("", mixed.normalizationKey("LIVE! live"));

        for (String sample : List.of("delivery live", "live直播live", "a live b 直播 c")) {
            String once = mixed.normalize(sample).normalizationKey;
            assertEquals(once, mixed.normalize(once).normalizationKey, "key should be stable for: " + sample);
        }
    }

    @Test
    void normalizeRawItem_shouldCarryPlatformRankUrlAndTime() {
        Instant at = Instant.parse("2026-10-18T01:00:00Z");
        NormalizedItem item = normalizer.normalize(new RawItem(" weibo ", " AI 芯片 ", null, 3, at));

        assertEquals("weibo", item.platformId);
        assertEquals("AI 芯片", item.canonicalTitle);
        assertEquals("ai 芯片", item.normalizationKey);
        assertEquals(3, item.rankPosition);
        assertEquals("", item.url);
        assertEquals(at, item.fetchedAt);
    }

    @Test
    void fromConfig_shouldReadBoilerplateTokensAndLength() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "normalize.max_title_length", "8",
                "normalize.boilerplate_tokens", "LIVE;热议"
        ));
        TitleNormalizer configured = TitleNormalizer.fromConfig(config);

        assertEquals(List.of("live", "热议"), configured.boilerplateTokens());
        assertEquals("12345...", configured.canonicalTitle("1234567890"));
        assertEquals("now", configured.normalize("LIVE now").normalizationKey);
    }
}
