package com.sahd.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void stripsDiacriticsAndTatweel() {
        assertThat(normalizer.normalize("الصَّلَاةُ")).isEqualTo("الصلاه");
        assertThat(normalizer.normalize("كتـــاب")).isEqualTo("كتاب");
    }

    @Test
    void foldsLetterVariants() {
        assertThat(normalizer.normalize("أحمد إبراهيم آمن ٱلله")).isEqualTo("احمد ابراهىم امن الله");
        assertThat(normalizer.normalize("مدرسة")).isEqualTo("مدرسه");
        assertThat(normalizer.normalize("في")).isEqualTo("فى");
    }

    @Test
    void replacesNonArabicAndPunctuationWithSingleSpaces() {
        assertThat(normalizer.normalize("  ما حكم الصلاة؟ hello 123، السفر  ")).isEqualTo("ما حكم الصلاه السفر");
        assertThat(normalizer.normalize("abc 42")).isEmpty();
    }

    @Test
    void foldsPresentationForms() {
        // U+FEFB is the lam-alef ligature presentation form.
        assertThat(normalizer.normalize("ﻻ")).isEqualTo("لا");
    }

    @Test
    void nullAndEmptyBecomeEmpty() {
        assertThat(normalizer.normalize((String) null)).isEmpty();
        assertThat(normalizer.normalize("")).isEmpty();
        assertThat(normalizer.normalize(Integer.valueOf(5))).isEmpty();
    }

    @Test
    void normalizationIsIdempotent() {
        List<String> samples = List.of(
            "الصَّلَاةُ عَلَى النَّبِيِّ",
            "إنَّ مَعَ العُسْرِ يُسْرًا",
            "ﷺ حديث شريف",
            "ﻻ إله إلا الله",
            "mixed نص with latin ١٢٣",
            "سُورَةُ ٱلْفَاتِحَةِ ۝",
            ""
        );
        for (String sample : samples) {
            String once = normalizer.normalize(sample);
            assertThat(normalizer.normalize(once)).as(sample).isEqualTo(once);
        }
    }
}
