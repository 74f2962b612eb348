package com.sahd.search.query;

import java.text.Normalizer;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Canonical form for Arabic query and segment text: compatibility-folded, without harakat or
 * Quranic annotation marks, with alef/teh-marbuta/yeh variants folded, restricted to Arabic
 * letters and single spaces. {@code normalize(normalize(x)).equals(normalize(x))} for any x.
 */
@Component
public class TextNormalizer {
    private static final Pattern MARKS = Pattern.compile(
        "[\\u0610-\\u061A\\u064B-\\u065F\\u0670\\u06D6-\\u06ED\\u0640]"
    );
    private static final Pattern ALEF_VARIANTS = Pattern.compile("[\\u0622\\u0623\\u0625\\u0671]");
    private static final Pattern ARABIC_PUNCTUATION = Pattern.compile("[\\u060C\\u061B\\u061F\\u066A-\\u066D\\u06D4]");
    private static final Pattern OUTSIDE_SCRIPT = Pattern.compile("[^\\u0600-\\u06FF\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String value = Normalizer.normalize(text, Normalizer.Form.NFKC);
        value = MARKS.matcher(value).replaceAll("");
        value = ALEF_VARIANTS.matcher(value).replaceAll("ا");
        value = value.replace('ة', 'ه');
        value = value.replace('ي', 'ى');
        value = ARABIC_PUNCTUATION.matcher(value).replaceAll(" ");
        value = OUTSIDE_SCRIPT.matcher(value).replaceAll(" ");
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    public String normalize(Object value) {
        return value instanceof CharSequence text ? normalize(text.toString()) : "";
    }
}
