package com.dcruver.coursepipeline.corpus;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds numeric and statistical tokens in research text: digit sequences with optional
 * thousand separators and decimals, an optional leading currency symbol, and an optional
 * trailing percent sign or unit word.
 */
@Component
public class NumericDataDetector {

    private static final List<String> UNIT_WORDS = List.of(
        "円", "ドル", "万", "億", "兆", "件", "人", "倍", "社", "時間", "分",
        "percent", "million", "billion", "thousand", "dollars", "dollar", "yen", "USD", "JPY", "EUR"
    );

    private static final Pattern NUMERIC_TOKEN = Pattern.compile(
        "(?:[$¥€£￥]\\s?)?"
            + "\\d+(?:,\\d{3})*(?:\\.\\d+)?"
            + "(?:\\s?[%％]|" + unitAlternation() + ")?");

    private static String unitAlternation() {
        StringBuilder sb = new StringBuilder("\\s?(?:");
        for (int i = 0; i < UNIT_WORDS.size(); i++) {
            if (i > 0) {
                sb.append('|');
            }
            sb.append(Pattern.quote(UNIT_WORDS.get(i)));
        }
        return sb.append(")(?![A-Za-z])").toString();
    }

    /**
     * Number of numeric mentions in the text
     */
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Matcher matcher = NUMERIC_TOKEN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * The first {@code limit} numeric mentions, as they appear in the text
     */
    public List<String> samples(String text, int limit) {
        List<String> samples = new ArrayList<>();
        if (text == null || limit <= 0) {
            return samples;
        }
        Matcher matcher = NUMERIC_TOKEN.matcher(text);
        while (matcher.find() && samples.size() < limit) {
            samples.add(matcher.group().trim());
        }
        return samples;
    }
}
