package lorekeeper.domain.extraction.strategies;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Words that suggest a piece of text holds a particular kind of record. English and Korean markers are both used
 * because the source workspaces mix the two.
 */
final class TextMarkers {
    static final List<String> GLOSSARY = List.of(
            "glossary", "term", "definition", "stands for", "abbreviation", "means", "용어", "정의", "약자");

    static final List<String> INSTRUCTION = List.of(
            "how to", "guide", "tutorial", "instruction", "방법", "가이드", "튜토리얼", "지침");

    static final List<String> REFERENCE = List.of(
            "참조", "참고", "reference", "refer to", "link", "url", "source", "citation");

    static final Pattern URL = Pattern.compile("https?://\\S+");

    private TextMarkers() {
    }

    static boolean containsAny(final String text, final List<String> markers) {
        if (StringUtils.isBlank(text)) {
            return false;
        }

        final String lowerText = text.toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lowerText::contains);
    }

    static boolean containsUrl(final String text) {
        return StringUtils.isNotBlank(text) && URL.matcher(text).find();
    }
}
