package org.mediascan.util;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class CleanStringParser {

    private static final String CLEANED_GROUP = "cleaned";

    /**
     * Strips release tags (codec, resolution, source...) from a name.
     *
     * @return the {@code cleaned} group of the first pattern that captures something, or empty when
     * no pattern applies
     */
    public Optional<String> tryClean(String name, List<Pattern> patterns) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(name);
            if (matcher.find()) {
                String cleaned = matcher.group(CLEANED_GROUP);
                if (cleaned != null && !cleaned.isEmpty()) {
                    return Optional.of(cleaned);
                }
            }
        }
        return Optional.empty();
    }
}
