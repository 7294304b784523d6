package org.mediascan.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class CleanDateTimeParser {

    /**
     * Splits {@code "Movie (2020) - [1080p]"} into {@code "Movie"} and {@code 2020}. Names without a
     * recognizable year come back trimmed with a {@code null} year.
     */
    public CleanDateTimeResult clean(String name, List<Pattern> patterns) {
        if (name == null || name.isEmpty()) {
            return new CleanDateTimeResult(name, null);
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(name);
            if (!matcher.find() || matcher.groupCount() < 2) {
                continue;
            }
            String title = matcher.group(1);
            String year = matcher.group(2);
            if (title != null && StringUtils.isNumeric(year)) {
                return new CleanDateTimeResult(title.trim(), Integer.parseInt(year));
            }
        }
        return new CleanDateTimeResult(name.trim(), null);
    }

    public record CleanDateTimeResult(String name, Integer year) {
    }
}
