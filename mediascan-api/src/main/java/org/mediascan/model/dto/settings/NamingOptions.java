package org.mediascan.model.dto.settings;

import org.mediascan.config.NamingProperties;
import org.mediascan.exception.ApiError;
import org.mediascan.model.enums.ExtraRuleType;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Compiled, immutable view of {@link NamingProperties}. Built once and shared by all naming components.
 */
@Getter
public class NamingOptions {

    private static final List<String> STACK_RULE_GROUPS = List.of("filename", "parttype", "number");

    private final Set<String> videoFileExtensions;
    private final Set<String> stubFileExtensions;
    private final List<Pattern> cleanStringPatterns;
    private final List<Pattern> cleanDateTimePatterns;
    private final List<FileStackRule> stackingRules;
    private final List<ExtraRule> extraRules;

    private NamingOptions(NamingProperties properties) {
        this.videoFileExtensions = normalizeExtensions(properties.getVideoFileExtensions());
        this.stubFileExtensions = normalizeExtensions(properties.getStubFileExtensions());
        this.cleanStringPatterns = properties.getCleanStrings().stream()
                .map(regex -> compile("clean-strings", regex))
                .toList();
        this.cleanDateTimePatterns = properties.getCleanDateTimes().stream()
                .map(regex -> compile("clean-date-times", regex))
                .toList();
        this.stackingRules = properties.getStackingRules().stream()
                .map(NamingOptions::toStackRule)
                .toList();
        this.extraRules = properties.getExtraRules().stream()
                .map(NamingOptions::toExtraRule)
                .toList();
    }

    public static NamingOptions from(NamingProperties properties) {
        return new NamingOptions(properties);
    }

    public static NamingOptions defaults() {
        return new NamingOptions(new NamingProperties());
    }

    public boolean isVideoExtension(String extension) {
        return extension != null && videoFileExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    public boolean isStubExtension(String extension) {
        return extension != null && stubFileExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    private static Set<String> normalizeExtensions(List<String> extensions) {
        return extensions.stream()
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static FileStackRule toStackRule(NamingProperties.StackingRule rule) {
        Pattern pattern = compile("stacking-rules", rule.getPattern());
        for (String group : STACK_RULE_GROUPS) {
            if (!pattern.pattern().contains("(?<" + group + ">")) {
                throw ApiError.INVALID_NAMING_OPTION.createException("stacking-rules",
                        "pattern must declare the named group '" + group + "': " + rule.getPattern());
            }
        }
        return new FileStackRule(pattern, rule.isNumerical());
    }

    private static ExtraRule toExtraRule(NamingProperties.ExtraRuleProperties rule) {
        if (rule.getType() == null || rule.getRuleType() == null || rule.getToken() == null) {
            throw ApiError.INVALID_NAMING_OPTION.createException("extra-rules", "type, rule-type and token are required");
        }
        Pattern pattern = rule.getRuleType() == ExtraRuleType.REGEX ? compile("extra-rules", rule.getToken()) : null;
        return new ExtraRule(rule.getType(), rule.getRuleType(), rule.getToken(), pattern);
    }

    private static Pattern compile(String option, String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw ApiError.INVALID_NAMING_OPTION.createException(option, e.getMessage());
        }
    }
}
