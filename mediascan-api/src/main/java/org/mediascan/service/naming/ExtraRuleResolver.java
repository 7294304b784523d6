package org.mediascan.service.naming;

import org.mediascan.model.dto.settings.ExtraRule;
import org.mediascan.model.dto.settings.NamingOptions;
import org.mediascan.model.enums.ExtraType;
import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
public class ExtraRuleResolver {

    private static final Pattern TRAILING_DIGITS = Pattern.compile("\\d+$");

    private final NamingOptions namingOptions;

    /**
     * Finds the extra type of a path from the first matching rule.
     *
     * @param libraryRoot files placed directly in this folder are never matched by directory name
     */
    public Optional<ExtraType> resolve(String path, String libraryRoot) {
        if (StringUtils.isEmpty(path)) {
            return Optional.empty();
        }
        String fileName = FilenameUtils.getBaseName(path);
        String directory = FilenameUtils.getFullPathNoEndSeparator(path);
        String directoryName = FilenameUtils.getName(directory);

        for (ExtraRule rule : namingOptions.getExtraRules()) {
            boolean matched = switch (rule.ruleType()) {
                case FILENAME -> fileName.equalsIgnoreCase(rule.token());
                // "-trailer2" is still a trailer
                case SUFFIX -> StringUtils.endsWithIgnoreCase(
                        TRAILING_DIGITS.matcher(fileName).replaceFirst(""), rule.token());
                case REGEX -> rule.pattern().matcher(fileName).find();
                case DIRECTORY_NAME -> directoryName.equalsIgnoreCase(rule.token())
                        && !isLibraryRoot(directory, libraryRoot);
            };
            if (matched) {
                return Optional.of(rule.extraType());
            }
        }
        return Optional.empty();
    }

    private boolean isLibraryRoot(String directory, String libraryRoot) {
        if (StringUtils.isEmpty(libraryRoot)) {
            return false;
        }
        String normalizedRoot = FilenameUtils.normalizeNoEndSeparator(libraryRoot, true);
        String normalizedDirectory = FilenameUtils.normalizeNoEndSeparator(directory, true);
        return normalizedDirectory != null && normalizedDirectory.equalsIgnoreCase(normalizedRoot);
    }
}
