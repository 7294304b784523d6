package org.mediascan.service.naming;

import org.mediascan.model.dto.VideoFileInfo;
import org.mediascan.model.dto.settings.NamingOptions;
import org.mediascan.model.enums.ExtraType;
import org.mediascan.util.CleanDateTimeParser;
import org.mediascan.util.CleanStringParser;
import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Turns a single path into a {@link VideoFileInfo}: container, title, year and extra type.
 */
@Component
@RequiredArgsConstructor
public class VideoResolver {

    private final NamingOptions namingOptions;
    private final ExtraRuleResolver extraRuleResolver;

    public VideoFileInfo resolveDirectory(String path, boolean parseName, String libraryRoot) {
        return resolve(path, true, parseName, libraryRoot);
    }

    public VideoFileInfo resolveFile(String path, boolean parseName, String libraryRoot) {
        return resolve(path, false, parseName, libraryRoot);
    }

    /**
     * @return the resolved file, or {@code null} when the path is empty or a file is neither a video nor a stub
     */
    public VideoFileInfo resolve(String path, boolean isDirectory, boolean parseName, String libraryRoot) {
        if (StringUtils.isEmpty(path)) {
            return null;
        }

        String container = null;
        if (!isDirectory) {
            String extension = FilenameUtils.getExtension(path);
            if (!namingOptions.isVideoExtension(extension) && !namingOptions.isStubExtension(extension)) {
                return null;
            }
            container = extension.toLowerCase(Locale.ROOT);
        }

        ExtraType extraType = extraRuleResolver.resolve(path, libraryRoot).orElse(null);

        String name = isDirectory ? FilenameUtils.getName(path) : FilenameUtils.getBaseName(path);
        Integer year = null;

        if (parseName) {
            CleanDateTimeParser.CleanDateTimeResult dateTimeResult =
                    CleanDateTimeParser.clean(name, namingOptions.getCleanDateTimePatterns());
            name = dateTimeResult.name();
            year = dateTimeResult.year();

            name = CleanStringParser.tryClean(name, namingOptions.getCleanStringPatterns())
                    .map(String::trim)
                    .orElse(name);
        }

        return VideoFileInfo.builder()
                .path(path)
                .directory(isDirectory)
                .container(container)
                .name(name)
                .year(year)
                .extraType(extraType)
                .build();
    }

    public boolean isVideoFile(String path) {
        return namingOptions.isVideoExtension(FilenameUtils.getExtension(path));
    }

    public boolean isStubFile(String path) {
        return namingOptions.isStubExtension(FilenameUtils.getExtension(path));
    }
}
