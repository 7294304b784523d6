package org.mediascan.service.naming;

import org.mediascan.model.dto.FileStack;
import org.mediascan.model.dto.FileSystemMetadata;
import org.mediascan.model.dto.settings.FileStackRule;
import org.mediascan.model.dto.settings.NamingOptions;
import org.mediascan.util.AlphanumericComparator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Detects multi-part titles ({@code cd1/cd2}, {@code part1/part2}, {@code disc a/disc b}) among files
 * or folders of one media item.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StackResolver {

    private final NamingOptions namingOptions;

    public List<FileStack> resolveDirectories(Collection<String> directories) {
        return resolve(directories.stream().map(path -> new FileSystemMetadata(path, true)).toList());
    }

    public List<FileStack> resolveFiles(Collection<String> files) {
        return resolve(files.stream().map(path -> new FileSystemMetadata(path, false)).toList());
    }

    public List<FileStack> resolve(Collection<FileSystemMetadata> files) {
        List<FileSystemMetadata> candidates = files.stream()
                .filter(this::isStackCandidate)
                .sorted(Comparator.comparing(FileSystemMetadata::fullName, AlphanumericComparator.INSTANCE))
                .toList();

        Map<String, PotentialStack> potentialStacks = new LinkedHashMap<>();
        for (FileSystemMetadata file : candidates) {
            String name = FilenameUtils.getName(file.fullName());
            for (FileStackRule rule : namingOptions.getStackingRules()) {
                Optional<FileStackRule.StackPart> match = rule.match(name);
                if (match.isEmpty()) {
                    continue;
                }
                FileStackRule.StackPart part = match.get();
                PotentialStack stack = potentialStacks.computeIfAbsent(part.stackName(),
                        k -> new PotentialStack(file.directory(), rule.isNumerical(), part.partType()));

                if (!stack.parts.isEmpty()) {
                    if (stack.directory != file.directory()
                            || !stack.partType.equalsIgnoreCase(part.partType())
                            || stack.parts.containsKey(part.partNumber().toLowerCase(Locale.ROOT))) {
                        continue;
                    }
                    if (stack.numerical != rule.isNumerical()) {
                        break;
                    }
                }

                stack.parts.put(part.partNumber().toLowerCase(Locale.ROOT), file.fullName());
                break;
            }
        }

        List<FileStack> stacks = new ArrayList<>();
        for (Map.Entry<String, PotentialStack> entry : potentialStacks.entrySet()) {
            PotentialStack stack = entry.getValue();
            if (stack.parts.size() < 2) {
                continue;
            }
            stacks.add(new FileStack(entry.getKey(), stack.directory, new ArrayList<>(stack.parts.values())));
        }
        log.debug("Detected {} stacks among {} candidates", stacks.size(), candidates.size());
        return stacks;
    }

    private boolean isStackCandidate(FileSystemMetadata file) {
        if (file.directory()) {
            return true;
        }
        String extension = FilenameUtils.getExtension(file.fullName());
        return namingOptions.isVideoExtension(extension) || namingOptions.isStubExtension(extension);
    }

    private static class PotentialStack {
        final boolean directory;
        final boolean numerical;
        final String partType;
        final Map<String, String> parts = new LinkedHashMap<>();

        PotentialStack(boolean directory, boolean numerical, String partType) {
            this.directory = directory;
            this.numerical = numerical;
            this.partType = partType;
        }
    }
}
