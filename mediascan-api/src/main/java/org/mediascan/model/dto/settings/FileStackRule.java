package org.mediascan.model.dto.settings;

import lombok.Getter;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Getter
public class FileStackRule {

    private final Pattern pattern;
    private final boolean numerical;

    public FileStackRule(Pattern pattern, boolean numerical) {
        this.pattern = pattern;
        this.numerical = numerical;
    }

    public Optional<StackPart> match(String fileName) {
        Matcher matcher = pattern.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new StackPart(
                matcher.group("filename"),
                matcher.group("parttype"),
                matcher.group("number")
        ));
    }

    public record StackPart(String stackName, String partType, String partNumber) {
    }
}
