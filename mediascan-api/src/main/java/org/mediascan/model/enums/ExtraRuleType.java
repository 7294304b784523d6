package org.mediascan.model.enums;

/**
 * How an {@link org.mediascan.model.dto.settings.ExtraRule} token is compared against a path.
 */
public enum ExtraRuleType {
    /** File name without extension equals the token. */
    FILENAME,
    /** File name without extension, trailing digits removed, ends with the token. */
    SUFFIX,
    /** Name of the containing directory equals the token. */
    DIRECTORY_NAME,
    /** Token is a regular expression matched against the file name. */
    REGEX
}
