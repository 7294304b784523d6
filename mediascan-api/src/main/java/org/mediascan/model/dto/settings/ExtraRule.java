package org.mediascan.model.dto.settings;

import org.mediascan.model.enums.ExtraRuleType;
import org.mediascan.model.enums.ExtraType;

import java.util.regex.Pattern;

/**
 * @param pattern compiled token, only set for {@link ExtraRuleType#REGEX} rules
 */
public record ExtraRule(ExtraType extraType, ExtraRuleType ruleType, String token, Pattern pattern) {
}
