package org.mediascan.config;

import org.mediascan.model.dto.settings.NamingOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class NamingConfig {

    @Bean
    public NamingOptions namingOptions(NamingProperties namingProperties) {
        NamingOptions options = NamingOptions.from(namingProperties);
        log.info("Loaded naming options: {} video extensions, {} stacking rules, {} extra rules",
                options.getVideoFileExtensions().size(), options.getStackingRules().size(), options.getExtraRules().size());
        return options;
    }
}
