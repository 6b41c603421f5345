package com.herzen.unlock.config;

import com.herzen.unlock.parser.ParserDtos.StrictnessMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "unlock-graph")
public record UnlockGraphProperties(@DefaultValue("LENIENT") StrictnessMode strictness,
                                    @DefaultValue("true") boolean objectiveBridging) {
}
