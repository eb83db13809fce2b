package com.aijudge.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Judge prompt budget and verdict repair settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "aijudge.judge")
public class JudgeProperties {

    private int reasoningMinWords = 300;
    private int reasoningMaxWords = 400;
    private int jsonOverheadTokens = 168;

    /**
     * Ask the judge once to reformat output that could only be read heuristically.
     */
    private boolean repairEnabled = true;
}
