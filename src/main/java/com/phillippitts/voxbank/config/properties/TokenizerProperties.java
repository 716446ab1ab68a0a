package com.phillippitts.voxbank.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tokenizer rules: maximum word length, optional number/contraction expansion and the
 * silence inserted for punctuation.
 *
 * <p>Properties:
 * <ul>
 *   <li>vox.tokenizer.max-word-length - longest accepted word (default: 30)</li>
 *   <li>vox.tokenizer.expand-numbers - spell out digit words, e.g. "42" to "forty two" (default: false)</li>
 *   <li>vox.tokenizer.expand-contractions - "don't" to "do not" (default: false)</li>
 *   <li>vox.tokenizer.period-pause-ms / comma-pause-ms / ellipsis-pause-ms / dash-pause-ms</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "vox.tokenizer")
public class TokenizerProperties {

    @Positive(message = "Max word length must be positive")
    @Max(value = 64, message = "Max word length must not exceed 64 (file name safety)")
    private int maxWordLength = 30;

    private boolean expandNumbers = false;

    private boolean expandContractions = false;

    @Min(0)
    private int periodPauseMs = 200;

    @Min(0)
    private int commaPauseMs = 150;

    @Min(0)
    private int ellipsisPauseMs = 250;

    @Min(0)
    private int dashPauseMs = 100;

    public int getMaxWordLength() {
        return maxWordLength;
    }

    public void setMaxWordLength(int maxWordLength) {
        this.maxWordLength = maxWordLength;
    }

    public boolean isExpandNumbers() {
        return expandNumbers;
    }

    public void setExpandNumbers(boolean expandNumbers) {
        this.expandNumbers = expandNumbers;
    }

    public boolean isExpandContractions() {
        return expandContractions;
    }

    public void setExpandContractions(boolean expandContractions) {
        this.expandContractions = expandContractions;
    }

    public int getPeriodPauseMs() {
        return periodPauseMs;
    }

    public void setPeriodPauseMs(int periodPauseMs) {
        this.periodPauseMs = periodPauseMs;
    }

    public int getCommaPauseMs() {
        return commaPauseMs;
    }

    public void setCommaPauseMs(int commaPauseMs) {
        this.commaPauseMs = commaPauseMs;
    }

    public int getEllipsisPauseMs() {
        return ellipsisPauseMs;
    }

    public void setEllipsisPauseMs(int ellipsisPauseMs) {
        this.ellipsisPauseMs = ellipsisPauseMs;
    }

    public int getDashPauseMs() {
        return dashPauseMs;
    }

    public void setDashPauseMs(int dashPauseMs) {
        this.dashPauseMs = dashPauseMs;
    }
}
