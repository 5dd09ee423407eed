package com.regesh.inference;

import com.regesh.model.Texts;
import lombok.extern.slf4j.Slf4j;

/**
 * Normalises raw text before it is sent to the classifier.
 *
 * <p>Texts longer than the model's input limit ({@code modelMaxLength - reservedTokens})
 * are cut to that limit.  Truncation is reported as a warning, never as an error.</p>
 */
@Slf4j
public class TextPreprocessor {

    private final int maxLength;

    public TextPreprocessor(int modelMaxLength, int reservedTokens) {
        if (modelMaxLength <= reservedTokens) {
            throw new IllegalArgumentException("modelMaxLength (" + modelMaxLength
                    + ") must exceed reservedTokens (" + reservedTokens + ")");
        }
        this.maxLength = modelMaxLength - reservedTokens;
    }

    /**
     * Coerces {@code text} to a string ({@code null} becomes empty), trims it and truncates
     * it to the model's input limit.
     */
    public String preprocess(Object text) {
        String value = text == null ? "" : String.valueOf(text);
        value = value.strip();

        if (value.length() > maxLength) {
            log.warn("Text truncated from {} to {} characters", value.length(), maxLength);
            value = Texts.truncate(value, maxLength);
        }
        return value;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
