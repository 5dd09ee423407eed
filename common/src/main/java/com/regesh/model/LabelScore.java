package com.regesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A single (label, score) pair as returned by the classifier.
 */
@Value
public class LabelScore {

    String label;
    double score;

    @JsonCreator
    public LabelScore(@JsonProperty("label") String label, @JsonProperty("score") double score) {
        this.label = label;
        this.score = score;
    }
}
