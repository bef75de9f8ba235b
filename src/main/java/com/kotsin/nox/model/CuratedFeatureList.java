package com.kotsin.nox.model;

import lombok.Value;

import java.util.List;

/**
 * Ordered feature names that survived missing-value pruning, plus the names that did not.
 * Data dependent: two runs over different input may curate different lists.
 */
@Value
public class CuratedFeatureList {

    List<String> features;
    List<String> pruned;

    public CuratedFeatureList(List<String> features, List<String> pruned) {
        this.features = List.copyOf(features);
        this.pruned = List.copyOf(pruned);
    }

    public int size() {
        return features.size();
    }

    public boolean contains(String feature) {
        return features.contains(feature);
    }
}
