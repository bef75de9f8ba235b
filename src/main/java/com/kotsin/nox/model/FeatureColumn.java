package com.kotsin.nox.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * FeatureColumn - One generated interval statistic column.
 *
 * Named {@code <channel>_<kind>_<seconds>s}, e.g. {@code br1_eo_o2_a_momentum_max_up_300s}.
 */
@Value
public class FeatureColumn {

    String channel;
    StatisticKind kind;
    int windowSeconds;

    public String name() {
        return channel + "_" + kind.getFragment() + "_" + windowSeconds + "s";
    }

    /**
     * Full (channel x window x kind) cross product in column order.
     */
    public static List<FeatureColumn> crossProduct(Collection<String> channels, Collection<Integer> windowsSeconds) {
        List<FeatureColumn> columns = new ArrayList<>(channels.size() * windowsSeconds.size() * StatisticKind.values().length);
        for (String channel : channels) {
            columns.addAll(forChannel(channel, windowsSeconds));
        }
        return columns;
    }

    public static List<FeatureColumn> forChannel(String channel, Collection<Integer> windowsSeconds) {
        List<FeatureColumn> columns = new ArrayList<>(windowsSeconds.size() * StatisticKind.values().length);
        for (int window : windowsSeconds) {
            for (StatisticKind kind : StatisticKind.values()) {
                columns.add(new FeatureColumn(channel, kind, window));
            }
        }
        return columns;
    }

    @Override
    public String toString() {
        return name();
    }
}
