package com.xilinx.rapidwright.rapidflowmap.utils;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

public class StatisticsUtils {
    public static double getMean(Collection<Integer> data) {
        if (data.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Integer d : data) {
            sum += d;
        }
        return sum / data.size();
    }

    public static int getMax(Collection<Integer> data) {
        int max = 0;
        for (Integer d : data) {
            max = Math.max(max, d);
        }
        return max;
    }

    // value -> number of occurrences, ordered by value
    public static Map<Integer, Integer> getHistogram(Collection<Integer> data) {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (Integer d : data) {
            histogram.merge(d, 1, Integer::sum);
        }
        return histogram;
    }

    public static String histogramToString(Map<Integer, Integer> histogram, String keyPrefix) {
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<Integer, Integer> entry : histogram.entrySet()) {
            if (builder.length() > 0) {
                builder.append(" ");
            }
            builder.append(String.format("%s%d=%d", keyPrefix, entry.getKey(), entry.getValue()));
        }
        return builder.toString();
    }
}
