package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Traffic-light bucketing of a merchant's sensors. {@code score} is the green
 * share of all bucketed sensors.
 */
@Value
@Builder
public class SensorHealth {
    List<String> green;
    List<String> amber;
    List<String> red;
    double score;

    public int total() {
        return green.size() + amber.size() + red.size();
    }
}
