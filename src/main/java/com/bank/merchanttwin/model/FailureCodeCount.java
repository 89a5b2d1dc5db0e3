package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

/**
 * How widespread one failure code is across a fleet. {@code count} is the
 * number of merchants exhibiting the code; {@code occurrences} counts every
 * action that reported it.
 */
@Value
@Builder
public class FailureCodeCount {
    String code;
    int count;
    int occurrences;
    int pct;
}
