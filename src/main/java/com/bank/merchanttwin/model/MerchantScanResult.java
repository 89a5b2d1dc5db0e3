package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MerchantScanResult {
    Merchant merchant;
    MerchantSummary summary;
    List<Failure> failures;
}
