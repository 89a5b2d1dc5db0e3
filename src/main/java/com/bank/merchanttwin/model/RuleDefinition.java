package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

/**
 * Static metadata of one catalog rule. Demand figures are historical
 * contact-centre call totals; the two paths are for display only.
 */
@Value
@Builder
public class RuleDefinition {
    ActionKey actionKey;
    String label;
    int demandRank;         // 1 = highest call volume
    long demandTotal;
    String menuPath;
    String ussdPath;
    String description;
}
