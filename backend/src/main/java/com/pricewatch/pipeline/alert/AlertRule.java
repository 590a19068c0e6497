package com.pricewatch.pipeline.alert;

import com.pricewatch.pipeline.model.AlertMatch;
import com.pricewatch.pipeline.model.AlertRuleType;
import com.pricewatch.pipeline.model.Snapshot;

import java.util.Optional;

/**
 * One configured condition over consecutive snapshots of the same entity.
 */
public interface AlertRule {

    String ruleId();

    AlertRuleType type();

    /**
     * @param previous the entity's latest snapshot before {@code current}, or null when there is none
     */
    Optional<AlertMatch> evaluate(Snapshot previous, Snapshot current);
}
