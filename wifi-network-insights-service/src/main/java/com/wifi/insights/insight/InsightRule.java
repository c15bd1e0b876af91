package com.wifi.insights.insight;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the rule catalog: a firing condition and the candidate it produces.
 *
 * <p>The factory is only invoked after the trigger has matched, so it may rely on every metric
 * the trigger checked being present.
 *
 * @param key stable rule identifier, also the prefix of generated card ids
 * @param trigger firing condition over the rule context
 * @param factory builds the candidate for a fired rule
 */
public record InsightRule(
    String key,
    Predicate<RuleContext> trigger,
    Function<RuleContext, InsightCandidate> factory) {

  public Optional<InsightCandidate> apply(RuleContext context) {
    if (!trigger.test(context)) {
      return Optional.empty();
    }
    return Optional.of(factory.apply(context));
  }
}
