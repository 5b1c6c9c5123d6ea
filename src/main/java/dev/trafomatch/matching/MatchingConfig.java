package dev.trafomatch.matching;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the matching engine from {@link MatchingProperties}. The engine classes themselves carry no
 * Spring annotations and are plain, reentrant objects.
 */
@Configuration
public class MatchingConfig {

  @Bean
  public AttributePolicy attributePolicy(MatchingProperties properties) {
    return new AttributePolicy(properties.toSpecs());
  }

  @Bean
  public AttributeComparator attributeComparator(MatchingProperties properties) {
    return new AttributeComparator(properties.getAbsentScore());
  }

  @Bean
  public RecordScorer recordScorer(AttributePolicy policy, AttributeComparator comparator) {
    return new RecordScorer(policy, comparator);
  }

  @Bean
  public ConstraintFilter constraintFilter(MatchingProperties properties) {
    return new ConstraintFilter(properties.isAbsentBoundSatisfied());
  }

  @Bean
  public Ranker ranker(
      AttributePolicy policy,
      RecordScorer scorer,
      ConstraintFilter filter,
      MatchingProperties properties) {
    return new Ranker(
        policy, scorer, filter, properties.getBoundOnlyPolicy(), properties.getParallelThreshold());
  }

  @Bean
  public QueryNormalizer queryNormalizer(AttributePolicy policy, MatchingProperties properties) {
    return new QueryNormalizer(policy, properties.getDefaultLimit(), properties.getMaxLimit());
  }
}
